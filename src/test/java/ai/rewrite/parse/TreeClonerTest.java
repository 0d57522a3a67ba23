package ai.rewrite.parse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;

import ai.rewrite.model.Outcome;

class TreeClonerTest {

    private static final String SOURCE = "class A {\n"
            + "    void f() { g(); }\n"
            + "    void g() {}\n"
            + "}\n";

    private final SourceParser parser = new SourceParser();
    private final TreeCloner cloner = new TreeCloner(parser);

    @Test
    void cloneIsStructurallyEqualButDistinct() {
        final ParsedSource ps = SourceParserTest.success(parser.parse(SOURCE));

        final CompilationUnit working = working(ps);

        assertNotSame(ps.reference(), working);
        assertEquals(ps.reference(), working);
        assertFalse(ps.tokens().isPairedWith(working));
    }

    @Test
    void mutatingCloneLeavesReferenceAndTokensAlone() {
        final ParsedSource ps = SourceParserTest.success(parser.parse(SOURCE));
        final CompilationUnit working = working(ps);

        working.findFirst(ClassOrInterfaceDeclaration.class).orElseThrow().setName("B");
        working.findFirst(MethodDeclaration.class).orElseThrow().remove();

        assertEquals("A", ps.reference().findFirst(ClassOrInterfaceDeclaration.class).orElseThrow().getNameAsString());
        assertEquals(2, ps.reference().findAll(MethodDeclaration.class).size());
        assertEquals(SOURCE, ps.tokens().text());
    }

    @Test
    void cloneTracksEdits() {
        final ParsedSource ps = SourceParserTest.success(parser.parse(SOURCE));
        final CompilationUnit working = working(ps);
        final ChangeTracker tracker = ChangeTracker.of(working).orElseThrow();

        assertFalse(tracker.isModified());
        working.findFirst(MethodDeclaration.class).orElseThrow().setName("h");
        assertTrue(tracker.isModified());
    }

    @Test
    void everyCloneIsIndependent() {
        final ParsedSource ps = SourceParserTest.success(parser.parse(SOURCE));
        final CompilationUnit first = working(ps);
        final CompilationUnit second = working(ps);

        first.findFirst(ClassOrInterfaceDeclaration.class).orElseThrow().setName("B");

        assertEquals("A", second.findFirst(ClassOrInterfaceDeclaration.class).orElseThrow().getNameAsString());
        assertFalse(ChangeTracker.of(second).orElseThrow().isModified());
    }

    private CompilationUnit working(ParsedSource ps) {
        final Outcome.Success<CompilationUnit> ok = assertInstanceOf(Outcome.Success.class, cloner.cloneTree(ps));
        return ok.value();
    }
}
