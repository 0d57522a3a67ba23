package ai.rewrite.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.CompilationUnit;

import ai.rewrite.model.Outcome;
import ai.rewrite.model.RewriteError;
import ai.rewrite.rules.Rule;
import ai.rewrite.rules.RuleRegistry;

class RuleApplierTest {

    private final RuleRegistry registry = RuleRegistry.builder()
            .register("same", unit -> unit)
            .register("recurse", RuleApplierTest::recurse)
            .register("bare", unit -> {
                throw new UnsupportedOperationException();
            })
            .register("assert", unit -> {
                throw new AssertionError("bad invariant");
            })
            .register("jvm", unit -> {
                throw new InternalError("jvm broke");
            })
            .build();

    private final RuleApplier applier = new RuleApplier(registry);

    @Test
    void returnsTransformedTree() {
        final CompilationUnit unit = StaticJavaParser.parse("class A {}");

        final Outcome.Success<CompilationUnit> ok = assertInstanceOf(Outcome.Success.class,
                applier.apply(new Rule("same", "d", "same"), unit));

        assertSame(unit, ok.value());
    }

    @Test
    void stackOverflowBecomesTransformError() {
        final Outcome<CompilationUnit> res = applier.apply(new Rule("recurse", "d", "recurse"),
                StaticJavaParser.parse("class A {}"));

        final Outcome.Failure<CompilationUnit> failure = assertInstanceOf(Outcome.Failure.class, res);
        assertEquals(RewriteError.Stage.TRANSFORM, failure.error().stage());
    }

    @Test
    void exceptionWithoutMessageIsNamed() {
        final Outcome<CompilationUnit> res = applier.apply(new Rule("bare", "d", "bare"),
                StaticJavaParser.parse("class A {}"));

        final Outcome.Failure<CompilationUnit> failure = assertInstanceOf(Outcome.Failure.class, res);
        assertEquals("UnsupportedOperationException", failure.error().message());
    }

    @Test
    void errorsBecomeTransformErrors() {
        final Outcome<CompilationUnit> res = applier.apply(new Rule("assert", "d", "assert"),
                StaticJavaParser.parse("class A {}"));

        final Outcome.Failure<CompilationUnit> failure = assertInstanceOf(Outcome.Failure.class, res);
        assertEquals(RewriteError.Stage.TRANSFORM, failure.error().stage());
        assertEquals("bad invariant", failure.error().message());
    }

    @Test
    void virtualMachineErrorsPropagate() {
        assertThrows(InternalError.class, () -> applier.apply(new Rule("jvm", "d", "jvm"),
                StaticJavaParser.parse("class A {}")));
    }

    private static CompilationUnit recurse(CompilationUnit unit) {
        return recurse(unit);
    }
}
