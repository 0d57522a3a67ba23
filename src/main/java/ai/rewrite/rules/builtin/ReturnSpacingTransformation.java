package ai.rewrite.rules.builtin;

import com.github.javaparser.JavaToken;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.visitor.ModifierVisitor;
import com.github.javaparser.ast.visitor.Visitable;

import ai.rewrite.rules.Transformation;

/**
 * Normalizes the spacing of {@code return} statements: one space after the keyword, none
 * before the semicolon. The returned expression keeps its own formatting.
 */
public final class ReturnSpacingTransformation implements Transformation {

    public static final String ID = "return-spacing";

    @Override
    public CompilationUnit apply(CompilationUnit unit) {
        unit.accept(new ReturnVisitor(), null);
        return unit;
    }

    static boolean isCanonical(ReturnStmt stmt) {
        final String original = originalText(stmt);
        if (original == null || hasComment(stmt)) {
            return true;
        }
        final String expected = stmt.getExpression()
                .map(e -> {
                    final String expr = originalText(e);
                    return expr == null ? null : "return " + expr + ";";
                })
                .orElse("return;");
        return expected == null || expected.equals(original);
    }

    private static boolean hasComment(Node node) {
        for (JavaToken t : node.getTokenRange().get()) {
            if (t.getCategory().isComment()) {
                return true;
            }
        }
        return false;
    }

    private static String originalText(Node node) {
        return node.getTokenRange().map(Object::toString).orElse(null);
    }

    private static final class ReturnVisitor extends ModifierVisitor<Void> {

        @Override
        public Visitable visit(ReturnStmt n, Void arg) {
            super.visit(n, arg);
            if (isCanonical(n)) {
                return n;
            }
            // the expression node moves over as-is, so its original text is printed unchanged
            return new ReturnStmt(n.getExpression().orElse(null));
        }
    }
}
