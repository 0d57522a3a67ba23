package ai.rewrite.rules.builtin;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.visitor.ModifierVisitor;
import com.github.javaparser.ast.visitor.Visitable;

import ai.rewrite.rules.Transformation;

/**
 * {@code new ArrayList<String>()} -> {@code new ArrayList<>()}.
 * Anonymous class bodies keep their explicit arguments.
 */
public final class DiamondOperatorTransformation implements Transformation {

    public static final String ID = "diamond-operator";

    @Override
    public CompilationUnit apply(CompilationUnit unit) {
        unit.accept(new DiamondVisitor(), null);
        return unit;
    }

    private static final class DiamondVisitor extends ModifierVisitor<Void> {

        @Override
        public Visitable visit(ObjectCreationExpr n, Void arg) {
            super.visit(n, arg);
            if (n.getAnonymousClassBody().isPresent()) {
                return n;
            }
            final var type = n.getType();
            final var args = type.getTypeArguments().orElse(null);
            if (args == null || args.isEmpty()) {
                return n;
            }
            type.setTypeArguments(new NodeList<>());
            return n;
        }
    }
}
