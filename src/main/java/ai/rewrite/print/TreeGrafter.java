package ai.rewrite.print;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.DataKey;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.metamodel.PropertyMetaModel;

/**
 * Makes a lexically tracked tree structurally equal to another tree by replacing only the
 * subtrees that differ. Everything that already matches keeps its original tokens.
 * <p>
 * Properties are walked through the JavaParser metamodel. A node whose own attributes differ
 * (operator, identifier, literal value) or whose optional children appear or vanish is
 * replaced as a whole; lists are aligned on their common head and tail.
 */
final class TreeGrafter {

    private TreeGrafter() {
    }

    static void graft(CompilationUnit target, CompilationUnit source) {
        if (!alignProperties(target, source)) {
            throw new IllegalStateException("Compilation units cannot be aligned");
        }
    }

    private static void align(Node target, Node source) {
        if (target.equals(source)) {
            return;
        }
        if (target.getClass() != source.getClass() || !alignProperties(target, source)) {
            if (!target.replace(detachedCopy(source))) {
                throw new IllegalStateException("Cannot replace " + target.getClass().getSimpleName());
            }
        }
    }

    @SuppressWarnings("unchecked")
    private static boolean alignProperties(Node target, Node source) {
        final List<PropertyMetaModel> properties = target.getMetaModel().getAllPropertyMetaModels();
        for (PropertyMetaModel property : properties) {
            final Object t = property.getValue(target);
            final Object s = property.getValue(source);
            if (property.isNodeList() || property.isNode()) {
                if ((t == null) != (s == null)) {
                    return false;
                }
            } else if (!Objects.equals(t, s)) {
                return false;
            }
        }
        for (PropertyMetaModel property : properties) {
            final Object t = property.getValue(target);
            if (t == null) {
                continue;
            }
            final Object s = property.getValue(source);
            if (property.isNodeList()) {
                alignList((NodeList<Node>) t, (NodeList<Node>) s);
            } else if (property.isNode()) {
                align((Node) t, (Node) s);
            }
        }
        return true;
    }

    private static void alignList(NodeList<Node> target, NodeList<Node> source) {
        final int targetSize = target.size();
        final int sourceSize = source.size();

        int head = 0;
        while (head < targetSize && head < sourceSize && target.get(head).equals(source.get(head))) {
            head++;
        }
        int tail = 0;
        while (tail < targetSize - head && tail < sourceSize - head
                && target.get(targetSize - 1 - tail).equals(source.get(sourceSize - 1 - tail))) {
            tail++;
        }

        final int targetMiddle = targetSize - head - tail;
        final int sourceMiddle = sourceSize - head - tail;
        final int paired = Math.min(targetMiddle, sourceMiddle);
        for (int i = 0; i < paired; i++) {
            align(target.get(head + i), source.get(head + i));
        }
        for (int i = paired; i < targetMiddle; i++) {
            target.remove(head + paired);
        }
        for (int i = paired; i < sourceMiddle; i++) {
            target.add(head + i, detachedCopy(source.get(head + i)));
        }
    }

    /**
     * Copy without the node data {@code clone()} carries over (formatting, tracking), so the
     * copy is printed from its own structure.
     */
    private static Node detachedCopy(Node node) {
        final Node copy = node.clone();
        copy.walk(n -> {
            for (DataKey<?> key : new ArrayList<>(n.getDataKeys())) {
                n.removeData(key);
            }
        });
        return copy;
    }
}
