package ai.rewrite.parse;

import java.util.Optional;

import com.github.javaparser.ast.DataKey;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.observer.ObservableProperty;
import com.github.javaparser.ast.observer.PropagatingAstObserver;

/**
 * Records whether a working tree was edited after it was cloned. Attached to the tree root
 * under {@link #KEY}; nodes added later are observed too.
 * <p>
 * Node data survives {@code Node.clone()}, so a tracker only answers for the root it was
 * attached to.
 */
public final class ChangeTracker extends PropagatingAstObserver {

    public static final DataKey<ChangeTracker> KEY = new DataKey<>() {
    };

    private final Node root;
    private boolean modified;

    private ChangeTracker(Node root) {
        this.root = root;
    }

    public static ChangeTracker attach(Node root) {
        final ChangeTracker tracker = new ChangeTracker(root);
        root.registerForSubtree(tracker);
        root.setData(KEY, tracker);
        return tracker;
    }

    public static Optional<ChangeTracker> of(Node root) {
        if (!root.containsData(KEY)) {
            return Optional.empty();
        }
        final ChangeTracker tracker = root.getData(KEY);
        return tracker.root == root ? Optional.of(tracker) : Optional.empty();
    }

    @Override
    public void concretePropertyChange(Node observedNode, ObservableProperty property, Object oldValue, Object newValue) {
        modified = true;
    }

    @Override
    public void concreteListChange(NodeList<?> observedNode, ListChangeType type, int index, Node nodeAddedOrRemoved) {
        modified = true;
    }

    @Override
    public void concreteListReplacement(NodeList<?> observedNode, int index, Node oldValue, Node newValue) {
        modified = true;
    }

    public boolean isModified() {
        return modified;
    }
}
