package im.arun.mathreader.navigation;

import im.arun.mathreader.model.SemanticNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Cursor for step-by-step exploration of one tree. Moves only between
 * navigable nodes, so pure grouping nodes are never focused.
 *
 * <p>Not thread-safe: one cursor belongs to one caller.
 */
public class MathNavigator {
    private final SemanticNode root;
    private final Deque<Integer> positionStack = new ArrayDeque<>();
    private SemanticNode current;
    private int siblingIndex;

    public MathNavigator(SemanticNode root) {
        this.root = root;
        this.current = root;
    }

    public SemanticNode getCurrent() {
        return current;
    }

    public SemanticNode getRoot() {
        return root;
    }

    public int getSiblingIndex() {
        return siblingIndex;
    }

    /**
     * Number of {@link #enter()} steps that are still open.
     */
    public int getLevel() {
        return positionStack.size();
    }

    /**
     * Moves to the first navigable child.
     *
     * @return false, with no state change, when there is nothing to enter
     */
    public boolean enter() {
        List<SemanticNode> navigable = current.getNavigableChildren();
        if (navigable.isEmpty()) {
            return false;
        }
        positionStack.push(siblingIndex);
        siblingIndex = 0;
        current = navigable.get(0);
        return true;
    }

    /**
     * Moves back up to the parent node.
     *
     * @return false at the root or when nothing was entered
     */
    public boolean exit() {
        SemanticNode parent = navigableParent(current);
        if (current == root || parent == null || positionStack.isEmpty()) {
            return false;
        }
        current = parent;
        siblingIndex = positionStack.pop();
        return true;
    }

    public boolean next() {
        SemanticNode parent = navigableParent(current);
        if (parent == null || positionStack.isEmpty()) {
            return false;
        }
        List<SemanticNode> siblings = parent.getNavigableChildren();
        if (siblingIndex >= siblings.size() - 1) {
            return false;
        }
        siblingIndex++;
        current = siblings.get(siblingIndex);
        return true;
    }

    public boolean previous() {
        SemanticNode parent = navigableParent(current);
        if (parent == null || positionStack.isEmpty() || siblingIndex <= 0) {
            return false;
        }
        siblingIndex--;
        current = parent.getNavigableChildren().get(siblingIndex);
        return true;
    }

    /**
     * The node whose navigable children list contains {@code node}: the
     * closest ancestor that is not a grouping node, or the cursor root.
     * Sibling lists are recomputed on every move since the tree never changes.
     */
    private SemanticNode navigableParent(SemanticNode node) {
        SemanticNode parent = node.getParent();
        while (parent != null && parent != root && parent.getNodeType().isGrouping()
                && parent.getParent() != null) {
            parent = parent.getParent();
        }
        return parent;
    }

    public void reset() {
        current = root;
        positionStack.clear();
        siblingIndex = 0;
    }

    /**
     * Nodes from the tree root down to the current node, inclusive.
     */
    public List<SemanticNode> getPath() {
        return current.getPathFromRoot();
    }
}
