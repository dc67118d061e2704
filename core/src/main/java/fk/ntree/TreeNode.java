package fk.ntree;

import com.google.common.base.Preconditions;
import fk.ntree.iterator.PostOrderIterator;
import fk.ntree.iterator.PreOrderIterator;
import fk.ntree.iterator.SiblingIterator;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * A vertex of a {@link Tree}. A node owns its children, which are kept in a doubly linked sibling list, and holds
 * non owning references to its parent and siblings.
 * <p>
 * Nodes are only ever created through {@link #appendChild(Object)} / {@link #prependChild(Object)} on a node that is
 * already part of a tree, and stop being part of it once {@link #deleteFromTree()} has been called on them or on one of
 * their ancestors.
 */
public class TreeNode<T> {

    private T value;

    private Tree<T> tree;

    private TreeNode<T> parent;
    private TreeNode<T> firstChild;
    private TreeNode<T> lastChild;
    private TreeNode<T> previousSibling;
    private TreeNode<T> nextSibling;

    private int childCount;

    TreeNode(Tree<T> tree, T value) {
        this.tree = tree;
        this.value = value;
    }

    /**
     * Adds a new child after the current last child.
     * @param childValue value to be held by the new child
     * @return the newly created child, so that insertions can be chained
     */
    public TreeNode<T> appendChild(T childValue) {
        Tree<T> owner = attachedTree();
        TreeNode<T> child = new TreeNode<>(owner, childValue);
        child.parent = this;

        if (lastChild == null) {
            firstChild = child;
        } else {
            child.previousSibling = lastChild;
            lastChild.nextSibling = child;
        }
        lastChild = child;

        ++childCount;
        owner.nodesAdded(1);
        return child;
    }

    /**
     * Adds a new child before the current first child.
     * @param childValue value to be held by the new child
     * @return the newly created child, so that insertions can be chained
     */
    public TreeNode<T> prependChild(T childValue) {
        Tree<T> owner = attachedTree();
        TreeNode<T> child = new TreeNode<>(owner, childValue);
        child.parent = this;

        if (firstChild == null) {
            lastChild = child;
        } else {
            child.nextSibling = firstChild;
            firstChild.previousSibling = child;
        }
        firstChild = child;

        ++childCount;
        owner.nodesAdded(1);
        return child;
    }

    /**
     * Removes this node, along with its entire subtree, from the tree. The siblings on either side are linked to each
     * other and the parent's first/last child are moved to the new boundary siblings where needed.
     * <p>
     * All link updates are done before any node is released. Released nodes are detached from the tree and the
     * tree's value disposer, if any, sees each removed value exactly once, children before parents. Should the disposer
     * throw, the subtree is still fully removed and the first failure is rethrown.
     *
     * @throws IllegalStateException if this is the head of the tree or it was already removed
     */
    public void deleteFromTree() {
        Tree<T> owner = attachedTree();
        Preconditions.checkState(parent != null, "the head of a tree cannot be deleted");

        // post-order, so that children are released before their parents
        List<TreeNode<T>> removed = new ArrayList<>();
        for (PostOrderIterator<T> itr = new PostOrderIterator<>(this); itr.isValid(); itr.advance()) {
            removed.add(itr.node());
        }

        if (previousSibling == null && nextSibling == null) {
            parent.firstChild = null;
            parent.lastChild = null;
        } else if (previousSibling == null) {
            parent.firstChild = nextSibling;
            nextSibling.previousSibling = null;
        } else if (nextSibling == null) {
            parent.lastChild = previousSibling;
            previousSibling.nextSibling = null;
        } else {
            previousSibling.nextSibling = nextSibling;
            nextSibling.previousSibling = previousSibling;
        }
        --parent.childCount;

        owner.nodesRemoved(removed.size());
        owner.release(removed);
    }

    /**
     * Reorders the direct children of this node. Grandchildren keep their own order. The sort is stable.
     * @param comparator comparison on the children's values
     */
    public void sortChildren(Comparator<? super T> comparator) {
        Preconditions.checkNotNull(comparator);
        if (childCount < 2) {
            return;
        }

        List<TreeNode<T>> children = new ArrayList<>(childCount);
        for (TreeNode<T> child = firstChild; child != null; child = child.nextSibling) {
            children.add(child);
        }
        children.sort(comparingValues(comparator));

        TreeNode<T> previous = null;
        for (TreeNode<T> child : children) {
            child.previousSibling = previous;
            if (previous != null) {
                previous.nextSibling = child;
            }
            previous = child;
        }
        previous.nextSibling = null;

        firstChild = children.get(0);
        lastChild = previous;
    }

    /**
     * Orders nodes by their values, whichever tree they belong to.
     */
    public static <T> Comparator<TreeNode<T>> comparingValues(Comparator<? super T> comparator) {
        Preconditions.checkNotNull(comparator);
        return (lhs, rhs) -> comparator.compare(lhs.value, rhs.value);
    }

    /**
     * @return number of nodes in the subtree below this node, this node excluded
     */
    public int countAllDescendants() {
        int count = 0;
        for (PreOrderIterator<T> itr = new PreOrderIterator<>(this); itr.isValid(); itr.advance()) {
            ++count;
        }
        return count - 1;
    }

    /**
     * @return the direct children of this node, first to last
     */
    public Iterable<TreeNode<T>> children() {
        return () -> new SiblingIterator<>(firstChild);
    }

    public T getValue() {
        return value;
    }

    public void setValue(T value) {
        this.value = value;
    }

    public TreeNode<T> getParent() {
        return parent;
    }

    public TreeNode<T> getFirstChild() {
        return firstChild;
    }

    public TreeNode<T> getLastChild() {
        return lastChild;
    }

    public TreeNode<T> getPreviousSibling() {
        return previousSibling;
    }

    public TreeNode<T> getNextSibling() {
        return nextSibling;
    }

    public int getChildCount() {
        return childCount;
    }

    public boolean hasChildren() {
        return firstChild != null;
    }

    /**
     * @return true while this node is still part of an open tree
     */
    public boolean isAttached() {
        return tree != null;
    }

    /**
     * Cuts every link of this node. Called by the owning tree once the node is no longer reachable.
     */
    void detach() {
        tree = null;
        parent = null;
        firstChild = null;
        lastChild = null;
        previousSibling = null;
        nextSibling = null;
        childCount = 0;
    }

    private Tree<T> attachedTree() {
        Preconditions.checkState(tree != null, "node is not part of a tree anymore");
        return tree;
    }

    @Override
    public String toString() {
        return "TreeNode{value=" + value + ", childCount=" + childCount + "}";
    }
}
