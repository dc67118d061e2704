package fk.ntree.iterator;

import com.google.common.base.Preconditions;
import fk.ntree.TreeNode;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Cursor over the nodes of a tree. A cursor is either positioned on a node or exhausted, in which case it is the
 * end sentinel of its range and carries no node.
 * <p>
 * {@link #advance()} moves the cursor and returns it, {@link #next()} returns the current node and then moves, as
 * required by {@link Iterator}. Two cursors of the same kind are equal when they are positioned on the same node, or
 * when both are exhausted, so a half-open range can be walked with {@code for (itr = begin; !itr.equals(end); ...)}.
 * <p>
 * Cursors read the links of the nodes as they move. They are invalidated by removing the node they sit on.
 *
 * @param <T> type of the values held by the nodes
 */
public abstract class TreeIterator<T> implements Iterator<TreeNode<T>> {

    TreeNode<T> current;

    TreeIterator(TreeNode<T> current) {
        this.current = current;
    }

    /**
     * Node following the given one in this traversal order, or null when the traversal is over.
     */
    abstract TreeNode<T> successor(TreeNode<T> node);

    /**
     * @return an independent cursor positioned on the same node
     */
    public abstract TreeIterator<T> copy();

    public boolean isValid() {
        return current != null;
    }

    @Override
    public boolean hasNext() {
        return isValid();
    }

    /**
     * @throws IllegalStateException if the cursor is exhausted
     */
    public TreeNode<T> node() {
        Preconditions.checkState(current != null, "cannot dereference an exhausted iterator");
        return current;
    }

    /**
     * @throws IllegalStateException if the cursor is exhausted
     */
    public T value() {
        return node().getValue();
    }

    /**
     * Moves to the next node. Advancing an exhausted cursor leaves it exhausted.
     * @return this cursor
     */
    public TreeIterator<T> advance() {
        if (current != null) {
            current = successor(current);
        }
        return this;
    }

    @Override
    public TreeNode<T> next() {
        if (current == null) {
            throw new NoSuchElementException();
        }
        TreeNode<T> result = current;
        current = successor(current);
        return result;
    }

    static <T> TreeNode<T> leftmostLeaf(TreeNode<T> node) {
        TreeNode<T> leaf = node;
        while (leaf.getFirstChild() != null) {
            leaf = leaf.getFirstChild();
        }
        return leaf;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        TreeIterator<?> that = (TreeIterator<?>) o;
        return current == that.current;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(current);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + (current == null ? "end" : current.toString()) + "}";
    }
}
