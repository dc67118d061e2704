package fk.ntree.iterator;

import fk.ntree.TreeNode;

/**
 * Walks the sibling chain to the right of a node, the node included. Never moves to a parent or a child.
 */
public class SiblingIterator<T> extends TreeIterator<T> {

    /**
     * End sentinel.
     */
    public SiblingIterator() {
        super(null);
    }

    public SiblingIterator(TreeNode<T> start) {
        super(start);
    }

    @Override
    TreeNode<T> successor(TreeNode<T> node) {
        return node.getNextSibling();
    }

    @Override
    public SiblingIterator<T> advance() {
        super.advance();
        return this;
    }

    @Override
    public SiblingIterator<T> copy() {
        return new SiblingIterator<>(current);
    }
}
