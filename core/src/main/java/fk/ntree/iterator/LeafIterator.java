package fk.ntree.iterator;

import fk.ntree.Tree;
import fk.ntree.TreeNode;

/**
 * Visits the nodes without children of a subtree, left to right. A node without children is its own only leaf.
 * <p>
 * Backed by a pre-order walk bounded to the same subtree, which is moved past every node that has children.
 */
public class LeafIterator<T> extends TreeIterator<T> {

    private final PreOrderIterator<T> traversal;

    /**
     * End sentinel.
     */
    public LeafIterator() {
        this((TreeNode<T>) null);
    }

    public LeafIterator(Tree<T> tree) {
        this(tree.getHead());
    }

    public LeafIterator(TreeNode<T> root) {
        super(null);
        this.traversal = new PreOrderIterator<>(root);
        this.current = skipToLeaf();
    }

    private LeafIterator(PreOrderIterator<T> traversal) {
        super(traversal.current);
        this.traversal = traversal;
    }

    @Override
    TreeNode<T> successor(TreeNode<T> node) {
        traversal.advance();
        return skipToLeaf();
    }

    private TreeNode<T> skipToLeaf() {
        while (traversal.isValid() && traversal.node().hasChildren()) {
            traversal.advance();
        }
        return traversal.current;
    }

    @Override
    public LeafIterator<T> advance() {
        super.advance();
        return this;
    }

    @Override
    public LeafIterator<T> copy() {
        return new LeafIterator<>(traversal.copy());
    }
}
