package fk.ntree.iterator;

import fk.ntree.Tree;
import fk.ntree.TreeNode;

/**
 * Visits a node, then each of its child subtrees from left to right. A cursor started on a node never leaves that
 * node's subtree.
 */
public class PreOrderIterator<T> extends TreeIterator<T> {

    private final TreeNode<T> root;

    /**
     * End sentinel.
     */
    public PreOrderIterator() {
        this((TreeNode<T>) null);
    }

    public PreOrderIterator(Tree<T> tree) {
        this(tree.getHead());
    }

    public PreOrderIterator(TreeNode<T> root) {
        super(root);
        this.root = root;
    }

    private PreOrderIterator(TreeNode<T> root, TreeNode<T> current) {
        super(current);
        this.root = root;
    }

    @Override
    TreeNode<T> successor(TreeNode<T> node) {
        if (node.getFirstChild() != null) {
            return node.getFirstChild();
        }

        // climb until an ancestor, still below the root, has a sibling left to visit
        for (TreeNode<T> ancestor = node; ancestor != null && ancestor != root; ancestor = ancestor.getParent()) {
            if (ancestor.getNextSibling() != null) {
                return ancestor.getNextSibling();
            }
        }
        return null;
    }

    @Override
    public PreOrderIterator<T> advance() {
        super.advance();
        return this;
    }

    @Override
    public PreOrderIterator<T> copy() {
        return new PreOrderIterator<>(root, current);
    }
}
