package fk.ntree.iterator;

import fk.ntree.Tree;
import fk.ntree.TreeNode;

/**
 * Visits every child subtree, left to right, before the node itself. This is the default order of a {@link Tree},
 * and the order in which nodes can be released. A cursor started on a node begins at that node's deepest leftmost
 * descendant and ends right after the node itself.
 */
public class PostOrderIterator<T> extends TreeIterator<T> {

    private final TreeNode<T> root;

    /**
     * End sentinel.
     */
    public PostOrderIterator() {
        this((TreeNode<T>) null);
    }

    public PostOrderIterator(Tree<T> tree) {
        this(tree.getHead());
    }

    public PostOrderIterator(TreeNode<T> root) {
        super(root == null ? null : leftmostLeaf(root));
        this.root = root;
    }

    private PostOrderIterator(TreeNode<T> root, TreeNode<T> current) {
        super(current);
        this.root = root;
    }

    @Override
    TreeNode<T> successor(TreeNode<T> node) {
        if (node == root) {
            return null;
        }
        if (node.getNextSibling() != null) {
            return leftmostLeaf(node.getNextSibling());
        }
        return node.getParent();
    }

    @Override
    public PostOrderIterator<T> advance() {
        super.advance();
        return this;
    }

    @Override
    public PostOrderIterator<T> copy() {
        return new PostOrderIterator<>(root, current);
    }
}
