package fk.ntree;

import com.google.common.base.Preconditions;
import fk.ntree.iterator.PreOrderIterator;

import java.util.function.Consumer;

/**
 * Hands every node of a subtree, in pre-order, to a consumer.
 */
public class TreeTraverser<T> {

    private final Consumer<TreeNode<T>> consumer;

    public TreeTraverser(Consumer<TreeNode<T>> consumer) {
        this.consumer = Preconditions.checkNotNull(consumer);
    }

    /**
     * node must not be null and must still be part of its tree.
     * @param node root of the subtree to walk
     */
    public void traverse(TreeNode<T> node) {
        Preconditions.checkNotNull(node);
        for (PreOrderIterator<T> itr = new PreOrderIterator<>(node); itr.isValid(); itr.advance()) {
            consumer.accept(itr.node());
        }
    }
}
