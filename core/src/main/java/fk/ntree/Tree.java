package fk.ntree;

import com.google.common.base.Preconditions;
import fk.ntree.iterator.LeafIterator;
import fk.ntree.iterator.PostOrderIterator;
import fk.ntree.iterator.PreOrderIterator;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * An ordered N-ary tree. The tree owns a single head node, which in turn owns the rest of the nodes, and keeps a
 * running count of all of them.
 * <p>
 * Iteration over the tree itself is in post-order, children before their parent, which is also the order in which
 * nodes are released. Pre-order and leaf ranges are available through {@link #beginPreOrder()} / {@link #endPreOrder()}
 * and {@link #beginLeaf()} / {@link #endLeaf()}, or as {@link Iterable}s.
 * <p>
 * Not thread safe. Callers must not mutate a tree while an iterator is positioned on a node that the mutation removes.
 *
 * @param <T> type of the values held by the nodes
 */
public class Tree<T> implements Iterable<TreeNode<T>>, AutoCloseable {

    private final Consumer<? super T> disposer;

    private TreeNode<T> head;

    private int size;

    private boolean closed;

    public Tree(T headValue) {
        this(headValue, null);
    }

    /**
     * @param headValue value of the head node
     * @param disposer  invoked once for every value whose node is released, either by
     *                  {@link TreeNode#deleteFromTree()} or by {@link #close()}. May be null.
     */
    public Tree(T headValue, Consumer<? super T> disposer) {
        this.disposer = disposer;
        this.head = new TreeNode<>(this, headValue);
        this.size = 1;
    }

    /**
     * Deep copy of the structure of a tree. Values are shared with the source tree, which keeps disposing of them, so
     * the copy has no value disposer.
     */
    public static <T> Tree<T> copyOf(Tree<T> source) {
        return copyOf(source, Function.identity(), null);
    }

    /**
     * Deep copy of the structure of a tree, values are copied with the given function. The copy has the same size and
     * the same pre-order sequence of values as the source, and carries over the source's value disposer since it owns
     * the copied values.
     */
    public static <T> Tree<T> copyOf(Tree<T> source, Function<? super T, ? extends T> valueCopier) {
        return copyOf(source, valueCopier, Preconditions.checkNotNull(source).disposer);
    }

    /**
     * @param disposer disposer of the copy, may be null
     */
    public static <T> Tree<T> copyOf(Tree<T> source, Function<? super T, ? extends T> valueCopier,
                                     Consumer<? super T> disposer) {
        Preconditions.checkNotNull(valueCopier);
        TreeNode<T> sourceHead = Preconditions.checkNotNull(source).getHead();

        Tree<T> copy = new Tree<>(valueCopier.apply(sourceHead.getValue()), disposer);
        Map<TreeNode<T>, TreeNode<T>> copies = new IdentityHashMap<>();
        copies.put(sourceHead, copy.head);

        PreOrderIterator<T> itr = new PreOrderIterator<>(sourceHead);
        for (itr.advance(); itr.isValid(); itr.advance()) {
            TreeNode<T> original = itr.node();
            TreeNode<T> copiedParent = copies.get(original.getParent());
            copies.put(original, copiedParent.appendChild(valueCopier.apply(original.getValue())));
        }
        return copy;
    }

    /**
     * Number of edges between a node and the head of its tree.
     */
    public static int depth(TreeNode<?> node) {
        Preconditions.checkNotNull(node);
        int depth = 0;
        for (TreeNode<?> ancestor = node.getParent(); ancestor != null; ancestor = ancestor.getParent()) {
            ++depth;
        }
        return depth;
    }

    public TreeNode<T> getHead() {
        checkOpen();
        return head;
    }

    /**
     * @return total number of nodes, head included
     */
    public int size() {
        checkOpen();
        return size;
    }

    public boolean isClosed() {
        return closed;
    }

    public PreOrderIterator<T> beginPreOrder() {
        return new PreOrderIterator<>(getHead());
    }

    public PreOrderIterator<T> endPreOrder() {
        return new PreOrderIterator<>();
    }

    public PostOrderIterator<T> begin() {
        return new PostOrderIterator<>(getHead());
    }

    public PostOrderIterator<T> end() {
        return new PostOrderIterator<>();
    }

    public LeafIterator<T> beginLeaf() {
        return new LeafIterator<>(getHead());
    }

    public LeafIterator<T> endLeaf() {
        return new LeafIterator<>();
    }

    /**
     * Post-order iteration over the whole tree.
     */
    @Override
    public Iterator<TreeNode<T>> iterator() {
        return begin();
    }

    @Override
    public Spliterator<TreeNode<T>> spliterator() {
        return Spliterators.spliterator(iterator(), size, Spliterator.ORDERED | Spliterator.NONNULL);
    }

    public Iterable<TreeNode<T>> preOrder() {
        return this::beginPreOrder;
    }

    public Iterable<TreeNode<T>> postOrder() {
        return this::begin;
    }

    public Iterable<TreeNode<T>> leaves() {
        return this::beginLeaf;
    }

    /**
     * @return post-order stream of all the nodes
     */
    public Stream<TreeNode<T>> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    public Stream<TreeNode<T>> preOrderStream() {
        return StreamSupport.stream(
            Spliterators.spliterator(beginPreOrder(), size, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    public Stream<TreeNode<T>> leafStream() {
        return StreamSupport.stream(leaves().spliterator(), false);
    }

    /**
     * Runs the visitor for each node of the tree in pre-order, handing over the position of the node in that order.
     */
    public void foreach(Visitor<T> visitor) {
        Preconditions.checkNotNull(visitor);
        int[] idx = {0};
        new TreeTraverser<T>(node -> visitor.visit(idx[0]++, node)).traverse(getHead());
    }

    /**
     * Releases every node, head included, children before parents. The tree cannot be used afterwards.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }

        List<TreeNode<T>> nodes = new ArrayList<>(size);
        for (PostOrderIterator<T> itr = begin(); itr.isValid(); itr.advance()) {
            nodes.add(itr.node());
        }

        closed = true;
        size = 0;
        head = null;
        release(nodes);
    }

    void nodesAdded(int count) {
        size += count;
    }

    void nodesRemoved(int count) {
        size -= count;
    }

    /**
     * Detaches nodes that have already been unlinked from the structure, then hands their values to the disposer in the
     * given order. A failing disposer does not stop the others, the first failure is rethrown once all have run.
     */
    void release(List<TreeNode<T>> nodes) {
        for (TreeNode<T> node : nodes) {
            node.detach();
        }
        if (disposer == null) {
            return;
        }

        RuntimeException failure = null;
        for (TreeNode<T> node : nodes) {
            try {
                disposer.accept(node.getValue());
            } catch (RuntimeException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    private void checkOpen() {
        Preconditions.checkState(!closed, "tree has been closed");
    }

    /**
     * Callback for {@link #foreach(Visitor)}: (index, node) -> void
     * @param <T> type of the values held by the nodes
     */
    public interface Visitor<T> {
        void visit(int idx, TreeNode<T> node);
    }
}
