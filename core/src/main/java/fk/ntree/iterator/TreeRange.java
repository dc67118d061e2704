package fk.ntree.iterator;

import com.google.common.base.Preconditions;
import fk.ntree.TreeNode;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Half-open range [begin, end) of tree cursors, usable wherever an {@link Iterable} is expected. Every call to
 * {@link #iterator()} walks the range from the start again; the cursors handed over are never moved.
 * <p>
 * For example, the leaves below a given node:
 * <pre>
 *     TreeRange.of(new LeafIterator&lt;&gt;(node), new LeafIterator&lt;&gt;()).stream().count();
 * </pre>
 */
public final class TreeRange<T> implements Iterable<TreeNode<T>> {

    private final TreeIterator<T> begin;
    private final TreeIterator<T> end;

    private TreeRange(TreeIterator<T> begin, TreeIterator<T> end) {
        this.begin = begin;
        this.end = end;
    }

    public static <T> TreeRange<T> of(TreeIterator<T> begin, TreeIterator<T> end) {
        Preconditions.checkNotNull(begin);
        Preconditions.checkNotNull(end);
        Preconditions.checkArgument(begin.getClass() == end.getClass(),
            "range bounds must be of the same kind, got %s and %s", begin.getClass().getSimpleName(), end.getClass().getSimpleName());
        return new TreeRange<>(begin.copy(), end.copy());
    }

    @Override
    public Iterator<TreeNode<T>> iterator() {
        final TreeIterator<T> cursor = begin.copy();
        return new Iterator<TreeNode<T>>() {
            @Override
            public boolean hasNext() {
                return cursor.isValid() && !cursor.equals(end);
            }

            @Override
            public TreeNode<T> next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return cursor.next();
            }
        };
    }

    public Stream<TreeNode<T>> stream() {
        return StreamSupport.stream(spliterator(), false);
    }
}
