package fk.ntree;

import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static fk.ntree.TestTrees.find;
import static fk.ntree.TestTrees.values;

public class TreeTest {

    @Test
    public void testSize() {
        Tree<String> tree = TestTrees.sampleTree();

        Assert.assertEquals(9, tree.size());
        Assert.assertEquals(tree.size(), values(tree).size());
        Assert.assertEquals(tree.size(), values(tree.preOrder()).size());
        Assert.assertEquals(tree.size(), tree.stream().count());
    }

    @Test
    public void testDepth() {
        Tree<String> tree = TestTrees.sampleTree();

        Assert.assertEquals(0, Tree.depth(tree.getHead()));
        Assert.assertEquals(1, Tree.depth(find(tree, "B")));
        Assert.assertEquals(2, Tree.depth(find(tree, "D")));
        Assert.assertEquals(3, Tree.depth(find(tree, "E")));
        Assert.assertEquals(3, Tree.depth(find(tree, "H")));
    }

    @Test
    public void testDefaultIterationIsPostOrder() {
        Tree<String> tree = TestTrees.sampleTree();

        Assert.assertEquals(Arrays.asList("A", "C", "E", "D", "B", "H", "I", "G", "F"), values(tree));
        Assert.assertEquals(values(tree), values(tree.postOrder()));
        Assert.assertEquals(Arrays.asList("F", "B", "A", "D", "C", "E", "G", "I", "H"), values(tree.preOrder()));
        Assert.assertEquals(Arrays.asList("A", "C", "E", "H"), values(tree.leaves()));
    }

    @Test
    public void testStreams() {
        Tree<String> tree = TestTrees.sampleTree();

        Assert.assertEquals(1, tree.stream().filter(node -> "A".equals(node.getValue())).count());
        Assert.assertEquals("ACEDBHIGF", tree.stream().map(TreeNode::getValue).collect(Collectors.joining()));
        Assert.assertEquals("FBADCEGIH", tree.preOrderStream().map(TreeNode::getValue).collect(Collectors.joining()));
        Assert.assertEquals(Arrays.asList("a", "c", "e", "h"),
            tree.leafStream().map(node -> node.getValue().toLowerCase()).collect(Collectors.toList()));
    }

    @Test
    public void testForeachVisitsInPreOrder() {
        Tree<String> tree = TestTrees.sampleTree();
        List<String> visited = new ArrayList<>();
        List<Integer> indexes = new ArrayList<>();

        tree.foreach((idx, node) -> {
            indexes.add(idx);
            visited.add(node.getValue());
        });

        Assert.assertEquals(Arrays.asList("F", "B", "A", "D", "C", "E", "G", "I", "H"), visited);
        Assert.assertEquals(Arrays.asList(0, 1, 2, 3, 4, 5, 6, 7, 8), indexes);
    }

    @Test
    public void testCopy() {
        Tree<String> tree = TestTrees.sampleTree();
        Tree<String> copy = Tree.copyOf(tree);

        Assert.assertEquals(tree.size(), copy.size());
        Assert.assertEquals(values(tree.preOrder()), values(copy.preOrder()));
        Assert.assertEquals(values(tree), values(copy));

        Map<TreeNode<String>, Boolean> originals = new IdentityHashMap<>();
        for (TreeNode<String> node : tree) {
            originals.put(node, Boolean.TRUE);
        }
        for (TreeNode<String> node : copy) {
            Assert.assertFalse(originals.containsKey(node));
        }
    }

    @Test
    public void testCopyIsIndependent() {
        Tree<String> tree = TestTrees.sampleTree();
        Tree<String> copy = Tree.copyOf(tree);

        find(copy, "B").deleteFromTree();
        copy.getHead().appendChild("X");

        Assert.assertEquals(9, tree.size());
        Assert.assertEquals(5, copy.size());
        Assert.assertEquals(Arrays.asList("F", "B", "A", "D", "C", "E", "G", "I", "H"), values(tree.preOrder()));
        Assert.assertEquals(Arrays.asList("F", "G", "I", "H", "X"), values(copy.preOrder()));
    }

    @Test
    public void testCopyWithValueCopier() {
        Tree<StringBuilder> tree = new Tree<>(new StringBuilder("root"));
        tree.getHead().appendChild(new StringBuilder("child"));

        Tree<StringBuilder> copy = Tree.copyOf(tree, sb -> new StringBuilder(sb));
        copy.getHead().getFirstChild().getValue().append("-copy");

        Assert.assertEquals("child", tree.getHead().getFirstChild().getValue().toString());
        Assert.assertEquals("child-copy", copy.getHead().getFirstChild().getValue().toString());
        Assert.assertNotSame(tree.getHead().getValue(), copy.getHead().getValue());
    }

    @Test
    public void testCopySharingValuesDisposesEachValueOnce() {
        Map<String, Integer> disposals = new IdentityHashMap<>();
        Tree<String> tree = new Tree<>(new String("F"), value -> disposals.merge(value, 1, Integer::sum));
        tree.getHead().appendChild(new String("B"));

        Tree<String> copy = Tree.copyOf(tree);
        copy.close();
        tree.close();

        Assert.assertEquals(2, disposals.size());
        for (Integer count : disposals.values()) {
            Assert.assertEquals(1, count.intValue());
        }
    }

    @Test
    public void testCopyWithValueCopierOwnsItsValues() {
        List<String> disposed = new ArrayList<>();
        Tree<String> tree = new Tree<>("F", disposed::add);
        tree.getHead().appendChild("B");

        Tree<String> copy = Tree.copyOf(tree, value -> value + "'");
        copy.close();
        Assert.assertEquals(Arrays.asList("B'", "F'"), disposed);

        Tree<String> unowned = Tree.copyOf(tree, value -> value, null);
        unowned.close();
        Assert.assertEquals(2, disposed.size());

        tree.close();
        Assert.assertEquals(Arrays.asList("B'", "F'", "B", "F"), disposed);
    }

    @Test
    public void testCopyOfSingleNodeTree() {
        Tree<Integer> copy = Tree.copyOf(new Tree<>(42));

        Assert.assertEquals(1, copy.size());
        Assert.assertEquals(Integer.valueOf(42), copy.getHead().getValue());
        Assert.assertFalse(copy.getHead().hasChildren());
    }

    @Test
    public void testCloseDisposesEveryValueOnce() {
        AtomicInteger constructed = new AtomicInteger();
        AtomicInteger destroyed = new AtomicInteger();

        Tree<Counted> tree = new Tree<>(new Counted("F", constructed), counted -> destroyed.incrementAndGet());
        TreeNode<Counted> head = tree.getHead();
        head.appendChild(new Counted("B", constructed)).appendChild(new Counted("A", constructed));
        head.getFirstChild().appendChild(new Counted("D", constructed)).appendChild(new Counted("C", constructed));
        head.getFirstChild().getLastChild().appendChild(new Counted("E", constructed));
        head.appendChild(new Counted("G", constructed)).appendChild(new Counted("I", constructed))
            .appendChild(new Counted("H", constructed));

        Assert.assertEquals(constructed.get(), tree.size());
        Assert.assertEquals(0, destroyed.get());

        tree.close();

        Assert.assertEquals(constructed.get(), destroyed.get());
        Assert.assertTrue(tree.isClosed());
        Assert.assertFalse(head.isAttached());

        // closing again is a no-op
        tree.close();
        Assert.assertEquals(constructed.get(), destroyed.get());
    }

    @Test
    public void testCloseInPostOrder() {
        List<String> disposed = new ArrayList<>();
        Tree<String> tree = new Tree<>("F", disposed::add);
        TestTrees.populate(tree);

        tree.close();

        Assert.assertEquals(Arrays.asList("A", "C", "E", "D", "B", "H", "I", "G", "F"), disposed);
    }

    @Test(expected = IllegalStateException.class)
    public void testClosedTreeRejectsAccess() {
        Tree<String> tree = TestTrees.sampleTree();
        tree.close();
        tree.getHead();
    }

    @Test(expected = IllegalStateException.class)
    public void testClosedTreeRejectsInsertion() {
        Tree<String> tree = TestTrees.sampleTree();
        TreeNode<String> head = tree.getHead();
        tree.close();
        head.appendChild("X");
    }

    @Test
    public void testNullValues() {
        Tree<String> tree = new Tree<>(null);
        tree.getHead().appendChild(null);

        Assert.assertEquals(2, tree.size());
        Assert.assertEquals(Arrays.asList(null, null), values(tree));
    }

    private static class Counted {
        private final String label;

        Counted(String label, AtomicInteger constructed) {
            this.label = label;
            constructed.incrementAndGet();
        }

        @Override
        public String toString() {
            return label;
        }
    }
}
