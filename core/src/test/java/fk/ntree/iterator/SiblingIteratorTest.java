package fk.ntree.iterator;

import fk.ntree.TestTrees;
import fk.ntree.Tree;
import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static fk.ntree.TestTrees.find;

public class SiblingIteratorTest {

    @Test
    public void testFollowsAppendOrder() {
        Tree<String> tree = TestTrees.flatTree();
        List<String> visited = new ArrayList<>();

        SiblingIterator<String> itr = new SiblingIterator<>(tree.getHead().getFirstChild());
        SiblingIterator<String> end = new SiblingIterator<>();
        while (!itr.equals(end)) {
            visited.add(itr.next().getValue());
        }

        Assert.assertEquals(Arrays.asList("B", "D", "A", "C", "F", "G", "E", "H"), visited);
        Assert.assertFalse(itr.isValid());
    }

    @Test
    public void testDoesNotDescendOrAscend() {
        Tree<String> tree = TestTrees.sampleTree();

        Assert.assertEquals(Arrays.asList("B", "G"), TestTrees.drain(new SiblingIterator<>(find(tree, "B"))));
        Assert.assertEquals(Arrays.asList("D"), TestTrees.drain(new SiblingIterator<>(find(tree, "D"))));
        Assert.assertEquals(Collections.singletonList("F"), TestTrees.drain(new SiblingIterator<>(tree.getHead())));
    }

    @Test
    public void testStartsMidChain() {
        Tree<String> tree = TestTrees.flatTree();
        SiblingIterator<String> itr = new SiblingIterator<>(tree.getHead().getFirstChild()).advance().advance();

        Assert.assertEquals(Arrays.asList("A", "C", "F", "G", "E", "H"), TestTrees.drain(itr));
    }

    @Test
    public void testChildrenView() {
        Tree<String> tree = TestTrees.flatTree();

        Assert.assertEquals(Arrays.asList("B", "D", "A", "C", "F", "G", "E", "H"), TestTrees.values(tree.getHead().children()));
        Assert.assertTrue(TestTrees.values(find(tree, "B").children()).isEmpty());
    }
}
