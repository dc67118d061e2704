package fk.ntree.bench;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import fk.ntree.Tree;
import fk.ntree.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Times full traversals of a scanned file tree. Each traversal counts the nodes it visits and adds up the bytes of the
 * regular files among them.
 */
public class TraversalBenchmark {

    private static final Logger logger = LoggerFactory.getLogger(TraversalBenchmark.class);

    private final Tree<FileInfo> tree;
    private final int trialCount;
    private final Ticker ticker;

    // keeps the result of the last trial reachable
    private volatile TraversalSummary lastSummary;

    public TraversalBenchmark(Tree<FileInfo> tree, int trialCount) {
        this(tree, trialCount, Ticker.systemTicker());
    }

    @VisibleForTesting
    TraversalBenchmark(Tree<FileInfo> tree, int trialCount, Ticker ticker) {
        Preconditions.checkArgument(trialCount > 0, "trial count must be positive, got %s", trialCount);
        this.tree = Preconditions.checkNotNull(tree);
        this.trialCount = trialCount;
        this.ticker = Preconditions.checkNotNull(ticker);
    }

    /**
     * Runs every traversal and logs its average time.
     * @return average time in milliseconds, keyed by traversal name, in the order the traversals ran
     */
    public Map<String, Long> runAll() {
        Map<String, Long> averages = new LinkedHashMap<>();
        averages.put("pre-order", runTrials(this::preOrderTraversal));
        averages.put("post-order", runTrials(this::postOrderTraversal));
        averages.put("leaf", runTrials(this::leafTraversal));

        for (Map.Entry<String, Long> entry : averages.entrySet()) {
            logger.info("Average {} traversal time: {} ms", entry.getKey(), entry.getValue());
        }
        return averages;
    }

    /**
     * @return average wall time of the trial in milliseconds
     */
    public long runTrials(Supplier<TraversalSummary> trial) {
        long totalMillis = 0;
        for (int i = 0; i < trialCount; ++i) {
            Stopwatch stopwatch = Stopwatch.createStarted(ticker);
            lastSummary = trial.get();
            totalMillis += stopwatch.elapsed(TimeUnit.MILLISECONDS);
        }
        logger.debug("Last trial visited {}", lastSummary);
        return totalMillis / trialCount;
    }

    public TraversalSummary preOrderTraversal() {
        return summarize(tree.preOrder());
    }

    public TraversalSummary postOrderTraversal() {
        return summarize(tree);
    }

    public TraversalSummary leafTraversal() {
        return summarize(tree.leaves());
    }

    static TraversalSummary summarize(Iterable<TreeNode<FileInfo>> nodes) {
        long nodeCount = 0;
        long totalBytes = 0;
        for (TreeNode<FileInfo> node : nodes) {
            ++nodeCount;
            if (node.getValue().getType() == FileType.REGULAR) {
                totalBytes += node.getValue().getSize();
            }
        }
        return new TraversalSummary(nodeCount, totalBytes);
    }

    public static class TraversalSummary {
        private final long nodeCount;
        private final long totalBytes;

        public TraversalSummary(long nodeCount, long totalBytes) {
            this.nodeCount = nodeCount;
            this.totalBytes = totalBytes;
        }

        public long getNodeCount() {
            return nodeCount;
        }

        public long getTotalBytes() {
            return totalBytes;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;

            TraversalSummary that = (TraversalSummary) o;
            return nodeCount == that.nodeCount && totalBytes == that.totalBytes;
        }

        @Override
        public int hashCode() {
            return 31 * Long.hashCode(nodeCount) + Long.hashCode(totalBytes);
        }

        @Override
        public String toString() {
            return nodeCount + " nodes, " + totalBytes + " bytes";
        }
    }
}
