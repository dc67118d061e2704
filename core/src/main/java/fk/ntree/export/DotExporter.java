package fk.ntree.export;

import com.google.common.base.Preconditions;
import fk.ntree.Tree;
import fk.ntree.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Writes a tree as a Graphviz graph: one declaration per node, labelled from its value, followed by one edge per
 * parent/child link. Nodes are numbered from 1 in pre-order.
 */
public final class DotExporter {

    private static final Logger logger = LoggerFactory.getLogger(DotExporter.class);

    private DotExporter() {
    }

    public static <T> String toDot(Tree<T> tree, Function<? super T, String> labeler) {
        StringBuilder sb = new StringBuilder();
        try {
            write(tree, labeler, sb);
        } catch (IOException e) {
            // StringBuilder does not throw
            throw new IllegalStateException(e);
        }
        return sb.toString();
    }

    public static <T> void export(Tree<T> tree, Function<? super T, String> labeler, Path output) throws IOException {
        Preconditions.checkNotNull(output);
        try (Writer writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
            write(tree, labeler, writer);
        }
        logger.info("Exported tree of {} nodes to {}", tree.size(), output);
    }

    private static <T> void write(Tree<T> tree, Function<? super T, String> labeler, Appendable out) throws IOException {
        Preconditions.checkNotNull(tree);
        Preconditions.checkNotNull(labeler);

        Map<TreeNode<T>, Integer> ids = new IdentityHashMap<>(tree.size());
        tree.foreach((idx, node) -> ids.put(node, idx + 1));

        out.append("graph {\n");
        for (TreeNode<T> node : tree.preOrder()) {
            out.append("  \"").append(String.valueOf(ids.get(node))).append("\" [label=\"")
                .append(escape(labeler.apply(node.getValue()))).append("\"];\n");
        }
        for (TreeNode<T> node : tree.preOrder()) {
            if (node.getParent() != null) {
                out.append("  \"").append(String.valueOf(ids.get(node.getParent()))).append("\" -- \"")
                    .append(String.valueOf(ids.get(node))).append("\";\n");
            }
        }
        out.append("}\n");
    }

    static String escape(String label) {
        if (label == null) {
            return "";
        }
        return label.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
