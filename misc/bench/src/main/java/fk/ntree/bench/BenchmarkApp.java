package fk.ntree.bench;

import fk.ntree.Tree;
import fk.ntree.export.DotExporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Scans a directory into a tree of {@link FileInfo} and times traversals over it.
 * <p>
 * Usage: {@code BenchmarkApp <config.json>} or {@code BenchmarkApp --root <directory>}.
 */
public class BenchmarkApp {

    private static final Logger logger = LoggerFactory.getLogger(BenchmarkApp.class);

    public static void main(String[] args) throws Exception {
        BenchmarkConfig config = parseArgs(args);
        if (config == null) {
            System.err.println("usage: BenchmarkApp <config.json> | --root <directory>");
            System.exit(1);
            return;
        }

        DriveScanner scanner = new DriveScanner(config.getRootPath(), config.getScannerThreads());
        Tree<FileInfo> tree = scan(scanner, config.getProgressIntervalMs());

        logger.info("Tree has {} nodes, {} leaves, {} bytes in total", tree.size(), tree.leafStream().count(),
            tree.getHead().getValue().getSize());

        new TraversalBenchmark(tree, config.getTrialCount()).runAll();

        Path dotOutput = config.getDotOutputPath();
        if (dotOutput != null) {
            DotExporter.export(tree, info -> info.getName() + info.getExtension(), dotOutput);
        }
    }

    static BenchmarkConfig parseArgs(String[] args) throws Exception {
        if (args.length == 2 && "--root".equals(args[0])) {
            return BenchmarkConfig.forRoot(args[1]);
        }
        if (args.length == 1 && !args[0].startsWith("--")) {
            return BenchmarkConfig.load(Paths.get(args[0]));
        }
        return null;
    }

    /**
     * Runs the scan on its own thread, logging progress until it is done.
     */
    static Tree<FileInfo> scan(DriveScanner scanner, long progressIntervalMs) throws Exception {
        AtomicReference<Exception> failure = new AtomicReference<>();
        Thread scanningThread = new Thread(() -> {
            try {
                scanner.start();
            } catch (Exception e) {
                failure.set(e);
            }
        }, "drive-scanner-main");
        scanningThread.start();

        ScanningProgress progress = scanner.getProgress();
        while (!progress.isScanCompleted() && scanningThread.isAlive()) {
            logger.info("Files scanned: {}", progress.getFilesScanned());
            scanningThread.join(progressIntervalMs);
        }
        scanningThread.join();

        if (failure.get() != null) {
            throw failure.get();
        }
        logger.info("Scan done: {}", progress);
        return scanner.getTree();
    }
}
