package fk.ntree.bench;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import fk.ntree.Tree;
import fk.ntree.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds a tree of {@link FileInfo} mirroring a directory, using a fixed pool of workers. Every directory entry is
 * handled by its own task, and directories post tasks for their own entries, so the scan is over once the count of
 * outstanding tasks drops to zero.
 * <p>
 * Empty files, empty directories and symbolic links to directories are left out of the tree. Once every worker is
 * done, the size of each directory is set to the total size of the files below it.
 * <p>
 * A scanner runs a single scan.
 */
public class DriveScanner {

    private static final Logger logger = LoggerFactory.getLogger(DriveScanner.class);

    public static final int DEFAULT_WORKER_COUNT = 4;

    private final Path rootPath;
    private final int workerCount;
    private final Tree<FileInfo> tree;
    private final ScanningProgress progress = new ScanningProgress();

    // guards structural changes to the tree, workers append under different parents concurrently
    private final Object treeLock = new Object();

    private final AtomicInteger outstandingTasks = new AtomicInteger(0);
    private final CountDownLatch tasksDrained = new CountDownLatch(1);

    private ExecutorService workers;

    public DriveScanner(Path rootPath) {
        this(rootPath, DEFAULT_WORKER_COUNT);
    }

    public DriveScanner(Path rootPath, int workerCount) {
        Preconditions.checkNotNull(rootPath);
        Preconditions.checkArgument(Files.isDirectory(rootPath), "%s is not a directory", rootPath);
        Preconditions.checkArgument(workerCount > 0, "worker count must be positive, got %s", workerCount);

        this.rootPath = rootPath;
        this.workerCount = workerCount;
        this.tree = new Tree<>(FileInfo.directory(rootPath.toString()));
    }

    /**
     * Scans the root directory and blocks until the tree is complete.
     * @throws InterruptedException if the calling thread is interrupted while waiting for the workers, in which case
     *                              the workers are stopped and the tree is left incomplete
     */
    public void start() throws InterruptedException {
        Preconditions.checkState(workers == null, "scan of %s has already been started", rootPath);

        progress.reset();
        logger.info("Scanning {} with {} workers", rootPath, workerCount);
        Stopwatch stopwatch = Stopwatch.createStarted();

        workers = Executors.newFixedThreadPool(workerCount,
            new ThreadFactoryBuilder().setNameFormat("drive-scanner-%d").setDaemon(true).build());
        try {
            post(() -> postEntries(rootPath, tree.getHead()));
            tasksDrained.await();
        } finally {
            workers.shutdownNow();
        }

        computeDirectorySizes(tree);
        progress.completed();
        logger.info("Scan of {} completed in {}: {}", rootPath, stopwatch, progress);
    }

    public Tree<FileInfo> getTree() {
        return tree;
    }

    public ScanningProgress getProgress() {
        return progress;
    }

    public Path getRootPath() {
        return rootPath;
    }

    /**
     * Adds the size of every node to the size of its parent directory, children first, so that each directory ends up
     * with the total size of its subtree.
     */
    @VisibleForTesting
    static void computeDirectorySizes(Tree<FileInfo> tree) {
        for (TreeNode<FileInfo> node : tree) {
            TreeNode<FileInfo> parent = node.getParent();
            if (parent != null && parent.getValue().getType() == FileType.DIRECTORY) {
                parent.getValue().addSize(node.getValue().getSize());
            }
        }
    }

    private void post(Runnable task) {
        outstandingTasks.incrementAndGet();
        try {
            workers.execute(() -> {
                try {
                    task.run();
                } finally {
                    taskDone();
                }
            });
        } catch (RejectedExecutionException e) {
            // only once the scan has been interrupted
            logger.debug("Dropping scan task, workers have been stopped");
            taskDone();
        }
    }

    private void taskDone() {
        if (outstandingTasks.decrementAndGet() == 0) {
            tasksDrained.countDown();
        }
    }

    private void postEntries(Path directory, TreeNode<FileInfo> node) {
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(directory)) {
            for (Path entry : entries) {
                post(() -> processPath(entry, node));
            }
        } catch (IOException | DirectoryIteratorException e) {
            logger.debug("Could not list entries of {}", directory, e);
        }
    }

    private void processPath(Path path, TreeNode<FileInfo> parent) {
        try {
            if (Files.isRegularFile(path)) {
                processFile(path, parent);
            } else if (Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS)) {
                processDirectory(path, parent);
            }
        } catch (IOException | UncheckedIOException | DirectoryIteratorException | SecurityException e) {
            logger.debug("Skipping {}", path, e);
        }
    }

    private void processFile(Path path, TreeNode<FileInfo> parent) throws IOException {
        progress.fileScanned();

        long size = Files.size(path);
        if (size == 0) {
            return;
        }
        progress.bytesProcessed(size);

        FileInfo info = FileInfo.regularFile(path, size);
        synchronized (treeLock) {
            parent.appendChild(info);
        }
    }

    private void processDirectory(Path path, TreeNode<FileInfo> parent) throws IOException {
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(path)) {
            if (!entries.iterator().hasNext()) {
                return;
            }
        }

        Path fileName = path.getFileName();
        FileInfo info = FileInfo.directory(fileName == null ? path.toString() : fileName.toString());
        TreeNode<FileInfo> child;
        synchronized (treeLock) {
            child = parent.appendChild(info);
        }
        progress.directoryScanned();

        postEntries(path, child);
    }
}
