package fk.ntree.bench;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters updated by the scanning workers, safe to poll from any thread while a scan is running.
 */
public class ScanningProgress {

    private final AtomicLong filesScanned = new AtomicLong(0);
    private final AtomicLong directoriesScanned = new AtomicLong(0);
    private final AtomicLong bytesProcessed = new AtomicLong(0);
    private final AtomicBoolean scanCompleted = new AtomicBoolean(false);

    public void reset() {
        filesScanned.set(0);
        directoriesScanned.set(0);
        bytesProcessed.set(0);
        scanCompleted.set(false);
    }

    public long getFilesScanned() {
        return filesScanned.get();
    }

    public long getDirectoriesScanned() {
        return directoriesScanned.get();
    }

    public long getBytesProcessed() {
        return bytesProcessed.get();
    }

    public boolean isScanCompleted() {
        return scanCompleted.get();
    }

    void fileScanned() {
        filesScanned.incrementAndGet();
    }

    void directoryScanned() {
        directoriesScanned.incrementAndGet();
    }

    void bytesProcessed(long bytes) {
        bytesProcessed.addAndGet(bytes);
    }

    void completed() {
        scanCompleted.set(true);
    }

    @Override
    public String toString() {
        return "files=" + filesScanned.get() + ", directories=" + directoriesScanned.get() + ", bytes=" + bytesProcessed.get()
            + (scanCompleted.get() ? ", completed" : "");
    }
}
