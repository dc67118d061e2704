package fk.ntree.bench;

import com.google.common.base.Preconditions;

import java.nio.file.Path;

/**
 * Payload of a node in a scanned file tree. The size of a directory is the sum of everything below it, which is only
 * known once the scan is over, so it is mutable.
 */
public class FileInfo {

    private final String name;
    private final String extension;
    private final FileType type;
    private long size;

    public FileInfo(String name, String extension, long size, FileType type) {
        this.name = Preconditions.checkNotNull(name);
        this.extension = Preconditions.checkNotNull(extension);
        this.type = Preconditions.checkNotNull(type);
        this.size = size;
    }

    public static FileInfo directory(String name) {
        return new FileInfo(name, "", 0L, FileType.DIRECTORY);
    }

    /**
     * Splits the file name of a regular file into a name and an extension, the extension being the last dot and what
     * follows it. A leading dot does not start an extension, so ".bashrc" has none.
     */
    public static FileInfo regularFile(Path path, long size) {
        Path fileName = Preconditions.checkNotNull(path).getFileName();
        String fullName = fileName == null ? path.toString() : fileName.toString();

        int dot = fullName.lastIndexOf('.');
        if (dot <= 0) {
            return new FileInfo(fullName, "", size, FileType.REGULAR);
        }
        return new FileInfo(fullName.substring(0, dot), fullName.substring(dot), size, FileType.REGULAR);
    }

    public String getName() {
        return name;
    }

    public String getExtension() {
        return extension;
    }

    public FileType getType() {
        return type;
    }

    public long getSize() {
        return size;
    }

    public void setSize(long size) {
        this.size = size;
    }

    public void addSize(long bytes) {
        this.size += bytes;
    }

    @Override
    public String toString() {
        return name + extension + " (" + type + ", " + size + " bytes)";
    }
}
