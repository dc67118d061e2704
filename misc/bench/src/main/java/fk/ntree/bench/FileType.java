package fk.ntree.bench;

/**
 * The basic kinds of file system entries. Junctions and other reparse points count as {@link #SYMLINK}.
 */
public enum FileType {
    REGULAR,
    DIRECTORY,
    SYMLINK
}
