package com.libragraph.vfs.api;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Read-only file system capability set.
 *
 * <p>Implementations back it with a zip archive, a real directory tree, or a
 * union of other readers; calling code does not need to know which.
 * All operations must be safe to call concurrently.
 */
public interface VfsReader {

    /**
     * Returns metadata for the node at {@code path}.
     *
     * @throws PathNotFoundException if nothing exists at {@code path}
     * @throws IOException on I/O errors
     */
    FileInfo stat(VfsContext ctx, String path) throws IOException;

    /**
     * Opens the file at {@code path} for reading.
     * Every call returns an independent stream owned by the caller, who must close it.
     *
     * @throws PathNotFoundException if nothing exists at {@code path}
     * @throws IOException on I/O errors
     */
    InputStream open(VfsContext ctx, String path) throws IOException;

    /**
     * Returns every path matching the shell-style {@code pattern}, or an empty
     * list if none does.
     *
     * <p>A malformed pattern is a programming error and is reported with the
     * unchecked {@code MalformedPatternException}, never through the return value.
     *
     * @throws IOException on I/O errors
     */
    List<String> glob(VfsContext ctx, String pattern) throws IOException;
}
