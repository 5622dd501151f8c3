package com.libragraph.vfs.api;

import java.time.Instant;

/**
 * POSIX/FS metadata for a VFS node, passed through from whatever the backing
 * store recorded. Nullable fields: only populated when the source provides them.
 */
public record EntryMetadata(
        Instant mtime,
        Instant ctime,
        Instant atime,
        Integer posixMode
) {
    private static final EntryMetadata EMPTY = new EntryMetadata(null, null, null, null);

    public static EntryMetadata empty() {
        return EMPTY;
    }
}
