package com.libragraph.vfs.api;

import com.libragraph.vfs.types.EntryType;

import java.util.Objects;

/**
 * Result of {@link VfsReader#stat}.
 *
 * @param name     base name of the node, without any trailing separator
 * @param size     length in bytes (0 for directories or when unknown)
 * @param type     file, directory or symlink
 * @param metadata timestamps and mode as recorded by the source
 */
public record FileInfo(
        String name,
        long size,
        EntryType type,
        EntryMetadata metadata
) {
    public FileInfo {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(type, "type cannot be null");
        if (metadata == null) {
            metadata = EntryMetadata.empty();
        }
    }

    public boolean isDirectory() {
        return type == EntryType.DIRECTORY;
    }

    /**
     * Base name of a {@code /}-separated path: the last non-empty segment.
     */
    public static String baseName(String path) {
        String trimmed = path;
        while (trimmed.length() > 1 && trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        int slash = trimmed.lastIndexOf('/');
        return slash >= 0 && slash < trimmed.length() - 1 ? trimmed.substring(slash + 1) : trimmed;
    }
}
