package com.libragraph.vfs.api;

import java.nio.file.NoSuchFileException;

/**
 * Thrown when a stat or open targets a path that does not exist in the reader.
 */
public class PathNotFoundException extends NoSuchFileException {

    private final String path;

    public PathNotFoundException(String path) {
        super(path, null, "path \"" + path + "\" does not exist");
        this.path = path;
    }

    public String path() {
        return path;
    }
}
