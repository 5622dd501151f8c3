package com.libragraph.vfs.api;

import java.io.IOException;

/**
 * Thrown when an archive parses cleanly but holds no entries.
 * Such an archive has no root and is rejected as invalid input.
 */
public class EmptyArchiveException extends IOException {

    public EmptyArchiveException() {
        super("archive has no root directory");
    }
}
