package com.libragraph.vfs.api;

import java.io.IOException;

/**
 * Thrown when an archive cannot be opened: its length cannot be determined or
 * its structure cannot be parsed. No partially opened reader is ever returned.
 */
public class ArchiveOpenException extends IOException {

    public ArchiveOpenException(String message, Throwable cause) {
        super(message, cause);
    }

    public ArchiveOpenException(String message) {
        super(message);
    }
}
