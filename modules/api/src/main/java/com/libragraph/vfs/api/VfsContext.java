package com.libragraph.vfs.api;

/**
 * Caller-supplied context passed to every {@link VfsReader} operation so hosts
 * can propagate cancellation through layers of readers.
 */
@FunctionalInterface
public interface VfsContext {

    boolean isCancelled();

    /** A context that is never cancelled. */
    static VfsContext background() {
        return Background.INSTANCE;
    }

    enum Background implements VfsContext {
        INSTANCE;

        @Override
        public boolean isCancelled() {
            return false;
        }
    }
}
