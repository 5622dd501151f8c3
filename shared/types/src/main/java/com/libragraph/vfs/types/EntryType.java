package com.libragraph.vfs.types;

/**
 * Kind of node a path resolves to.
 */
public enum EntryType {
    FILE(0100000),
    DIRECTORY(0040000),
    SYMLINK(0120000);

    private final int modeBits;

    EntryType(int modeBits) {
        this.modeBits = modeBits;
    }

    /** The S_IFxxx bits for this type. */
    public int modeBits() {
        return modeBits;
    }
}
