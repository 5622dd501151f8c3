package com.libragraph.vfs.util.glob;

/**
 * Thrown when a glob pattern is syntactically invalid.
 *
 * <p>Unchecked: a bad pattern is a defect in the code that built it, not a
 * condition callers are expected to recover from.
 */
public class MalformedPatternException extends IllegalArgumentException {

    private final String pattern;
    private final int index;

    public MalformedPatternException(String pattern, String reason, int index) {
        super("Invalid glob pattern \"" + pattern + "\": " + reason + " at index " + index);
        this.pattern = pattern;
        this.index = index;
    }

    public String pattern() {
        return pattern;
    }

    /** Code point index where parsing failed. */
    public int index() {
        return index;
    }
}
