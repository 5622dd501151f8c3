package com.libragraph.vfs.util.glob;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Compiled shell-style glob pattern over {@code /}-separated paths.
 *
 * <pre>
 *   *          any run of characters other than '/'
 *   ?          any single character other than '/'
 *   [abc]      one character from the class
 *   [^a-z]     one character outside the class
 *   \c         the character c, literally (also inside classes)
 * </pre>
 *
 * The whole pattern is validated by {@link #compile}, so a malformed pattern
 * fails even when no name would have reached the bad part.
 * Instances are immutable and thread-safe.
 */
public final class GlobPattern {

    public static final int SEPARATOR = '/';

    private final String pattern;
    private final List<Token> tokens;

    private GlobPattern(String pattern, List<Token> tokens) {
        this.pattern = pattern;
        this.tokens = tokens;
    }

    /**
     * Parses a glob pattern.
     *
     * @throws MalformedPatternException if the pattern is invalid
     */
    public static GlobPattern compile(String pattern) {
        Objects.requireNonNull(pattern, "pattern cannot be null");
        return new GlobPattern(pattern, new Parser(pattern).parse());
    }

    /**
     * Whether {@code s} contains any character with special meaning in a pattern.
     */
    public static boolean hasMeta(String s) {
        for (int i = 0; i < s.length(); i++) {
            switch (s.charAt(i)) {
                case '*', '?', '[', '\\':
                    return true;
                default:
                    break;
            }
        }
        return false;
    }

    public String pattern() {
        return pattern;
    }

    /**
     * Upper bound on the number of {@code /} characters a matching name contains.
     * Only literal separators and character classes can consume one.
     */
    public int maxSeparators() {
        int count = 0;
        for (Token token : tokens) {
            if (token.accepts(SEPARATOR)) count++;
        }
        return count;
    }

    /**
     * Whether a character class in this pattern accepts {@code /}, so that a
     * match may cross a separator the pattern text does not spell out.
     */
    public boolean classMatchesSeparator() {
        for (Token token : tokens) {
            if (token instanceof CharClass && token.accepts(SEPARATOR)) return true;
        }
        return false;
    }

    /**
     * Tests the whole of {@code name} against this pattern.
     */
    public boolean matches(String name) {
        int[] s = name.codePoints().toArray();
        // reach[j]: the tokens consumed so far can match the first j code points
        boolean[] reach = new boolean[s.length + 1];
        reach[0] = true;

        for (Token token : tokens) {
            boolean[] next = new boolean[s.length + 1];
            if (token instanceof Star) {
                next[0] = reach[0];
                for (int j = 1; j <= s.length; j++) {
                    next[j] = reach[j] || (next[j - 1] && s[j - 1] != SEPARATOR);
                }
            } else {
                for (int j = 1; j <= s.length; j++) {
                    next[j] = reach[j - 1] && token.accepts(s[j - 1]);
                }
            }
            reach = next;
        }
        return reach[s.length];
    }

    @Override
    public String toString() {
        return pattern;
    }

    private interface Token {
        boolean accepts(int cp);
    }

    private record Literal(int cp) implements Token {
        @Override
        public boolean accepts(int c) {
            return c == cp;
        }
    }

    private record AnyChar() implements Token {
        @Override
        public boolean accepts(int c) {
            return c != SEPARATOR;
        }
    }

    private record Star() implements Token {
        @Override
        public boolean accepts(int c) {
            return c != SEPARATOR;
        }
    }

    /** Ranges are stored as [lo0, hi0, lo1, hi1, ...]; a class may match '/'. */
    private record CharClass(boolean negated, int[] ranges) implements Token {
        @Override
        public boolean accepts(int c) {
            boolean in = false;
            for (int i = 0; i < ranges.length; i += 2) {
                if (ranges[i] <= c && c <= ranges[i + 1]) {
                    in = true;
                    break;
                }
            }
            return in != negated;
        }
    }

    private static final class Parser {
        private final String pattern;
        private final int[] cps;
        private int i;

        Parser(String pattern) {
            this.pattern = pattern;
            this.cps = pattern.codePoints().toArray();
        }

        List<Token> parse() {
            List<Token> out = new ArrayList<>();
            while (i < cps.length) {
                int c = cps[i];
                switch (c) {
                    case '*' -> {
                        // runs of stars behave like one
                        if (out.isEmpty() || !(out.get(out.size() - 1) instanceof Star)) {
                            out.add(new Star());
                        }
                        i++;
                    }
                    case '?' -> {
                        out.add(new AnyChar());
                        i++;
                    }
                    case '\\' -> {
                        if (i + 1 >= cps.length) {
                            throw fail("trailing escape");
                        }
                        out.add(new Literal(cps[i + 1]));
                        i += 2;
                    }
                    case '[' -> out.add(parseClass());
                    default -> {
                        out.add(new Literal(c));
                        i++;
                    }
                }
            }
            return List.copyOf(out);
        }

        private CharClass parseClass() {
            i++; // '['
            boolean negated = false;
            if (i < cps.length && cps[i] == '^') {
                negated = true;
                i++;
            }
            List<Integer> ranges = new ArrayList<>();
            while (true) {
                if (i < cps.length && cps[i] == ']' && !ranges.isEmpty()) {
                    i++;
                    break;
                }
                int lo = classChar();
                int hi = lo;
                if (cps[i] == '-') {
                    i++;
                    hi = classChar();
                }
                ranges.add(lo);
                ranges.add(hi);
            }
            return new CharClass(negated, ranges.stream().mapToInt(Integer::intValue).toArray());
        }

        /** Reads one (possibly escaped) class character; a class must still be open afterwards. */
        private int classChar() {
            if (i >= cps.length) {
                throw fail("unterminated character class");
            }
            if (cps[i] == '-' || cps[i] == ']') {
                throw fail("unexpected '" + Character.toString(cps[i]) + "' in character class");
            }
            if (cps[i] == '\\') {
                i++;
                if (i >= cps.length) {
                    throw fail("trailing escape");
                }
            }
            int c = cps[i++];
            if (i >= cps.length) {
                throw fail("unterminated character class");
            }
            return c;
        }

        private MalformedPatternException fail(String reason) {
            return new MalformedPatternException(pattern, reason, i);
        }
    }
}
