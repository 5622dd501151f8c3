package com.libragraph.vfs.core.local;

import com.libragraph.vfs.api.*;
import com.libragraph.vfs.types.EntryType;
import com.libragraph.vfs.util.glob.GlobPattern;
import com.libragraph.vfs.util.glob.MalformedPatternException;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.PosixFileAttributes;
import java.nio.file.attribute.PosixFilePermission;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * {@link VfsReader} over the real file system.
 *
 * <p>Relative paths resolve against the root given at construction (the working
 * directory by default); absolute paths are used as-is. Glob results keep the
 * form of the pattern: relative patterns yield relative, {@code /}-joined paths.
 */
public final class LocalFileSystem implements VfsReader {

    private static final Logger log = Logger.getLogger(LocalFileSystem.class);

    private final Path root;
    private final boolean posix;

    public LocalFileSystem() {
        this(Path.of(""));
    }

    public LocalFileSystem(Path root) {
        this.root = Objects.requireNonNull(root, "root cannot be null");
        this.posix = root.getFileSystem().supportedFileAttributeViews().contains("posix");
    }

    public Path root() {
        return root;
    }

    @Override
    public FileInfo stat(VfsContext ctx, String path) throws IOException {
        Path target = root.resolve(path);
        BasicFileAttributes attrs;
        try {
            attrs = posix
                    ? Files.readAttributes(target, PosixFileAttributes.class, LinkOption.NOFOLLOW_LINKS)
                    : Files.readAttributes(target, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
        } catch (NoSuchFileException e) {
            throw notFound(path, e);
        }

        EntryType type;
        if (attrs.isDirectory()) {
            type = EntryType.DIRECTORY;
        } else if (attrs.isSymbolicLink()) {
            type = EntryType.SYMLINK;
        } else {
            type = EntryType.FILE;
        }

        Integer mode = attrs instanceof PosixFileAttributes posixAttrs
                ? toMode(posixAttrs.permissions(), type) : null;
        EntryMetadata metadata = new EntryMetadata(
                Instant.ofEpochMilli(attrs.lastModifiedTime().toMillis()),
                Instant.ofEpochMilli(attrs.creationTime().toMillis()),
                Instant.ofEpochMilli(attrs.lastAccessTime().toMillis()),
                mode);

        Path fileName = target.getFileName();
        String name = fileName != null ? fileName.toString() : target.toString();
        return new FileInfo(name, type == EntryType.DIRECTORY ? 0 : attrs.size(), type, metadata);
    }

    @Override
    public InputStream open(VfsContext ctx, String path) throws IOException {
        try {
            return Files.newInputStream(root.resolve(path));
        } catch (NoSuchFileException e) {
            throw notFound(path, e);
        }
    }

    /**
     * Expands {@code pattern} one path segment at a time. Segments without
     * pattern characters are taken literally; the others are matched against the
     * sorted listing of each candidate directory. A pattern ending in {@code /}
     * selects directories only, and those results keep the trailing separator.
     * When a character class can match {@code /}, the tree below the literal
     * prefix is walked instead, as deep as the pattern could reach.
     *
     * @throws MalformedPatternException if the pattern is invalid
     */
    @Override
    public List<String> glob(VfsContext ctx, String pattern) throws IOException {
        GlobPattern compiled;
        try {
            compiled = GlobPattern.compile(pattern);
        } catch (MalformedPatternException e) {
            log.errorf(e, "Invalid glob pattern %s", pattern);
            throw e;
        }

        String trimmed = trimTrailingSeparators(pattern);
        boolean directoriesOnly = !trimmed.equals(pattern);

        List<String> matches = new ArrayList<>();
        if (compiled.classMatchesSeparator()) {
            walk(GlobPattern.compile(trimmed), trimmed, matches);
        } else {
            expand(trimmed, matches);
        }
        if (!directoriesOnly) {
            return Collections.unmodifiableList(matches);
        }

        List<String> dirs = new ArrayList<>();
        for (String match : matches) {
            if (Files.isDirectory(root.resolve(match), LinkOption.NOFOLLOW_LINKS)) {
                dirs.add(match.endsWith("/") ? match : match + "/");
            }
        }
        return Collections.unmodifiableList(dirs);
    }

    private void expand(String pattern, List<String> out) throws IOException {
        if (!GlobPattern.hasMeta(pattern)) {
            if (Files.exists(root.resolve(pattern), LinkOption.NOFOLLOW_LINKS)) {
                out.add(pattern);
            }
            return;
        }

        int sep = lastSeparator(pattern);
        String dir = "";
        String name = pattern;
        if (sep >= 0) {
            boolean escaped = pattern.charAt(sep) == '\\';
            dir = trimSeparators(pattern.substring(0, sep) + "/");
            name = pattern.substring(escaped ? sep + 2 : sep + 1);
        }
        GlobPattern file = GlobPattern.compile(name);

        List<String> dirs = new ArrayList<>();
        if (GlobPattern.hasMeta(dir)) {
            expand(dir, dirs);
        } else {
            dirs.add(dir);
        }

        for (String candidate : dirs) {
            for (String child : list(candidate)) {
                if (file.matches(child)) {
                    out.add(join(candidate, child));
                }
            }
        }
    }

    private void walk(GlobPattern glob, String pattern, List<String> out) throws IOException {
        int prefixEnd = pattern.lastIndexOf('/', firstMeta(pattern));
        String base = prefixEnd >= 0 ? trimSeparators(pattern.substring(0, prefixEnd + 1)) : "";
        int prefixSeparators = 0;
        for (int i = 0; i <= prefixEnd; i++) {
            if (pattern.charAt(i) == '/') prefixSeparators++;
        }
        descend(base, glob.maxSeparators() - prefixSeparators + 1, glob, out);
    }

    private void descend(String dir, int depth, GlobPattern glob, List<String> out) throws IOException {
        for (String child : list(dir)) {
            String path = join(dir, child);
            if (glob.matches(path)) {
                out.add(path);
            }
            if (depth > 1 && Files.isDirectory(root.resolve(path), LinkOption.NOFOLLOW_LINKS)) {
                descend(path, depth - 1, glob, out);
            }
        }
    }

    /** Sorted child names of {@code dir}, or none if it is not a directory. */
    private List<String> list(String dir) throws IOException {
        Path dirPath = root.resolve(dir);
        if (!Files.isDirectory(dirPath)) {
            return List.of();
        }
        List<String> names = new ArrayList<>();
        try (DirectoryStream<Path> children = Files.newDirectoryStream(dirPath)) {
            for (Path child : children) {
                names.add(child.getFileName().toString());
            }
        }
        Collections.sort(names);
        return names;
    }

    /**
     * Index of the last separator outside a character class: either a bare
     * {@code /} or the backslash of an escaped one. -1 if there is none.
     * The pattern must already be valid.
     */
    private static int lastSeparator(String pattern) {
        int last = -1;
        int i = 0;
        while (i < pattern.length()) {
            char c = pattern.charAt(i);
            if (c == '\\') {
                if (pattern.charAt(i + 1) == '/') last = i;
                i += 2;
            } else if (c == '[') {
                i = classEnd(pattern, i) + 1;
            } else {
                if (c == '/') last = i;
                i++;
            }
        }
        return last;
    }

    /** Index of the ']' closing the class opened at {@code open}. */
    private static int classEnd(String pattern, int open) {
        int i = open + 1;
        if (pattern.charAt(i) == '^') i++;
        // a valid class never starts with ']', so the first unescaped one closes it
        i = pattern.charAt(i) == '\\' ? i + 2 : i + 1;
        while (pattern.charAt(i) != ']') {
            i += pattern.charAt(i) == '\\' ? 2 : 1;
        }
        return i;
    }

    private static int firstMeta(String pattern) {
        for (int i = 0; i < pattern.length(); i++) {
            if (GlobPattern.hasMeta(pattern.substring(i, i + 1))) return i;
        }
        return pattern.length();
    }

    /** Strips unescaped trailing separators, keeping a lone "/". */
    private static String trimTrailingSeparators(String pattern) {
        String trimmed = pattern;
        while (trimmed.length() > 1 && trimmed.endsWith("/") && !escapesLast(trimmed)) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    /** Whether the last character of {@code s} is escaped by an odd run of backslashes. */
    private static boolean escapesLast(String s) {
        int backslashes = 0;
        for (int i = s.length() - 2; i >= 0 && s.charAt(i) == '\\'; i--) {
            backslashes++;
        }
        return backslashes % 2 == 1;
    }

    /** Drops trailing separators, keeping a lone "/" for the file system root. */
    private static String trimSeparators(String dir) {
        String trimmed = dir;
        while (trimmed.length() > 1 && trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static String join(String dir, String name) {
        if (dir.isEmpty()) return name;
        return dir.endsWith("/") ? dir + name : dir + "/" + name;
    }

    private static int toMode(Set<PosixFilePermission> permissions, EntryType type) {
        int mode = type.modeBits();
        for (PosixFilePermission permission : permissions) {
            // OWNER_READ (0400) down to OTHERS_EXECUTE (0001)
            mode |= 0400 >> permission.ordinal();
        }
        return mode;
    }

    private static PathNotFoundException notFound(String path, NoSuchFileException cause) {
        PathNotFoundException e = new PathNotFoundException(path);
        e.initCause(cause);
        return e;
    }
}
