package com.libragraph.vfs.zip;

import com.libragraph.vfs.api.*;
import com.libragraph.vfs.types.EntryType;
import com.libragraph.vfs.util.channel.SerializedReader;
import com.libragraph.vfs.util.glob.GlobPattern;
import com.libragraph.vfs.util.glob.MalformedPatternException;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.jboss.logging.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.FileChannel;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only {@link VfsReader} over the contents of one zip archive.
 *
 * <p>Paths are archive entry names, matched literally with {@code /} as the
 * separator; a directory may be named with or without its trailing separator.
 * The entry list is read once at open time and never changes.
 *
 * <p>Every positioned read Commons Compress issues against the archive, while
 * parsing and while streaming entry data, goes through one {@link SerializedReader},
 * so the source channel does not need to support concurrent access. Streams
 * returned by {@link #open} are independent and may be read concurrently.
 */
public final class ZipFileSystem implements VfsReader, Closeable {

    private static final Logger log = Logger.getLogger(ZipFileSystem.class);

    private static final String SEPARATOR = "/";

    private final ZipFile archive;
    private final SerializedReader reader;
    private final List<ZipArchiveEntry> entries;
    private final List<String> paths;

    private ZipFileSystem(ZipFile archive, SerializedReader reader, List<ZipArchiveEntry> entries) {
        this.archive = archive;
        this.reader = reader;
        this.entries = List.copyOf(entries);
        List<String> names = new ArrayList<>(entries.size());
        for (ZipArchiveEntry entry : entries) {
            names.add(entry.getName());
        }
        this.paths = Collections.unmodifiableList(names);
    }

    /**
     * Opens an archive with {@link ZipOptions#defaults()}.
     *
     * @see #open(SeekableByteChannel, ZipOptions)
     */
    public static ZipFileSystem open(SeekableByteChannel channel) throws IOException {
        return open(channel, ZipOptions.defaults());
    }

    /**
     * Opens the archive readable from {@code channel}.
     *
     * <p>On success the returned file system owns the channel and closes it in
     * {@link #close()}. On failure the channel is left open for the caller.
     *
     * @throws ArchiveOpenException  if the length cannot be determined or the data is not a zip archive
     * @throws EmptyArchiveException if the archive holds no entries
     */
    public static ZipFileSystem open(SeekableByteChannel channel, ZipOptions options) throws IOException {
        long size;
        try {
            size = channel.size();
        } catch (IOException e) {
            throw new ArchiveOpenException("cannot determine archive length", e);
        }

        SerializedReader reader = SerializedReader.wrap(channel);
        ZipFile archive;
        try {
            archive = ZipFile.builder()
                    .setSeekableByteChannel(reader.channel())
                    .setUseUnicodeExtraFields(options.useUnicodeExtraFields())
                    .setIgnoreLocalFileHeader(options.ignoreLocalFileHeader())
                    .setCharset(options.charset())
                    .get();
        } catch (IOException e) {
            throw new ArchiveOpenException("cannot read zip archive of " + size + " bytes", e);
        }

        List<ZipArchiveEntry> entries = Collections.list(archive.getEntries());
        if (entries.isEmpty()) {
            EmptyArchiveException empty = new EmptyArchiveException();
            try {
                // closes only the channel view, the caller keeps the source channel
                archive.close();
            } catch (IOException e) {
                empty.addSuppressed(e);
            }
            throw empty;
        }

        if (options.ignoreLocalFileHeader()) {
            try {
                resolveDataOffsets(archive, entries);
            } catch (IOException e) {
                ArchiveOpenException failure = new ArchiveOpenException("cannot locate entry data", e);
                try {
                    archive.close();
                } catch (IOException closeError) {
                    failure.addSuppressed(closeError);
                }
                throw failure;
            }
        }

        log.debugf("Opened zip archive: %d entries, %d bytes", (Object) entries.size(), size);
        return new ZipFileSystem(archive, reader, entries);
    }

    /**
     * Opens a zip file on disk with {@link ZipOptions#defaults()}.
     */
    public static ZipFileSystem open(Path archivePath) throws IOException {
        return open(archivePath, ZipOptions.defaults());
    }

    /**
     * Opens a zip file on disk. The file channel is closed again if the archive
     * cannot be opened.
     */
    public static ZipFileSystem open(Path archivePath, ZipOptions options) throws IOException {
        FileChannel channel = FileChannel.open(archivePath, StandardOpenOption.READ);
        try {
            return open(channel, options);
        } catch (IOException | RuntimeException e) {
            try {
                channel.close();
            } catch (IOException closeError) {
                e.addSuppressed(closeError);
            }
            throw e;
        }
    }

    @Override
    public FileInfo stat(VfsContext ctx, String path) throws IOException {
        Objects.requireNonNull(path, "path cannot be null");
        ZipArchiveEntry entry = find(path).orElseThrow(() -> new PathNotFoundException(path));
        return toFileInfo(entry);
    }

    @Override
    public InputStream open(VfsContext ctx, String path) throws IOException {
        Objects.requireNonNull(path, "path cannot be null");
        ZipArchiveEntry entry = find(path).orElseThrow(() -> new PathNotFoundException(path));
        return archive.getInputStream(entry);
    }

    /**
     * Matches {@code pattern} against every entry name in archive order.
     * A directory entry also matches through its name without the trailing
     * separator, so {@code *} lists top-level directories alongside top-level files.
     *
     * @throws MalformedPatternException if the pattern is invalid
     */
    @Override
    public List<String> glob(VfsContext ctx, String pattern) {
        GlobPattern glob;
        try {
            glob = GlobPattern.compile(pattern);
        } catch (MalformedPatternException e) {
            log.errorf(e, "Invalid glob pattern %s", pattern);
            throw e;
        }

        List<String> names = new ArrayList<>();
        for (String name : paths) {
            if (glob.matches(name) || (name.endsWith(SEPARATOR) && glob.matches(stripSeparator(name)))) {
                names.add(name);
            }
        }
        return Collections.unmodifiableList(names);
    }

    /**
     * Every entry name, in the order the archive lists them.
     */
    public List<String> paths() {
        return paths;
    }

    public int entryCount() {
        return entries.size();
    }

    /**
     * Closes the archive and the channel it was opened from.
     * Streams obtained from {@link #open} stop working.
     */
    @Override
    public void close() throws IOException {
        try (SerializedReader source = reader) {
            archive.close();
        }
    }

    private Optional<ZipArchiveEntry> find(String path) {
        String dirPath = path + SEPARATOR;
        for (ZipArchiveEntry entry : entries) {
            String name = entry.getName();
            if (name.equals(path) || name.equals(dirPath)) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    /**
     * Without local headers read at parse time, Commons Compress locates an
     * entry's data on first access with a seek outside the channel lock, so
     * every offset is fixed here while the archive is still private.
     */
    private static void resolveDataOffsets(ZipFile archive, List<ZipArchiveEntry> entries) throws IOException {
        for (ZipArchiveEntry entry : entries) {
            try (InputStream raw = archive.getRawInputStream(entry)) {
                log.tracef("Located data of %s at offset %d", entry.getName(), (Object) entry.getDataOffset());
            }
        }
    }

    private static String stripSeparator(String name) {
        return name.substring(0, name.length() - SEPARATOR.length());
    }

    private static FileInfo toFileInfo(ZipArchiveEntry entry) {
        EntryType type;
        if (entry.isDirectory()) {
            type = EntryType.DIRECTORY;
        } else if (entry.isUnixSymlink()) {
            type = EntryType.SYMLINK;
        } else {
            type = EntryType.FILE;
        }
        long size = type == EntryType.DIRECTORY ? 0 : Math.max(entry.getSize(), 0);
        return new FileInfo(FileInfo.baseName(entry.getName()), size, type, buildEntryMetadata(entry));
    }

    private static EntryMetadata buildEntryMetadata(ZipArchiveEntry entry) {
        Instant mtime = entry.getLastModifiedTime() != null
                ? Instant.ofEpochMilli(entry.getLastModifiedTime().toMillis()) : null;
        Instant ctime = entry.getCreationTime() != null
                ? Instant.ofEpochMilli(entry.getCreationTime().toMillis()) : null;
        Instant atime = entry.getLastAccessTime() != null
                ? Instant.ofEpochMilli(entry.getLastAccessTime().toMillis()) : null;
        return new EntryMetadata(mtime, ctime, atime, extractPosixMode(entry));
    }

    private static Integer extractPosixMode(ZipArchiveEntry entry) {
        if (entry.getPlatform() != ZipArchiveEntry.PLATFORM_UNIX) return null;
        int unixMode = (int) (entry.getExternalAttributes() >> 16) & 0xFFFF;
        return unixMode != 0 ? unixMode : null;
    }
}
