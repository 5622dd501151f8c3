package com.libragraph.vfs.zip;

import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.Charset;
import java.nio.file.Path;

/**
 * Opens {@link ZipFileSystem}s with the parsing options configured under
 * {@code vfs.zip.*}.
 */
@ApplicationScoped
public class ZipFileSystemFactory {

    private static final Logger log = Logger.getLogger(ZipFileSystemFactory.class);

    @ConfigProperty(name = "vfs.zip.encoding", defaultValue = "UTF-8")
    String encoding;

    @ConfigProperty(name = "vfs.zip.use-unicode-extra-fields", defaultValue = "true")
    boolean useUnicodeExtraFields;

    @ConfigProperty(name = "vfs.zip.ignore-local-file-header", defaultValue = "false")
    boolean ignoreLocalFileHeader;

    /**
     * Options derived from configuration.
     *
     * @throws java.nio.charset.UnsupportedCharsetException if {@code vfs.zip.encoding} names an unknown charset
     */
    public ZipOptions options() {
        return new ZipOptions(Charset.forName(encoding), useUnicodeExtraFields, ignoreLocalFileHeader);
    }

    public ZipFileSystem open(Path archivePath) throws IOException {
        log.debugf("Opening zip archive %s", archivePath);
        return ZipFileSystem.open(archivePath, options());
    }

    public ZipFileSystem open(SeekableByteChannel channel) throws IOException {
        return ZipFileSystem.open(channel, options());
    }
}
