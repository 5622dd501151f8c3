package com.libragraph.vfs.zip;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Parsing options handed to Commons Compress when an archive is opened.
 *
 * @param charset               encoding of entry names not flagged as UTF-8
 * @param useUnicodeExtraFields prefer names from Info-ZIP Unicode extra fields when present
 * @param ignoreLocalFileHeader read entry data offsets from the central directory only
 */
public record ZipOptions(
        Charset charset,
        boolean useUnicodeExtraFields,
        boolean ignoreLocalFileHeader
) {
    public ZipOptions {
        if (charset == null) {
            charset = StandardCharsets.UTF_8;
        }
    }

    public static ZipOptions defaults() {
        return new ZipOptions(StandardCharsets.UTF_8, true, false);
    }
}
