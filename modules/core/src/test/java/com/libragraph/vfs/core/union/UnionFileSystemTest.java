package com.libragraph.vfs.core.union;

import com.libragraph.vfs.api.FileInfo;
import com.libragraph.vfs.api.PathNotFoundException;
import com.libragraph.vfs.api.VfsContext;
import com.libragraph.vfs.api.VfsReader;
import com.libragraph.vfs.core.local.LocalFileSystem;
import com.libragraph.vfs.zip.ZipFileSystem;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;
import org.apache.commons.compress.utils.SeekableInMemoryByteChannel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class UnionFileSystemTest {

    private static final VfsContext CTX = VfsContext.background();

    @TempDir
    Path tempDir;

    private ZipFileSystem zip;
    private UnionFileSystem union;

    @BeforeEach
    void setUp() throws IOException {
        Files.writeString(tempDir.resolve("shared.txt"), "from disk");
        Files.writeString(tempDir.resolve("disk-only.txt"), "disk");

        zip = ZipFileSystem.open(zipOf("shared.txt", "from zip", "zip-only.txt", "zip"));
        union = UnionFileSystem.of(new LocalFileSystem(tempDir), zip);
    }

    @AfterEach
    void tearDown() throws IOException {
        zip.close();
    }

    @Test
    void firstLayerShouldWin() throws IOException {
        assertThat(read(union, "shared.txt")).isEqualTo("from disk");

        UnionFileSystem reversed = UnionFileSystem.of(zip, new LocalFileSystem(tempDir));
        assertThat(read(reversed, "shared.txt")).isEqualTo("from zip");
    }

    @Test
    void shouldFallThroughToLaterLayers() throws IOException {
        assertThat(read(union, "zip-only.txt")).isEqualTo("zip");
        FileInfo info = union.stat(CTX, "zip-only.txt");
        assertThat(info.size()).isEqualTo(3);
    }

    @Test
    void missingEverywhereShouldThrowNotFoundWithLayerDetails() {
        assertThatThrownBy(() -> union.stat(CTX, "ghost.txt"))
                .isInstanceOfSatisfying(PathNotFoundException.class, e -> {
                    assertThat(e.path()).isEqualTo("ghost.txt");
                    assertThat(e.getSuppressed()).hasSize(2);
                });
        assertThatThrownBy(() -> union.open(CTX, "ghost.txt"))
                .isInstanceOf(PathNotFoundException.class);
    }

    @Test
    void globShouldConcatenateLayersWithoutDuplicates() throws IOException {
        assertThat(union.glob(CTX, "*.txt"))
                .containsExactly("disk-only.txt", "shared.txt", "zip-only.txt");
    }

    @Test
    void otherFailuresShouldAbortLookup() {
        VfsReader broken = new VfsReader() {
            @Override
            public FileInfo stat(VfsContext ctx, String path) throws IOException {
                throw new IOException("disk on fire");
            }

            @Override
            public InputStream open(VfsContext ctx, String path) throws IOException {
                throw new IOException("disk on fire");
            }

            @Override
            public List<String> glob(VfsContext ctx, String pattern) throws IOException {
                throw new IOException("disk on fire");
            }
        };
        UnionFileSystem withBroken = UnionFileSystem.of(broken, zip);

        assertThatThrownBy(() -> withBroken.stat(CTX, "zip-only.txt")).hasMessage("disk on fire");
        assertThatThrownBy(() -> withBroken.glob(CTX, "*")).hasMessage("disk on fire");
    }

    @Test
    void emptyUnionShouldFindNothing() throws IOException {
        UnionFileSystem empty = new UnionFileSystem(List.of());

        assertThat(empty.glob(CTX, "*")).isEmpty();
        assertThatThrownBy(() -> empty.stat(CTX, "x")).isInstanceOf(PathNotFoundException.class);
    }

    // --- helpers ---

    private static String read(VfsReader reader, String path) throws IOException {
        try (InputStream in = reader.open(CTX, path)) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    /** Builds a zip from alternating name/content pairs. */
    private static SeekableInMemoryByteChannel zipOf(String... namesAndContents) throws IOException {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        try (ZipArchiveOutputStream zos = new ZipArchiveOutputStream(baos)) {
            for (int i = 0; i < namesAndContents.length; i += 2) {
                zos.putArchiveEntry(new ZipArchiveEntry(namesAndContents[i]));
                zos.write(namesAndContents[i + 1].getBytes(StandardCharsets.UTF_8));
                zos.closeArchiveEntry();
            }
        }
        return new SeekableInMemoryByteChannel(baos.toByteArray());
    }
}
