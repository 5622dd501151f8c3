package com.libragraph.vfs.core.union;

import com.libragraph.vfs.api.*;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.NoSuchFileException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Read-only union of several {@link VfsReader}s.
 *
 * <p>Layers are consulted in order: {@code stat} and {@code open} answer from the
 * first layer that has the path, and {@code glob} concatenates every layer's
 * matches, keeping the first occurrence of each path. A layer failing with
 * anything other than a missing path aborts the call.
 */
public final class UnionFileSystem implements VfsReader {

    private final List<VfsReader> layers;

    public UnionFileSystem(List<? extends VfsReader> layers) {
        this.layers = List.copyOf(layers);
    }

    public static UnionFileSystem of(VfsReader... layers) {
        return new UnionFileSystem(List.of(layers));
    }

    @Override
    public FileInfo stat(VfsContext ctx, String path) throws IOException {
        List<NoSuchFileException> misses = new ArrayList<>();
        for (VfsReader layer : layers) {
            try {
                return layer.stat(ctx, path);
            } catch (NoSuchFileException e) {
                misses.add(e);
            }
        }
        throw notFound(path, misses);
    }

    @Override
    public InputStream open(VfsContext ctx, String path) throws IOException {
        List<NoSuchFileException> misses = new ArrayList<>();
        for (VfsReader layer : layers) {
            try {
                return layer.open(ctx, path);
            } catch (NoSuchFileException e) {
                misses.add(e);
            }
        }
        throw notFound(path, misses);
    }

    @Override
    public List<String> glob(VfsContext ctx, String pattern) throws IOException {
        Set<String> matches = new LinkedHashSet<>();
        for (VfsReader layer : layers) {
            matches.addAll(layer.glob(ctx, pattern));
        }
        return List.copyOf(matches);
    }

    private static PathNotFoundException notFound(String path, List<NoSuchFileException> misses) {
        PathNotFoundException e = new PathNotFoundException(path);
        for (NoSuchFileException miss : misses) {
            e.addSuppressed(miss);
        }
        return e;
    }
}
