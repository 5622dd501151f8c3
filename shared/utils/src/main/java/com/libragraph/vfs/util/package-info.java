/**
 * Shared utilities for all VFS modules.
 *
 * <p>Contains the {@link com.libragraph.vfs.util.channel channel layer}
 * (PositionedReader, SerializedReader) and the
 * {@link com.libragraph.vfs.util.glob glob matcher}.
 * No framework dependencies.
 */
package com.libragraph.vfs.util;
