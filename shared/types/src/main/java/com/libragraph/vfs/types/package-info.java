/**
 * Pure Java value types shared across all VFS modules.
 *
 * <p>No framework dependencies.
 */
package com.libragraph.vfs.types;
