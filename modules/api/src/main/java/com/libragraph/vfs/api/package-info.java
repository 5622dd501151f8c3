/**
 * The VFS capability contract ({@link com.libragraph.vfs.api.VfsReader}) and the
 * value and exception types shared by its implementations.
 */
package com.libragraph.vfs.api;
