/**
 * Shared utilities for all Format Streams modules.
 *
 * <p>Contains the {@link com.libragraph.formatstreams.util.buffer buffer layer}
 * (BinaryData, Buffer, RamBuffer, FileBuffer) that concrete streams use as a seekable
 * backing store. No framework dependencies, pure Java.
 */
package com.libragraph.formatstreams.util;
