/**
 * Pure Java value types shared across all Format Streams modules.
 *
 * <p>{@link com.libragraph.formatstreams.types.FormatId} and
 * {@link com.libragraph.formatstreams.types.CodingId} are opaque media-type-style keys.
 * Nothing in the library interprets their structure. No framework dependencies.
 */
package com.libragraph.formatstreams.types;
