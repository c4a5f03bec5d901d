package com.libragraph.formatstreams.api;

import java.util.Arrays;
import java.util.Set;

/**
 * Criteria for recognizing a format from its bytes or name.
 *
 * @param mimeTypes    MIME types to match (e.g., "application/x-fvec", "text/*")
 * @param extensions   File extensions without dot (e.g., "fvec", "txt")
 * @param magicBytes   Magic bytes to match, or null if not applicable
 * @param magicOffset  Offset in header where magic bytes start
 * @param priority     Higher priority wins on conflict
 */
public record DetectionCriteria(
        Set<String> mimeTypes,
        Set<String> extensions,
        byte[] magicBytes,
        int magicOffset,
        int priority
) {
    public DetectionCriteria {
        mimeTypes = Set.copyOf(mimeTypes);
        extensions = Set.copyOf(extensions);
        if (magicBytes != null) {
            magicBytes = Arrays.copyOf(magicBytes, magicBytes.length);
        }
        if (magicOffset < 0) {
            throw new IllegalArgumentException("Negative magic offset: " + magicOffset);
        }
    }

    /**
     * Criteria matching on file extension only.
     */
    public static DetectionCriteria byExtension(int priority, String... extensions) {
        return new DetectionCriteria(Set.of(), Set.of(extensions), null, 0, priority);
    }

    /**
     * Checks if this criteria matches the given properties. Any of the three may be null.
     */
    public boolean matches(String mimeType, String filename, byte[] header) {
        if (magicBytes != null && header != null && matchesMagic(header)) {
            return true;
        }

        if (mimeType != null) {
            if (mimeTypes.contains(mimeType)) {
                return true;
            }
            String baseType = mimeType.split("/")[0];
            if (mimeTypes.contains(baseType + "/*")) {
                return true;
            }
        }

        if (filename != null) {
            int dotIndex = filename.lastIndexOf('.');
            if (dotIndex > 0) {
                String ext = filename.substring(dotIndex + 1).toLowerCase();
                return extensions.contains(ext);
            }
        }

        return false;
    }

    private boolean matchesMagic(byte[] header) {
        int endOffset = magicOffset + magicBytes.length;
        if (header.length < endOffset) {
            return false;
        }
        for (int i = 0; i < magicBytes.length; i++) {
            if (header[magicOffset + i] != magicBytes[i]) {
                return false;
            }
        }
        return true;
    }
}
