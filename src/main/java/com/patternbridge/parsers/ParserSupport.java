/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.patternbridge.parsers;

import com.patternbridge.layout.LayoutCandidate;
import com.patternbridge.model.DimensionSource;
import com.patternbridge.model.PatternMetadata;

/**
 * Byte-level helpers shared by the binary decoders.
 */
final class ParserSupport {

    static final double FALLBACK_STRIP_CONFIDENCE = 0.2;

    private ParserSupport() {}

    static int readU16LE(byte[] data, int offset) {
        return (data[offset] & 0xFF) | ((data[offset + 1] & 0xFF) << 8);
    }

    /**
     * Rejects non-positive hints; {@code null} passes.
     */
    static void requirePositiveHint(String name, Integer hint) throws PatternImportException {
        if (hint != null && hint <= 0) {
            throw new PatternImportException.MalformedRecordException(
                    "Invalid " + name + " hint: " + hint + " (must be positive)");
        }
    }

    /**
     * Hint agrees with the value a header declares, or no hint was given.
     */
    static boolean hintMatches(Integer hint, int actual) {
        return hint == null || hint == actual;
    }

    static void requireHintMatches(String name, Integer hint, int actual) throws PatternImportException {
        requirePositiveHint(name, hint);
        if (!hintMatches(hint, actual)) {
            throw new PatternImportException.MalformedRecordException(String.format(
                    "Suggested %s %d does not match %d found in the file", name, hint, actual));
        }
    }

    /**
     * Metadata for a detector result, or a 1-row strip when detection found nothing.
     */
    static PatternMetadata shapeMetadata(LayoutCandidate layout, int ledCount) {
        PatternMetadata.Builder builder = PatternMetadata.builder();
        if (layout != null) {
            builder.dimensions(layout.width(), layout.height())
                    .dimensionSource(DimensionSource.DETECTOR, layout.score());
        } else {
            builder.dimensions(ledCount, 1)
                    .dimensionSource(DimensionSource.FALLBACK, FALLBACK_STRIP_CONFIDENCE);
        }
        return builder.build();
    }
}
