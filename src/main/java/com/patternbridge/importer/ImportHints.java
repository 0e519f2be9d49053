/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.patternbridge.importer;

/**
 * Optional caller knowledge about a file. Every field is nullable; {@code null} means
 * the value is unknown and should be detected.
 *
 * @param suggestedLeds LEDs per frame
 * @param suggestedFrames number of frames
 * @param width manual display width, applied after decoding
 * @param height manual display height, applied after decoding
 */
public record ImportHints(Integer suggestedLeds, Integer suggestedFrames, Integer width, Integer height) {

    private static final ImportHints NONE = new ImportHints(null, null, null, null);

    public static ImportHints none() {
        return NONE;
    }

    public static ImportHints ofCounts(Integer suggestedLeds, Integer suggestedFrames) {
        return new ImportHints(suggestedLeds, suggestedFrames, null, null);
    }

    public boolean hasManualDimensions() {
        return width != null || height != null;
    }
}
