/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.patternbridge.layout;

/**
 * A width x height hypothesis with its score in [0,1].
 *
 * @param width LEDs per row
 * @param height rows (1 for a strip)
 * @param score confidence that the pixels really form this layout
 */
public record LayoutCandidate(int width, int height, double score) {

    public boolean isStrip() {
        return height == 1;
    }
}
