/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.patternbridge.layout;

/**
 * Joint answer for a headerless pixel stream: how many LEDs per frame, how many frames and
 * which display shape.
 */
public record DimensionResolution(int ledCount, int width, int height, int frames, double confidence) {
}
