/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.patternbridge.model;

import java.util.Arrays;

/**
 * One timed snapshot of all LED colours.
 *
 * <p>Pixels are kept as packed RGB bytes (3 per LED). The array is copied on the way in and
 * on the way out, so a frame never changes after construction.
 */
public final class Frame {

    private final byte[] rgb;
    private final int durationMs;

    /**
     * @param rgb packed RGB bytes, length a multiple of 3
     * @param durationMs display time in milliseconds, at least 1
     */
    public Frame(byte[] rgb, int durationMs) {
        if (rgb == null || rgb.length == 0 || rgb.length % 3 != 0) {
            throw new IllegalArgumentException("Frame pixel data must be a non-empty multiple of 3 bytes, got "
                    + (rgb == null ? "null" : rgb.length + " bytes"));
        }
        if (durationMs < 1) {
            throw new IllegalArgumentException("Frame duration must be positive: " + durationMs);
        }
        this.rgb = rgb.clone();
        this.durationMs = durationMs;
    }

    /**
     * Build a frame from a region of a larger buffer.
     *
     * @param data source buffer
     * @param offset byte offset of the first red channel
     * @param ledCount number of pixels to take
     * @param durationMs display time
     */
    public static Frame slice(byte[] data, int offset, int ledCount, int durationMs) {
        int length = ledCount * 3;
        if (offset < 0 || ledCount < 1 || offset + length > data.length) {
            throw new IllegalArgumentException(String.format(
                    "Cannot read %d pixels at offset %d from %d bytes", ledCount, offset, data.length));
        }
        return new Frame(Arrays.copyOfRange(data, offset, offset + length), durationMs);
    }

    public int getLedCount() {
        return rgb.length / 3;
    }

    public int getDurationMs() {
        return durationMs;
    }

    public Rgb getPixel(int index) {
        if (index < 0 || index >= getLedCount()) {
            throw new IndexOutOfBoundsException("Pixel " + index + " outside 0.." + (getLedCount() - 1));
        }
        int base = index * 3;
        return new Rgb(rgb[base] & 0xFF, rgb[base + 1] & 0xFF, rgb[base + 2] & 0xFF);
    }

    /** Packed RGB bytes (a copy). */
    public byte[] toBytes() {
        return rgb.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Frame)) return false;
        Frame other = (Frame) o;
        return durationMs == other.durationMs && Arrays.equals(rgb, other.rgb);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(rgb) + durationMs;
    }

    @Override
    public String toString() {
        return "Frame{leds=" + getLedCount() + ", durationMs=" + durationMs + "}";
    }
}
