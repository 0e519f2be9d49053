/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.patternbridge.model;

import java.util.List;
import java.util.Objects;

/**
 * A complete LED animation: ordered frames plus metadata.
 *
 * <p>All frames share one LED count, and metadata width x height matches it whenever both
 * are set. Patterns are immutable; {@link #withName(String)} and
 * {@link #withMetadata(PatternMetadata)} return new instances sharing the frames.
 */
public final class Pattern {

    private final String name;
    private final PatternMetadata metadata;
    private final List<Frame> frames;

    public Pattern(String name, PatternMetadata metadata, List<Frame> frames) {
        Objects.requireNonNull(metadata, "metadata");
        if (frames == null || frames.isEmpty()) {
            throw new IllegalArgumentException("Pattern needs at least one frame");
        }
        int expectedLeds = frames.get(0).getLedCount();
        for (int i = 1; i < frames.size(); i++) {
            int leds = frames.get(i).getLedCount();
            if (leds != expectedLeds) {
                throw new IllegalArgumentException(String.format(
                        "Frame %d has %d LEDs, expected %d", i, leds, expectedLeds));
            }
        }
        int width = metadata.getWidth();
        int height = metadata.getHeight();
        if (width > 0 && height > 0 && width * height != expectedLeds) {
            throw new IllegalArgumentException(String.format(
                    "Layout %dx%d does not match %d LEDs", width, height, expectedLeds));
        }
        this.name = name != null ? name : "Untitled Pattern";
        this.metadata = metadata;
        this.frames = List.copyOf(frames);
    }

    public String getName() { return name; }
    public PatternMetadata getMetadata() { return metadata; }
    public List<Frame> getFrames() { return frames; }

    public int getLedCount() {
        return frames.get(0).getLedCount();
    }

    public int getFrameCount() {
        return frames.size();
    }

    /** Total display time of one pass through the animation. */
    public long getDurationMs() {
        long total = 0;
        for (Frame frame : frames) {
            total += frame.getDurationMs();
        }
        return total;
    }

    public double getAverageFps() {
        long duration = getDurationMs();
        if (duration == 0) {
            return 0.0;
        }
        return frames.size() * 1000.0 / duration;
    }

    public Pattern withName(String newName) {
        return new Pattern(newName, metadata, frames);
    }

    public Pattern withMetadata(PatternMetadata newMetadata) {
        return new Pattern(name, newMetadata, frames);
    }

    @Override
    public String toString() {
        return "Pattern{name='" + name + "', leds=" + getLedCount() + ", frames=" + frames.size()
                + ", " + metadata + "}";
    }
}
