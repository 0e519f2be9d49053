/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.patternbridge.layout;

import java.util.List;

/**
 * Pixel-continuity measurements behind layout scoring.
 *
 * <p>A real 2-D image has small colour deltas between a pixel and the one directly below it.
 * Reading the same bytes with the wrong row length pairs up unrelated pixels instead. The
 * continuity of a candidate width is therefore the vertical-neighbour delta measured
 * against the delta between arbitrary pixel pairs of the same frame.
 *
 * <p>Deltas are the sum of absolute channel differences (0-765).
 */
final class RectangularityMetric {

    /** Pixels sampled (evenly spaced) for the arbitrary-pair baseline. */
    private static final int BASELINE_SAMPLES = 48;

    /** Vertical pairs inspected per width; longer frames are sampled with a stride. */
    private static final int MAX_VERTICAL_PAIRS = 4096;

    private RectangularityMetric() {}

    /**
     * Mean delta between arbitrary pixel pairs of one frame.
     *
     * @return 0 when the frame has fewer than two pixels or is a single colour
     */
    static double baseline(byte[] rgb, int offset, int pixelCount) {
        int samples = Math.min(pixelCount, BASELINE_SAMPLES);
        if (samples < 2) {
            return 0.0;
        }
        int[] indices = new int[samples];
        for (int k = 0; k < samples; k++) {
            indices[k] = (int) ((long) k * pixelCount / samples);
        }
        long total = 0;
        long pairs = 0;
        for (int j = 0; j < samples; j++) {
            for (int k = j + 1; k < samples; k++) {
                total += delta(rgb, offset, indices[j], indices[k]);
                pairs++;
            }
        }
        return (double) total / pairs;
    }

    /**
     * Continuity in [0,1] of reading the frame with rows of {@code width} pixels.
     *
     * @param baseline value of {@link #baseline} for the same frame
     */
    static double continuity(byte[] rgb, int offset, int pixelCount, int width, double baseline) {
        int pairs = pixelCount - width;
        if (pairs <= 0 || baseline <= 0.0) {
            return 0.0;
        }
        int step = Math.max(1, pairs / MAX_VERTICAL_PAIRS);
        long total = 0;
        int count = 0;
        for (int i = 0; i < pairs; i += step) {
            total += delta(rgb, offset, i, i + width);
            count++;
        }
        double vertical = (double) total / count;
        return clamp(1.0 - vertical / baseline);
    }

    /**
     * Geometry-only plausibility of a layout: closeness to a preferred aspect ratio, even
     * sides, and a penalty for extremely skewed shapes.
     */
    static double shapePrior(int width, int height, List<Double> preferredRatios) {
        if (width <= 0 || height <= 0) {
            return 0.0;
        }
        double aspect = (double) width / height;
        double bonus = 0.0;
        for (double preferred : preferredRatios) {
            double diff = Math.abs(aspect - preferred) / preferred;
            if (diff <= 0.05) {
                bonus = Math.max(bonus, 0.35);
            } else if (diff <= 0.12) {
                bonus = Math.max(bonus, 0.25);
            } else if (diff <= 0.20) {
                bonus = Math.max(bonus, 0.15);
            }
        }
        double score = 0.5 + bonus;
        if (width % 2 == 0 && height % 2 == 0) {
            score += 0.1;
        }
        double skew = Math.max(aspect, 1.0 / aspect);
        if (skew > 6.0) {
            score -= 0.2;
        }
        return clamp(score);
    }

    private static int delta(byte[] rgb, int offset, int a, int b) {
        int pa = offset + a * 3;
        int pb = offset + b * 3;
        return Math.abs((rgb[pa] & 0xFF) - (rgb[pb] & 0xFF))
                + Math.abs((rgb[pa + 1] & 0xFF) - (rgb[pb + 1] & 0xFF))
                + Math.abs((rgb[pa + 2] & 0xFF) - (rgb[pb + 2] & 0xFF));
    }

    static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
