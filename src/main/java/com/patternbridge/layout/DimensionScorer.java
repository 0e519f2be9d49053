/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.patternbridge.layout;

import com.patternbridge.config.ImportSettings;
import com.patternbridge.utils.LoggerUtil;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Jointly infers LED count, frame count and display shape for a headerless pixel stream.
 *
 * <p>Every divisor {@code L} of the total pixel count (up to the configured maximum LED count)
 * is tried as the LED count. Its layout score comes from {@link MatrixDetector} applied to
 * the first, middle and last implied frame. The frame-count plausibility uses the tiers
 * shared with the raw RGB decoder. The two are combined as
 * {@code 0.8 * layout + 0.2 * framePlausibility}; the best total wins, and ties go to the
 * smaller LED count (more frames).
 */
public class DimensionScorer {

    private static final double LAYOUT_WEIGHT = 0.8;
    private static final double FRAME_WEIGHT = 0.2;
    private static final double PREFERRED_COUNT_BONUS = 0.03;
    private static final double MAX_CONFIDENCE = 0.99;

    private final MatrixDetector detector;
    private final ImportSettings settings;

    public DimensionScorer() {
        this(ImportSettings.defaults());
    }

    public DimensionScorer(ImportSettings settings) {
        this(new MatrixDetector(settings), settings);
    }

    public DimensionScorer(MatrixDetector detector, ImportSettings settings) {
        this.detector = detector;
        this.settings = settings;
    }

    /**
     * Frame-count plausibility tier: 3 for 10-240 frames, 2 for 5-480, 1 for any other
     * count of at least 2, and 0 for a single frame.
     */
    public static int frameTier(int frames) {
        if (frames < 2) {
            return 0;
        }
        if (frames >= 10 && frames <= 240) {
            return 3;
        }
        if (frames >= 5 && frames <= 480) {
            return 2;
        }
        return 1;
    }

    static double framePlausibility(int frames) {
        return switch (frameTier(frames)) {
            case 3 -> 1.0;
            case 2 -> 0.8;
            case 1 -> 0.5;
            default -> 0.2;
        };
    }

    /**
     * @param totalPixels number of RGB triples in the stream
     * @param includeStrips whether 1-row layouts (and layouts thinner than 3) are acceptable
     * @param pixelBytes the packed RGB stream, or null to score geometry only
     * @param preferredLedCounts LED counts given a small bonus, may be empty
     * @return the best combination, or empty if no divisor yields a layout
     */
    public Optional<DimensionResolution> inferLedsAndFrames(int totalPixels, boolean includeStrips,
                                                            byte[] pixelBytes,
                                                            Collection<Integer> preferredLedCounts) {
        if (totalPixels <= 0) {
            return Optional.empty();
        }
        Collection<Integer> preferred = preferredLedCounts != null ? preferredLedCounts : List.of();

        DimensionResolution best = null;
        double bestScore = -1.0;
        int maxLeds = Math.min(totalPixels, settings.getMaxLedCount());

        for (int ledCount = 2; ledCount <= maxLeds; ledCount++) {
            if (totalPixels % ledCount != 0) {
                continue;
            }
            int frames = totalPixels / ledCount;

            Optional<LayoutCandidate> layout = detector.pickBestDimensions(
                    ledCount, pixelBytes, sampleOffsets(ledCount, frames), includeStrips);
            if (layout.isEmpty()) {
                continue;
            }
            LayoutCandidate candidate = layout.get();
            if (!includeStrips && Math.min(candidate.width(), candidate.height()) < 3) {
                continue;
            }

            double layoutScore = candidate.score();
            if (preferred.contains(ledCount)) {
                layoutScore = Math.min(MAX_CONFIDENCE, layoutScore + PREFERRED_COUNT_BONUS);
            }
            double total = LAYOUT_WEIGHT * layoutScore + FRAME_WEIGHT * framePlausibility(frames);

            if (total > bestScore) {
                best = new DimensionResolution(ledCount, candidate.width(), candidate.height(), frames,
                        Math.min(MAX_CONFIDENCE, total));
                bestScore = total;
            }
        }

        if (best != null) {
            DimensionResolution chosen = best;
            LoggerUtil.debug(() -> String.format(
                    "[DimensionScorer] %d pixels -> %d LEDs (%dx%d) x %d frames, confidence %.3f",
                    totalPixels, chosen.ledCount(), chosen.width(), chosen.height(), chosen.frames(),
                    chosen.confidence()));
        }
        return Optional.ofNullable(best);
    }

    private static int[] sampleOffsets(int ledCount, int frames) {
        int frameBytes = ledCount * 3;
        if (frames <= 1) {
            return new int[] {0};
        }
        if (frames == 2) {
            return new int[] {0, frameBytes};
        }
        return new int[] {0, (frames / 2) * frameBytes, (frames - 1) * frameBytes};
    }
}
