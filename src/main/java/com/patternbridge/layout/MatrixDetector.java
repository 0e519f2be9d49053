/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.patternbridge.layout;

import com.patternbridge.config.ImportSettings;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Finds the most plausible width x height for a fixed pixel count.
 *
 * <p>Every divisor pair with both sides of at least 2 is scored as
 * {@code 0.75 * continuity + 0.25 * shapePrior}, where continuity comes from the sampled
 * frame pixels (see {@link RectangularityMetric}) and the shape prior looks at geometry only.
 * Without pixel data the score is {@code 0.6 * shapePrior}, which never clears the
 * acceptance threshold on its own.
 *
 * <p>Selection:
 * <ol>
 *   <li>the best 2-D pair if its score reaches the acceptance threshold;</li>
 *   <li>otherwise the 1-row strip, when strips are allowed;</li>
 *   <li>otherwise the best 2-D pair if it reaches the minimum score;</li>
 *   <li>otherwise nothing.</li>
 * </ol>
 * Equal scores keep enumeration order, widest layout first, so results are deterministic.
 *
 * <p>Instances are immutable and thread-safe.
 */
public class MatrixDetector {

    private static final double CONTINUITY_WEIGHT = 0.75;
    private static final double PRIOR_WEIGHT = 0.25;
    private static final double PRIOR_ONLY_WEIGHT = 0.6;

    private final ImportSettings settings;

    public MatrixDetector() {
        this(ImportSettings.defaults());
    }

    public MatrixDetector(ImportSettings settings) {
        this.settings = settings;
    }

    /**
     * Best 2-D layout for a single frame, strips excluded.
     *
     * @param pixelCount LEDs per frame
     * @param sampleFramePixels packed RGB bytes of one frame, or null
     */
    public Optional<LayoutCandidate> pickBestDimensions(int pixelCount, byte[] sampleFramePixels) {
        return pickBestDimensions(pixelCount, sampleFramePixels, 0, false);
    }

    /**
     * Best layout for one frame stored at {@code offset} inside a larger buffer.
     */
    public Optional<LayoutCandidate> pickBestDimensions(int pixelCount, byte[] rgb, int offset,
                                                        boolean includeStrips) {
        return pickBestDimensions(pixelCount, rgb, new int[] {offset}, includeStrips);
    }

    /**
     * Best layout with continuity averaged over several frames of the same buffer.
     *
     * @param pixelCount LEDs per frame
     * @param rgb buffer holding the frames, or null when no pixels are available
     * @param frameOffsets byte offsets of the frames to sample; out-of-range offsets are ignored
     * @param includeStrips whether a 1-row strip may be returned
     */
    public Optional<LayoutCandidate> pickBestDimensions(int pixelCount, byte[] rgb, int[] frameOffsets,
                                                        boolean includeStrips) {
        if (pixelCount < 1) {
            return Optional.empty();
        }
        List<LayoutCandidate> grid = scoreGridLayouts(pixelCount, rgb, frameOffsets);
        LayoutCandidate best = grid.isEmpty() ? null : grid.get(0);

        if (best != null && best.score() >= settings.getLayoutAcceptThreshold()) {
            return Optional.of(best);
        }
        if (includeStrips) {
            return Optional.of(strip(pixelCount));
        }
        if (best != null && best.score() >= settings.getLayoutMinScore()) {
            return Optional.of(best);
        }
        return Optional.empty();
    }

    /**
     * All scored layouts, best first.
     *
     * @param limit maximum number of candidates returned, or 0 for all
     */
    public List<LayoutCandidate> generateCandidates(int pixelCount, byte[] rgb, int offset,
                                                    boolean includeStrips, int limit) {
        if (pixelCount < 1) {
            return List.of();
        }
        List<LayoutCandidate> candidates = new ArrayList<>(scoreGridLayouts(pixelCount, rgb, new int[] {offset}));
        if (includeStrips) {
            candidates.add(strip(pixelCount));
            candidates.sort(Comparator.comparingDouble(LayoutCandidate::score).reversed());
        }
        if (limit > 0 && candidates.size() > limit) {
            return List.copyOf(candidates.subList(0, limit));
        }
        return List.copyOf(candidates);
    }

    /**
     * Sanity warnings for a layout. An empty list means the layout is fine.
     */
    public List<String> validateLayout(int width, int height, int ledCount) {
        List<String> warnings = new ArrayList<>();
        if (width <= 0 || height <= 0) {
            warnings.add("Invalid dimensions " + width + "x" + height);
            return warnings;
        }
        if (width * height != ledCount) {
            warnings.add(String.format("Dimension mismatch: %dx%d != %d LEDs", width, height, ledCount));
        }
        if (width > 100 || height > 100) {
            warnings.add(String.format("Very large matrix (%dx%d)", width, height));
        }
        if (height > 1) {
            double aspect = (double) width / height;
            if (aspect > 10 || aspect < 0.1) {
                warnings.add(String.format("Unusual aspect ratio (%.2f)", aspect));
            }
        }
        return warnings;
    }

    private LayoutCandidate strip(int pixelCount) {
        return new LayoutCandidate(pixelCount, 1, settings.getStripScore());
    }

    private List<LayoutCandidate> scoreGridLayouts(int pixelCount, byte[] rgb, int[] frameOffsets) {
        int[] offsets = usableOffsets(pixelCount, rgb, frameOffsets);
        double[] baselines = new double[offsets.length];
        for (int i = 0; i < offsets.length; i++) {
            baselines[i] = RectangularityMetric.baseline(rgb, offsets[i], pixelCount);
        }

        List<LayoutCandidate> candidates = new ArrayList<>();
        for (int width = pixelCount / 2; width >= 2; width--) {
            if (pixelCount % width != 0) {
                continue;
            }
            int height = pixelCount / width;
            if (height < 2) {
                continue;
            }
            double prior = RectangularityMetric.shapePrior(width, height, settings.getPreferredAspectRatios());
            double score;
            if (offsets.length == 0) {
                score = PRIOR_ONLY_WEIGHT * prior;
            } else {
                double continuity = 0.0;
                for (int i = 0; i < offsets.length; i++) {
                    continuity += RectangularityMetric.continuity(rgb, offsets[i], pixelCount, width, baselines[i]);
                }
                continuity /= offsets.length;
                score = CONTINUITY_WEIGHT * continuity + PRIOR_WEIGHT * prior;
            }
            candidates.add(new LayoutCandidate(width, height, RectangularityMetric.clamp(score)));
        }
        // List.sort is stable: equal scores keep the widest-first enumeration order
        candidates.sort(Comparator.comparingDouble(LayoutCandidate::score).reversed());
        return candidates;
    }

    private static int[] usableOffsets(int pixelCount, byte[] rgb, int[] frameOffsets) {
        if (rgb == null || frameOffsets == null) {
            return new int[0];
        }
        long frameBytes = (long) pixelCount * 3;
        return Arrays.stream(frameOffsets)
                .filter(offset -> offset >= 0 && offset + frameBytes <= rgb.length)
                .distinct()
                .toArray();
    }
}
