/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.patternbridge.parsers;

import com.patternbridge.config.ImportSettings;
import com.patternbridge.layout.DimensionResolution;
import com.patternbridge.layout.DimensionScorer;
import com.patternbridge.model.DimensionSource;
import com.patternbridge.model.Frame;
import com.patternbridge.model.Pattern;
import com.patternbridge.model.PatternMetadata;
import com.patternbridge.utils.LoggerUtil;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decoder for headerless RGB data: {@code led_count * frame_count} packed triples.
 *
 * <p>The only hard constraint is a length divisible by 3, so this decoder accepts almost
 * anything and is registered last. LED and frame counts come from the caller's hints when
 * given; otherwise they are inferred from a table of common strip lengths, then from an
 * exact square, then from pixel content via {@link DimensionScorer}.
 */
public class RawRgbParser implements PatternParser {

    private static final int CONFIDENCE_SAMPLE_BYTES = 300;
    private static final double GRID_GUESS_CONFIDENCE = 0.5;

    private final ImportSettings settings;
    private final DimensionScorer scorer;

    public RawRgbParser() {
        this(ImportSettings.defaults());
    }

    public RawRgbParser(ImportSettings settings) {
        this.settings = settings;
        this.scorer = new DimensionScorer(settings);
    }

    @Override
    public boolean detect(byte[] data, String filename, Integer suggestedLeds, Integer suggestedFrames) {
        if (data == null || data.length == 0 || data.length % 3 != 0) {
            return false;
        }
        if (suggestedLeds != null && suggestedFrames != null) {
            return (long) suggestedLeds * suggestedFrames == data.length / 3;
        }
        return true;
    }

    /**
     * Byte variety of the first {@value #CONFIDENCE_SAMPLE_BYTES} bytes: colour data tends
     * to use many distinct values.
     */
    @Override
    public double getConfidence(byte[] data) {
        if (data == null || data.length == 0 || data.length % 3 != 0) {
            return 0.0;
        }
        boolean[] seen = new boolean[256];
        int distinct = 0;
        int limit = Math.min(data.length, CONFIDENCE_SAMPLE_BYTES);
        for (int i = 0; i < limit; i++) {
            int value = data[i] & 0xFF;
            if (!seen[value]) {
                seen[value] = true;
                distinct++;
            }
        }
        if (distinct > 50) {
            return 0.4;
        }
        if (distinct > 20) {
            return 0.3;
        }
        return 0.1;
    }

    @Override
    public Pattern parse(byte[] data, Integer suggestedLeds, Integer suggestedFrames) throws PatternImportException {
        if (data == null || data.length == 0) {
            throw new PatternImportException.MalformedRecordException("No RGB data");
        }
        if (data.length % 3 != 0) {
            throw new PatternImportException.MalformedRecordException(String.format(
                    "Raw RGB data must be a multiple of 3 bytes, got %d bytes", data.length));
        }
        ParserSupport.requirePositiveHint("LED count", suggestedLeds);
        ParserSupport.requirePositiveHint("frame count", suggestedFrames);

        int totalPixels = data.length / 3;
        DimensionResolution resolution = resolveDimensions(data, totalPixels, suggestedLeds, suggestedFrames);

        int ledCount = resolution.ledCount();
        int duration = settings.getDefaultFrameDurationMs();
        List<Frame> frames = new ArrayList<>(resolution.frames());
        for (int i = 0; i < resolution.frames(); i++) {
            frames.add(Frame.slice(data, i * ledCount * 3, ledCount, duration));
        }
        return new Pattern(null, metadataFor(resolution), frames);
    }

    @Override
    public String getFormatName() {
        return "Raw RGB";
    }

    @Override
    public String getFormatDescription() {
        return "Headerless RGB triples, LED and frame counts given or inferred";
    }

    /**
     * LED count, frame count and shape for the buffer. A resolution with zero width means
     * the shape has to be guessed from the LED count alone.
     */
    private DimensionResolution resolveDimensions(byte[] data, int totalPixels, Integer suggestedLeds,
                                                  Integer suggestedFrames) throws PatternImportException {
        if (suggestedLeds != null && suggestedFrames != null) {
            if ((long) suggestedLeds * suggestedFrames != totalPixels) {
                throw new PatternImportException.MalformedRecordException(String.format(
                        "Size mismatch: %d LEDs x %d frames = %d pixels, data has %d pixels (%d bytes)",
                        suggestedLeds, suggestedFrames, (long) suggestedLeds * suggestedFrames,
                        totalPixels, data.length));
            }
            return unshaped(suggestedLeds, suggestedFrames);
        }
        if (suggestedLeds != null) {
            if (totalPixels % suggestedLeds != 0) {
                throw new PatternImportException.MalformedRecordException(String.format(
                        "%d pixels (%d bytes) is not a whole number of frames of %d LEDs",
                        totalPixels, data.length, suggestedLeds));
            }
            return unshaped(suggestedLeds, totalPixels / suggestedLeds);
        }
        if (suggestedFrames != null) {
            if (totalPixels % suggestedFrames != 0) {
                throw new PatternImportException.MalformedRecordException(String.format(
                        "%d pixels (%d bytes) cannot be split into %d equal frames",
                        totalPixels, data.length, suggestedFrames));
            }
            return unshaped(totalPixels / suggestedFrames, suggestedFrames);
        }

        Optional<DimensionResolution> common = fromCommonLedCounts(totalPixels);
        if (common.isPresent()) {
            return common.get();
        }
        int side = (int) Math.round(Math.sqrt(totalPixels));
        if (side * side == totalPixels) {
            LoggerUtil.debug(() -> "[RawRgbParser] " + totalPixels + " pixels is a square, reading one frame");
            return unshaped(totalPixels, 1);
        }

        Optional<DimensionResolution> scored = scorer.inferLedsAndFrames(
                totalPixels, true, data, settings.getCommonLedCounts());
        if (scored.isPresent() && scored.get().confidence() >= settings.getScorerAcceptThreshold()) {
            return scored.get();
        }
        throw new PatternImportException.AmbiguousDimensionsException(totalPixels);
    }

    private Optional<DimensionResolution> fromCommonLedCounts(int totalPixels) {
        int bestLeds = 0;
        int bestFrames = 0;
        int bestTier = 0;
        for (int ledCount : settings.getCommonLedCounts()) {
            if (totalPixels % ledCount != 0) {
                continue;
            }
            int frames = totalPixels / ledCount;
            if (frames < 2) {
                continue;
            }
            int tier = DimensionScorer.frameTier(frames);
            if (tier > bestTier || (tier == bestTier && frames > bestFrames)) {
                bestTier = tier;
                bestLeds = ledCount;
                bestFrames = frames;
            }
        }
        if (bestTier == 0) {
            return Optional.empty();
        }
        return Optional.of(unshaped(bestLeds, bestFrames));
    }

    private static DimensionResolution unshaped(int ledCount, int frames) {
        return new DimensionResolution(ledCount, 0, 0, frames, 0.0);
    }

    private PatternMetadata metadataFor(DimensionResolution resolution) {
        if (resolution.width() > 0) {
            return PatternMetadata.builder()
                    .dimensions(resolution.width(), resolution.height())
                    .dimensionSource(DimensionSource.DETECTOR, resolution.confidence())
                    .build();
        }
        int ledCount = resolution.ledCount();
        int[] shape = guessShape(ledCount);
        double confidence = shape[1] > 1 ? GRID_GUESS_CONFIDENCE : ParserSupport.FALLBACK_STRIP_CONFIDENCE;
        return PatternMetadata.builder()
                .dimensions(shape[0], shape[1])
                .dimensionSource(DimensionSource.FALLBACK, confidence)
                .build();
    }

    /**
     * Width x height from the preferred-width table, else the most square factor pair,
     * else a single row.
     */
    int[] guessShape(int ledCount) {
        for (int width : settings.getPreferredWidths()) {
            if (width < ledCount && ledCount % width == 0) {
                return new int[] {width, ledCount / width};
            }
        }
        for (int height = (int) Math.sqrt(ledCount); height >= 2; height--) {
            if (ledCount % height == 0) {
                return new int[] {ledCount / height, height};
            }
        }
        return new int[] {ledCount, 1};
    }
}
