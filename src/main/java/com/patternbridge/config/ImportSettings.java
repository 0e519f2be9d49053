/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.patternbridge.config;

import com.patternbridge.utils.LoggerUtil;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Heuristic tables and thresholds used by the decoders and layout detection.
 *
 * <p>Configuration properties (all optional):
 * <ul>
 *   <li>raw.common.led.counts - LED counts tried for headerless RGB data</li>
 *   <li>raw.preferred.widths - display widths tried for the width x height guess</li>
 *   <li>raw.scorer.accept.threshold - minimum DimensionScorer confidence (default: 0.55)</li>
 *   <li>layout.preferred.aspect.ratios - width/height ratios favoured by the shape prior</li>
 *   <li>layout.accept.threshold - score a 2-D layout needs to beat a strip (default: 0.6)</li>
 *   <li>layout.min.score - lowest score a layout may be reported with (default: 0.35)</li>
 *   <li>layout.strip.score - score given to a 1-row strip (default: 0.4)</li>
 *   <li>layout.max.led.count - largest LED count considered per frame (default: 10000)</li>
 *   <li>enhanced.max.frame.header.bytes - longest per-frame header searched (default: 128)</li>
 *   <li>frame.default.duration.ms - duration for frames without one (default: 20)</li>
 *   <li>log.debug.enabled - turn on debug logging (default: false)</li>
 * </ul>
 *
 * <p>Instances are immutable.
 */
public final class ImportSettings {

    public static final String RESOURCE_NAME = "pattern-import.properties";

    static final List<Integer> DEFAULT_COMMON_LED_COUNTS =
            List.of(64, 72, 76, 96, 100, 120, 144, 150, 160, 192, 256, 300, 320, 400, 512);
    static final List<Integer> DEFAULT_PREFERRED_WIDTHS = List.of(12, 16, 8, 10, 20, 24, 32);
    static final List<Double> DEFAULT_ASPECT_RATIOS =
            List.of(1.0, 16.0 / 9.0, 4.0 / 3.0, 1.5, 2.0, 8.0 / 3.0, 3.0, 4.0, 0.5, 0.75);

    private final List<Integer> commonLedCounts;
    private final List<Integer> preferredWidths;
    private final List<Double> preferredAspectRatios;
    private final double scorerAcceptThreshold;
    private final double layoutAcceptThreshold;
    private final double layoutMinScore;
    private final double stripScore;
    private final int maxLedCount;
    private final int maxFrameHeaderBytes;
    private final int defaultFrameDurationMs;
    private final boolean debugLogging;

    private ImportSettings(Properties config) {
        this.commonLedCounts = parseIntList(config, "raw.common.led.counts", DEFAULT_COMMON_LED_COUNTS);
        this.preferredWidths = parseIntList(config, "raw.preferred.widths", DEFAULT_PREFERRED_WIDTHS);
        this.preferredAspectRatios = parseDoubleList(config, "layout.preferred.aspect.ratios", DEFAULT_ASPECT_RATIOS);
        this.scorerAcceptThreshold = parseUnitDouble(config, "raw.scorer.accept.threshold", 0.55);
        this.layoutAcceptThreshold = parseUnitDouble(config, "layout.accept.threshold", 0.6);
        this.layoutMinScore = parseUnitDouble(config, "layout.min.score", 0.35);
        this.stripScore = parseUnitDouble(config, "layout.strip.score", 0.4);
        this.maxLedCount = parsePositiveInt(config, "layout.max.led.count", 10000);
        this.maxFrameHeaderBytes = parsePositiveInt(config, "enhanced.max.frame.header.bytes", 128);
        this.defaultFrameDurationMs = parsePositiveInt(config, "frame.default.duration.ms", 20);
        this.debugLogging = Boolean.parseBoolean(config.getProperty("log.debug.enabled", "false").trim());
    }

    /**
     * Load settings from {@value #RESOURCE_NAME} on the classpath. Missing resource means
     * built-in defaults.
     */
    public static ImportSettings defaults() {
        Properties props = new Properties();
        try (InputStream in = ImportSettings.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            LoggerUtil.warn("[ImportSettings] Could not read " + RESOURCE_NAME + ": " + e.getMessage()
                    + ", using built-in defaults");
        }
        return fromProperties(props);
    }

    /**
     * Build settings from explicit properties; keys that are absent or invalid keep their defaults.
     */
    public static ImportSettings fromProperties(Properties config) {
        ImportSettings settings = new ImportSettings(config != null ? config : new Properties());
        if (settings.debugLogging) {
            LoggerUtil.setDebugEnabled(true);
        }
        return settings;
    }

    public List<Integer> getCommonLedCounts() { return commonLedCounts; }
    public List<Integer> getPreferredWidths() { return preferredWidths; }
    public List<Double> getPreferredAspectRatios() { return preferredAspectRatios; }
    public double getScorerAcceptThreshold() { return scorerAcceptThreshold; }
    public double getLayoutAcceptThreshold() { return layoutAcceptThreshold; }
    public double getLayoutMinScore() { return layoutMinScore; }
    public double getStripScore() { return stripScore; }
    public int getMaxLedCount() { return maxLedCount; }
    public int getMaxFrameHeaderBytes() { return maxFrameHeaderBytes; }
    public int getDefaultFrameDurationMs() { return defaultFrameDurationMs; }
    public boolean isDebugLogging() { return debugLogging; }

    private static List<Integer> parseIntList(Properties config, String key, List<Integer> defaultValue) {
        String value = config.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        List<Integer> result = new ArrayList<>();
        for (String part : value.split(",")) {
            String token = part.trim();
            if (token.isEmpty()) continue;
            try {
                int parsed = Integer.parseInt(token);
                if (parsed <= 0) {
                    throw new NumberFormatException("not positive");
                }
                result.add(parsed);
            } catch (NumberFormatException e) {
                LoggerUtil.warn("[ImportSettings] Invalid value for " + key + ": " + value + ", using default: " + defaultValue);
                return defaultValue;
            }
        }
        return result.isEmpty() ? defaultValue : List.copyOf(result);
    }

    private static List<Double> parseDoubleList(Properties config, String key, List<Double> defaultValue) {
        String value = config.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        List<Double> result = new ArrayList<>();
        for (String part : value.split(",")) {
            String token = part.trim();
            if (token.isEmpty()) continue;
            try {
                double parsed = Double.parseDouble(token);
                if (!(parsed > 0.0) || Double.isInfinite(parsed)) {
                    throw new NumberFormatException("not a positive ratio");
                }
                result.add(parsed);
            } catch (NumberFormatException e) {
                LoggerUtil.warn("[ImportSettings] Invalid value for " + key + ": " + value + ", using default: " + defaultValue);
                return defaultValue;
            }
        }
        return result.isEmpty() ? defaultValue : List.copyOf(result);
    }

    private static double parseUnitDouble(Properties config, String key, double defaultValue) {
        String value = config.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            double parsed = Double.parseDouble(value.trim());
            if (parsed < 0.0 || parsed > 1.0 || Double.isNaN(parsed)) {
                throw new NumberFormatException("outside [0,1]");
            }
            return parsed;
        } catch (NumberFormatException e) {
            LoggerUtil.warn("[ImportSettings] Invalid value for " + key + ": " + value + ", using default: " + defaultValue);
            return defaultValue;
        }
    }

    private static int parsePositiveInt(Properties config, String key, int defaultValue) {
        String value = config.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed <= 0) {
                throw new NumberFormatException("not positive");
            }
            return parsed;
        } catch (NumberFormatException e) {
            LoggerUtil.warn("[ImportSettings] Invalid value for " + key + ": " + value + ", using default: " + defaultValue);
            return defaultValue;
        }
    }
}
