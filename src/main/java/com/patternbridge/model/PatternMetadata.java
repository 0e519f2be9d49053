/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.patternbridge.model;

import java.util.Objects;
import java.util.Set;

/**
 * Display shape, provenance and wiring hints attached to a decoded pattern.
 *
 * <p>Everything downstream consumers learn about how a file was interpreted travels
 * through this object: which decoder produced it ({@link #getSourceFormat()}), how the
 * width x height was found ({@link #getDimensionSource()}, {@link #getDimensionConfidence()})
 * and what the filename suggested about physical wiring.
 *
 * <p>Immutable; use {@link #toBuilder()} to derive a modified copy.
 */
public final class PatternMetadata {

    /** Accepted channel orders. */
    public static final Set<String> COLOR_ORDERS = Set.of("RGB", "GRB", "BRG", "BGR", "RBG", "GBR");

    private final int width;
    private final int height;
    private final String colorOrder;
    private final DimensionSource dimensionSource;
    private final double dimensionConfidence;
    private final String wiringModeHint;
    private final String dataInCornerHint;
    private final double hintConfidence;
    private final String sourcePath;
    private final String sourceFormat;

    private PatternMetadata(Builder b) {
        if (b.width < 0 || b.height < 0) {
            throw new IllegalArgumentException("Width and height must not be negative: " + b.width + "x" + b.height);
        }
        if (!COLOR_ORDERS.contains(b.colorOrder)) {
            throw new IllegalArgumentException("Invalid color order: " + b.colorOrder);
        }
        checkUnit("Dimension confidence", b.dimensionConfidence);
        checkUnit("Hint confidence", b.hintConfidence);
        this.width = b.width;
        this.height = b.height;
        this.colorOrder = b.colorOrder;
        this.dimensionSource = Objects.requireNonNull(b.dimensionSource, "dimensionSource");
        this.dimensionConfidence = b.dimensionConfidence;
        this.wiringModeHint = b.wiringModeHint;
        this.dataInCornerHint = b.dataInCornerHint;
        this.hintConfidence = b.hintConfidence;
        this.sourcePath = b.sourcePath;
        this.sourceFormat = b.sourceFormat;
    }

    private static void checkUnit(String name, double value) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new IllegalArgumentException(name + " must be 0.0-1.0: " + value);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .dimensions(width, height)
                .colorOrder(colorOrder)
                .dimensionSource(dimensionSource, dimensionConfidence)
                .wiringHints(wiringModeHint, dataInCornerHint, hintConfidence)
                .sourcePath(sourcePath)
                .sourceFormat(sourceFormat);
    }

    public int getWidth() { return width; }
    public int getHeight() { return height; }
    public String getColorOrder() { return colorOrder; }
    public DimensionSource getDimensionSource() { return dimensionSource; }
    public double getDimensionConfidence() { return dimensionConfidence; }
    public String getWiringModeHint() { return wiringModeHint; }
    public String getDataInCornerHint() { return dataInCornerHint; }
    public double getHintConfidence() { return hintConfidence; }
    public String getSourcePath() { return sourcePath; }
    public String getSourceFormat() { return sourceFormat; }

    /** True for a 2-D matrix, false for a strip. */
    public boolean isMatrix() {
        return height > 1;
    }

    @Override
    public String toString() {
        return String.format("PatternMetadata{%dx%d, %s, source=%s (%.2f), format=%s}",
                width, height, colorOrder, dimensionSource.label(), dimensionConfidence, sourceFormat);
    }

    public static final class Builder {
        private int width;
        private int height;
        private String colorOrder = "RGB";
        private DimensionSource dimensionSource = DimensionSource.UNKNOWN;
        private double dimensionConfidence;
        private String wiringModeHint;
        private String dataInCornerHint;
        private double hintConfidence;
        private String sourcePath;
        private String sourceFormat;

        private Builder() {}

        public Builder dimensions(int width, int height) {
            this.width = width;
            this.height = height;
            return this;
        }

        public Builder colorOrder(String colorOrder) {
            this.colorOrder = colorOrder;
            return this;
        }

        public Builder dimensionSource(DimensionSource source, double confidence) {
            this.dimensionSource = source;
            this.dimensionConfidence = confidence;
            return this;
        }

        public Builder wiringHints(String wiringMode, String dataInCorner, double confidence) {
            this.wiringModeHint = wiringMode;
            this.dataInCornerHint = dataInCorner;
            this.hintConfidence = confidence;
            return this;
        }

        public Builder sourcePath(String sourcePath) {
            this.sourcePath = sourcePath;
            return this;
        }

        public Builder sourceFormat(String sourceFormat) {
            this.sourceFormat = sourceFormat;
            return this;
        }

        public PatternMetadata build() {
            return new PatternMetadata(this);
        }
    }
}
