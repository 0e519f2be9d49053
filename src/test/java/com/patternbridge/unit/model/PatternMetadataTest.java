/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.patternbridge.unit.model;

import com.patternbridge.model.DimensionSource;
import com.patternbridge.model.PatternMetadata;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PatternMetadata")
class PatternMetadataTest {

    @Test
    @DisplayName("Should default to RGB with unknown dimensions")
    void shouldHaveDefaults() {
        PatternMetadata metadata = PatternMetadata.builder().build();

        assertEquals("RGB", metadata.getColorOrder());
        assertEquals(DimensionSource.UNKNOWN, metadata.getDimensionSource());
        assertEquals(0.0, metadata.getDimensionConfidence());
        assertNull(metadata.getWiringModeHint());
        assertNull(metadata.getSourcePath());
    }

    @ParameterizedTest
    @ValueSource(doubles = {-0.1, 1.01, Double.NaN})
    @DisplayName("Should reject confidence outside 0-1")
    void shouldRejectConfidenceOutsideRange(double confidence) {
        assertThrows(IllegalArgumentException.class, () -> PatternMetadata.builder()
                .dimensionSource(DimensionSource.DETECTOR, confidence).build());
        assertThrows(IllegalArgumentException.class, () -> PatternMetadata.builder()
                .wiringHints("Serpentine", "LT", confidence).build());
    }

    @Test
    @DisplayName("Should reject unknown color order")
    void shouldRejectUnknownColorOrder() {
        assertThrows(IllegalArgumentException.class, () -> PatternMetadata.builder().colorOrder("RGBW").build());
    }

    @Test
    @DisplayName("Should carry every field through toBuilder")
    void shouldCarryFieldsThroughToBuilder() {
        PatternMetadata original = PatternMetadata.builder()
                .dimensions(12, 6)
                .colorOrder("GRB")
                .dimensionSource(DimensionSource.HEADER, 1.0)
                .wiringHints("Column-serpentine", "LB", 0.9)
                .sourcePath("/tmp/a.bin")
                .sourceFormat("enhanced binary")
                .build();

        PatternMetadata copy = original.toBuilder().build();

        assertEquals(12, copy.getWidth());
        assertEquals(6, copy.getHeight());
        assertEquals("GRB", copy.getColorOrder());
        assertEquals(DimensionSource.HEADER, copy.getDimensionSource());
        assertEquals("Column-serpentine", copy.getWiringModeHint());
        assertEquals("LB", copy.getDataInCornerHint());
        assertEquals(0.9, copy.getHintConfidence());
        assertEquals("/tmp/a.bin", copy.getSourcePath());
        assertEquals("enhanced binary", copy.getSourceFormat());
        assertEquals("header", copy.getDimensionSource().label());
    }
}
