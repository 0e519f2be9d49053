/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.patternbridge.unit.parsers;

import com.patternbridge.config.ImportSettings;
import com.patternbridge.model.Pattern;
import com.patternbridge.parsers.PatternImportException;
import com.patternbridge.parsers.StandardFormatParser;
import com.patternbridge.test.PatternFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Arrays;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("StandardFormatParser")
class StandardFormatParserTest {

    private StandardFormatParser parser;

    @BeforeEach
    void setUp() {
        parser = new StandardFormatParser(ImportSettings.fromProperties(new Properties()));
    }

    @Nested
    @DisplayName("Detection")
    class Detection {

        @Test
        @DisplayName("Should detect an exact-size file with full confidence")
        void shouldDetectExactSize() {
            byte[] data = PatternFixtures.standard(8, 6, 50);

            assertTrue(parser.detect(data, "x.bin", null, null));
            assertEquals(1.0, parser.getConfidence(data));
        }

        @Test
        @DisplayName("Should reject a file with trailing bytes")
        void shouldRejectTrailingBytes() {
            byte[] data = Arrays.copyOf(PatternFixtures.standard(8, 6, 50), 161);

            assertFalse(parser.detect(data, "x.bin", null, null));
            assertEquals(0.0, parser.getConfidence(data));
        }

        @Test
        @DisplayName("Should reject zero LEDs, zero frames and short buffers")
        void shouldRejectDegenerateHeaders() {
            assertFalse(parser.detect(new byte[] {0, 0, 1, 0, 20, 0}, "", null, null));
            assertFalse(parser.detect(new byte[] {1, 0, 0, 0}, "", null, null));
            assertFalse(parser.detect(new byte[] {1, 0}, "", null, null));
        }

        @Test
        @DisplayName("Should match on structure alone and leave hint checks to parsing")
        void shouldIgnoreHintsWhenDetecting() {
            byte[] data = PatternFixtures.standard(8, 6, 50);

            assertTrue(parser.detect(data, "", 10, null));
            assertTrue(parser.detect(data, "", null, 7));
            assertTrue(parser.detect(data, "", 8, 6));
            assertThrows(PatternImportException.MalformedRecordException.class, () -> parser.parse(data, 10, null));
        }
    }

    @Nested
    @DisplayName("Parsing")
    class Parsing {

        @ParameterizedTest(name = "{0} LEDs x {1} frames")
        @CsvSource({"1, 1", "8, 6", "72, 3", "300, 2"})
        @DisplayName("Should keep LED count, frame count and pixels")
        void shouldRoundTripCounts(int leds, int frames) throws Exception {
            byte[] data = PatternFixtures.standard(leds, frames, 40);

            Pattern pattern = parser.parse(data, null, null);

            assertEquals(leds, pattern.getLedCount());
            assertEquals(frames, pattern.getFrameCount());
            assertEquals(40, pattern.getFrames().get(0).getDurationMs());
            byte[] firstFrame = Arrays.copyOfRange(data, 6, 6 + leds * 3);
            assertArrayEquals(firstFrame, pattern.getFrames().get(0).toBytes());
            assertEquals(leds, pattern.getMetadata().getWidth() * pattern.getMetadata().getHeight());
        }

        @Test
        @DisplayName("Should raise zero durations to 1 ms")
        void shouldRaiseZeroDurations() throws Exception {
            Pattern pattern = parser.parse(PatternFixtures.standard(4, 2, 0), null, null);

            assertEquals(1, pattern.getFrames().get(0).getDurationMs());
        }

        @Test
        @DisplayName("Should report expected and actual sizes on mismatch")
        void shouldReportSizesOnMismatch() {
            byte[] data = Arrays.copyOf(PatternFixtures.standard(8, 6, 50), 150);

            PatternImportException e = assertThrows(PatternImportException.MalformedRecordException.class,
                    () -> parser.parse(data, null, null));
            assertTrue(e.getMessage().contains("160"), e.getMessage());
            assertTrue(e.getMessage().contains("150"), e.getMessage());
        }

        @Test
        @DisplayName("Should fail when hints contradict the header")
        void shouldFailOnContradictingHints() {
            byte[] data = PatternFixtures.standard(8, 6, 50);

            assertThrows(PatternImportException.MalformedRecordException.class, () -> parser.parse(data, null, 5));
            assertThrows(PatternImportException.MalformedRecordException.class, () -> parser.parse(data, 0, null));
        }
    }
}
