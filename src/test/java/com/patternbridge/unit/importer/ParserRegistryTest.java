/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.patternbridge.unit.importer;

import com.fasterxml.jackson.databind.JsonNode;
import com.patternbridge.config.ImportSettings;
import com.patternbridge.importer.FormatMatch;
import com.patternbridge.importer.ImportHints;
import com.patternbridge.importer.ImportResult;
import com.patternbridge.importer.ParserRegistry;
import com.patternbridge.importer.ValidationReport;
import com.patternbridge.model.DimensionSource;
import com.patternbridge.model.Pattern;
import com.patternbridge.model.PatternMetadata;
import com.patternbridge.parsers.PatternImportException;
import com.patternbridge.parsers.PatternParser;
import com.patternbridge.parsers.RawRgbParser;
import com.patternbridge.parsers.StandardFormatParser;
import com.patternbridge.test.PatternFixtures;
import com.patternbridge.utils.JacksonConfig;
import com.patternbridge.utils.LoggerUtil;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("ParserRegistry")
class ParserRegistryTest {

    @TempDir
    Path tempDir;

    private ImportSettings settings;
    private ParserRegistry registry;
    private List<String> logLines;

    @BeforeEach
    void setUp() {
        settings = ImportSettings.fromProperties(new Properties());
        registry = new ParserRegistry(settings);
        logLines = new ArrayList<>();
        LoggerUtil.setSink(logLines::add);
    }

    @AfterEach
    void tearDown() {
        LoggerUtil.setSink(null);
        LoggerUtil.setDebugEnabled(false);
    }

    private Path write(String name, byte[] data) throws Exception {
        Path file = tempDir.resolve(name);
        Files.write(file, data);
        return file;
    }

    @Nested
    @DisplayName("detectFormat")
    class DetectFormat {

        @Test
        @DisplayName("Should pick each format for its own fixture")
        void shouldPickEachFormat() {
            assertEquals("Standard", registry.detectFormat(PatternFixtures.standard(8, 6, 50), "a.bin")
                    .orElseThrow().formatName());
            assertEquals("Intel HEX", registry.detectFormat(
                    PatternFixtures.intelHex(PatternFixtures.standard(8, 6, 50)), "a.hex").orElseThrow().formatName());
            assertEquals("Enhanced Binary", registry.detectFormat(
                    PatternFixtures.dimensionHeader(12, 6, 2, 50), "a.bin").orElseThrow().formatName());
            assertEquals("Enhanced Binary", registry.detectFormat(
                    PatternFixtures.perFrameHeader(12, 6, 2, 4), "a.bin").orElseThrow().formatName());
            assertEquals("Enhanced Binary", registry.detectFormat(
                    PatternFixtures.ledMatrixStudio(12, 6, 2, 50, true), "a.ledm").orElseThrow().formatName());
            assertEquals("Raw RGB", registry.detectFormat(
                    PatternFixtures.rawGradient(12, 6, 5), "a.bin").orElseThrow().formatName());
        }

        @Test
        @DisplayName("Should keep raw gradients whose first pixel is not black")
        void shouldKeepRawWithNonZeroLeadingBytes() throws Exception {
            byte[] data = PatternFixtures.withLeadingU16(PatternFixtures.rawGradient(12, 6, 5), 2);

            ImportResult result = registry.parseBytes(data, "gradient.bin", null);

            assertEquals("Raw RGB", result.formatName());
            assertEquals(72, result.pattern().getLedCount());
            assertEquals(5, result.pattern().getFrameCount());
            assertEquals(12, result.pattern().getMetadata().getWidth());
            assertEquals(6, result.pattern().getMetadata().getHeight());
        }

        @Test
        @DisplayName("Should keep raw ramps whose first pixel is not black")
        void shouldKeepRawRampWithNonZeroLeadingBytes() throws Exception {
            byte[] data = PatternFixtures.withLeadingU16(PatternFixtures.rawRamp(17, 5, 6), 2);

            ImportResult result = registry.parseBytes(data, "ramp.bin", null);

            assertEquals("Raw RGB", result.formatName());
            assertEquals(85, result.pattern().getLedCount());
            assertEquals(6, result.pattern().getFrameCount());
            assertEquals(17, result.pattern().getMetadata().getWidth());
            assertEquals(5, result.pattern().getMetadata().getHeight());
        }

        @Test
        @DisplayName("Should be deterministic")
        void shouldBeDeterministic() {
            byte[] data = PatternFixtures.rawGradient(12, 6, 5);

            FormatMatch first = registry.detectFormat(data, "a.bin").orElseThrow();
            FormatMatch second = registry.detectFormat(data, "a.bin").orElseThrow();

            assertSame(first.parser(), second.parser());
            assertEquals(first.confidence(), second.confidence());
        }

        @Test
        @DisplayName("Should list every matching decoder in registration order")
        void shouldListMatchesInOrder() {
            byte[] data = PatternFixtures.standard(10, 3, 50);

            List<FormatMatch> matches = registry.rankFormats(data, "a.bin", null, null);

            assertEquals("Standard", matches.get(0).formatName());
            assertEquals(1.0, matches.get(0).confidence());
        }

        @Test
        @DisplayName("Should keep the earlier decoder on equal confidence")
        void shouldKeepEarlierDecoderOnTie() {
            PatternParser first = mock(PatternParser.class);
            PatternParser second = mock(PatternParser.class);
            when(first.detect(any(), anyString(), any(), any())).thenReturn(true);
            when(second.detect(any(), anyString(), any(), any())).thenReturn(true);
            when(first.getConfidence(any())).thenReturn(0.5);
            when(second.getConfidence(any())).thenReturn(0.5);

            ParserRegistry tied = new ParserRegistry(List.of(first, second));

            assertSame(first, tied.detectFormat(new byte[] {1}, "x").orElseThrow().parser());
        }

        @Test
        @DisplayName("Should survive a decoder that throws during detection")
        void shouldSurviveFaultyDecoder() {
            LoggerUtil.setDebugEnabled(true);
            PatternParser faulty = mock(PatternParser.class);
            when(faulty.getFormatName()).thenReturn("Faulty");
            when(faulty.detect(any(), anyString(), any(), any())).thenThrow(new IllegalStateException("boom"));

            ParserRegistry withFaulty = new ParserRegistry(List.of(faulty, new StandardFormatParser(settings)));
            Optional<FormatMatch> match = withFaulty.detectFormat(PatternFixtures.standard(8, 6, 50), "a.bin");

            assertTrue(match.isPresent());
            assertEquals("Standard", match.get().formatName());
            assertTrue(logLines.stream().anyMatch(l -> l.contains("[DEBUG]") && l.contains("Faulty")));
        }

        @Test
        @DisplayName("Should treat NaN confidence as no match and clamp the rest")
        void shouldSanitizeConfidence() {
            PatternParser nan = mock(PatternParser.class);
            PatternParser loud = mock(PatternParser.class);
            when(nan.detect(any(), anyString(), any(), any())).thenReturn(true);
            when(nan.getConfidence(any())).thenReturn(Double.NaN);
            when(loud.detect(any(), anyString(), any(), any())).thenReturn(true);
            when(loud.getConfidence(any())).thenReturn(3.0);

            List<FormatMatch> matches = new ParserRegistry(List.of(nan, loud)).rankFormats(new byte[] {1}, "x", null, null);

            assertEquals(1, matches.size());
            assertSame(loud, matches.get(0).parser());
            assertEquals(1.0, matches.get(0).confidence());
        }
    }

    @Nested
    @DisplayName("parseFile")
    class ParseFile {

        @Test
        @DisplayName("Should stamp name, provenance and filename hints")
        void shouldStampNameProvenanceAndHints() throws Exception {
            Path file = write("12x6 left to right alternate up down 33 frames.bin",
                    PatternFixtures.dimensionHeader(12, 6, 2, 50));

            ImportResult result = registry.parseFile(file, ImportHints.none());
            Pattern pattern = result.pattern();
            PatternMetadata metadata = pattern.getMetadata();

            assertEquals("Enhanced Binary", result.formatName());
            assertEquals(0.95, result.confidence());
            assertEquals("12x6 left to right alternate up down 33 frames", pattern.getName());
            assertEquals("enhanced binary", metadata.getSourceFormat());
            assertEquals(file.toAbsolutePath().toString(), metadata.getSourcePath());
            assertEquals(DimensionSource.HEADER, metadata.getDimensionSource());
            assertEquals(1.0, metadata.getDimensionConfidence());
            assertEquals("Column-serpentine", metadata.getWiringModeHint());
            assertEquals("LB", metadata.getDataInCornerHint());
            assertEquals(0.9, metadata.getHintConfidence());
            assertTrue(logLines.stream().anyMatch(l -> l.contains("[INFO]") && l.contains("Loaded pattern from")));
        }

        @Test
        @DisplayName("Should decode Intel HEX like the equivalent standard file")
        void shouldDecodeIntelHex() throws Exception {
            byte[] standard = PatternFixtures.standard(8, 6, 50);
            Pattern fromHex = registry.parseFile(write("p.hex", PatternFixtures.intelHex(standard)), null).pattern();
            Pattern direct = registry.parseFile(write("p.bin", standard), null).pattern();

            assertEquals(direct.getFrames(), fromHex.getFrames());
            assertEquals("intel hex", fromHex.getMetadata().getSourceFormat());
        }

        @Test
        @DisplayName("Should apply manual dimensions")
        void shouldApplyManualDimensions() throws Exception {
            Path file = write("raw.bin", PatternFixtures.rawGradient(12, 6, 5));

            Pattern pattern = registry.parseFile(file, new ImportHints(null, null, 8, 9)).pattern();

            assertEquals(8, pattern.getMetadata().getWidth());
            assertEquals(9, pattern.getMetadata().getHeight());
            assertEquals(DimensionSource.MANUAL, pattern.getMetadata().getDimensionSource());
            assertEquals(1.0, pattern.getMetadata().getDimensionConfidence());
        }

        @Test
        @DisplayName("Should reject manual dimensions that do not cover the LEDs")
        void shouldRejectBadManualDimensions() throws Exception {
            Path file = write("raw.bin", PatternFixtures.rawGradient(12, 6, 5));

            assertThrows(PatternImportException.MalformedRecordException.class,
                    () -> registry.parseFile(file, new ImportHints(null, null, 10, 10)));
        }

        @Test
        @DisplayName("Should pass count hints to the decoder")
        void shouldPassCountHints() throws Exception {
            Path file = write("raw.bin", PatternFixtures.rawGradient(12, 6, 5));

            Pattern pattern = registry.parseFile(file, ImportHints.ofCounts(36, 10)).pattern();

            assertEquals(36, pattern.getLedCount());
            assertEquals(10, pattern.getFrameCount());
        }

        @Test
        @DisplayName("Should fail in the standard decoder when hints contradict its header")
        void shouldFailStandardOnContradictingHints() throws Exception {
            Path file = write("strip.bin", PatternFixtures.standard(16, 1, 50));

            PatternImportException.ParserFailedException e = assertThrows(
                    PatternImportException.ParserFailedException.class,
                    () -> registry.parseFile(file, new ImportHints(18, null, null, null)));
            assertEquals("Standard", e.getFormatName());
            assertInstanceOf(PatternImportException.MalformedRecordException.class, e.getCause());
        }

        @Test
        @DisplayName("Should report missing, empty and unrecognised files")
        void shouldReportFileProblems() throws Exception {
            assertThrows(PatternImportException.FileNotFoundException.class,
                    () -> registry.parseFile(tempDir.resolve("missing.bin")));
            assertThrows(PatternImportException.EmptyFileException.class,
                    () -> registry.parseFile(write("empty.bin", new byte[0])));

            PatternImportException.UnknownFormatException e = assertThrows(
                    PatternImportException.UnknownFormatException.class,
                    () -> registry.parseFile(write("odd.bin", new byte[] {1, 2, 3, 4, 5, 6, 7})));
            assertEquals(7, e.getFileSize());
            assertEquals("odd.bin", e.getFilename());
            assertTrue(e.getMessage().contains("7 bytes"));
        }

        @Test
        @DisplayName("Should name the decoder when parsing fails")
        void shouldNameDecoderOnFailure() throws Exception {
            PatternParser broken = mock(PatternParser.class);
            when(broken.getFormatName()).thenReturn("Broken");
            when(broken.detect(any(), anyString(), any(), any())).thenReturn(true);
            when(broken.getConfidence(any())).thenReturn(0.8);
            when(broken.parse(any(), any(), any()))
                    .thenThrow(new PatternImportException.MalformedRecordException("bad record"));

            ParserRegistry withBroken = new ParserRegistry(List.of(broken, new RawRgbParser(settings)));

            PatternImportException.ParserFailedException e = assertThrows(
                    PatternImportException.ParserFailedException.class,
                    () -> withBroken.parseFile(write("x.bin", new byte[9])));
            assertEquals("Broken", e.getFormatName());
            assertEquals("Failed to parse as Broken: bad record", e.getMessage());
        }
    }

    @Nested
    @DisplayName("parseBytes")
    class ParseBytes {

        @Test
        @DisplayName("Should run the same pipeline without a source path")
        void shouldParseInMemory() throws Exception {
            ImportResult result = registry.parseBytes(PatternFixtures.rawRamp(17, 5, 6), "ramp.rgb", null);

            assertEquals("Raw RGB", result.formatName());
            assertEquals("ramp", result.pattern().getName());
            assertEquals(17, result.pattern().getMetadata().getWidth());
            assertNull(result.pattern().getMetadata().getSourcePath());
            assertEquals("raw rgb", result.pattern().getMetadata().getSourceFormat());
        }
    }

    @Nested
    @DisplayName("validateFile")
    class ValidateFile {

        @Test
        @DisplayName("Should report format and statistics for a good file")
        void shouldReportStatistics() throws Exception {
            ValidationReport report = registry.validateFile(write("std.bin", PatternFixtures.standard(8, 6, 50)));

            assertTrue(report.isValid());
            assertEquals("Standard", report.getFormat());
            assertEquals(1.0, report.getConfidence());
            assertEquals(8, report.getLeds());
            assertEquals(6, report.getFrames());
            assertEquals(300L, report.getDurationMs());
            assertEquals(20.0, report.getFps(), 1e-9);
            assertEquals(160L, report.getFileSize());
            assertNotNull(report.getLastModified());
        }

        @Test
        @DisplayName("Should stay valid when only the decode fails")
        void shouldStayValidWhenDecodeFails() throws Exception {
            PatternParser brittle = mock(PatternParser.class);
            when(brittle.getFormatName()).thenReturn("Brittle");
            when(brittle.detect(any(), anyString(), any(), any())).thenReturn(true);
            when(brittle.getConfidence(any())).thenReturn(0.6);
            when(brittle.parse(any(), any(), any()))
                    .thenThrow(new PatternImportException.MalformedRecordException("truncated frame"));

            ValidationReport report = new ParserRegistry(List.of(brittle))
                    .validateFile(write("x.bin", new byte[] {1, 2, 3}));

            assertTrue(report.isValid());
            assertEquals("Brittle", report.getFormat());
            assertNull(report.getLeds());
            assertTrue(report.getMessage().contains("truncated frame"));
        }

        @Test
        @DisplayName("Should mark missing, empty and unknown files invalid")
        void shouldMarkProblemsInvalid() throws Exception {
            assertFalse(registry.validateFile(tempDir.resolve("missing.bin")).isValid());

            ValidationReport empty = registry.validateFile(write("empty.bin", new byte[0]));
            assertFalse(empty.isValid());
            assertEquals(0L, empty.getFileSize());

            ValidationReport unknown = registry.validateFile(write("odd.bin", new byte[] {1, 2, 3, 4, 5, 6, 7}));
            assertFalse(unknown.isValid());
            assertTrue(unknown.getMessage().startsWith("Unknown format"));
        }

        @Test
        @DisplayName("Should serialize with snake_case keys and omit missing values")
        void shouldSerializeToJson() throws Exception {
            ValidationReport report = registry.validateFile(write("std.bin", PatternFixtures.standard(8, 6, 50)));

            JsonNode json = JacksonConfig.mapper().readTree(report.toJson());

            assertTrue(json.get("valid").asBoolean());
            assertEquals(160, json.get("file_size").asInt());
            assertEquals(300, json.get("duration_ms").asInt());
            assertTrue(json.get("last_modified").isTextual());

            JsonNode missing = JacksonConfig.mapper().readTree(registry.validateFile(tempDir.resolve("nope")).toJson());
            assertFalse(missing.has("leds"));
            assertFalse(missing.get("valid").asBoolean());
        }
    }

    @Test
    @DisplayName("Should list formats in registration order")
    void shouldListFormatsInOrder() {
        List<Map.Entry<String, String>> formats = registry.listSupportedFormats();

        assertEquals(List.of("Standard", "Intel HEX", "Enhanced Binary", "Raw RGB"),
                formats.stream().map(Map.Entry::getKey).toList());
        assertTrue(formats.stream().allMatch(f -> !f.getValue().isBlank()));
    }
}
