/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.patternbridge.importer;

import com.patternbridge.config.ImportSettings;
import com.patternbridge.model.DimensionSource;
import com.patternbridge.model.Pattern;
import com.patternbridge.model.PatternMetadata;
import com.patternbridge.parsers.EnhancedBinaryParser;
import com.patternbridge.parsers.IntelHexParser;
import com.patternbridge.parsers.PatternImportException;
import com.patternbridge.parsers.PatternParser;
import com.patternbridge.parsers.RawRgbParser;
import com.patternbridge.parsers.StandardFormatParser;
import com.patternbridge.utils.LoggerUtil;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for importing pattern files.
 *
 * <p>Every registered decoder is asked whether it recognises the data; the one with the
 * highest confidence decodes it, with earlier registrations winning ties. The default
 * order is Standard, Intel HEX, Enhanced Binary, Raw RGB. Raw RGB accepts nearly any
 * buffer and so goes last.
 *
 * <p>A decoder that throws while probing is treated as not matching, so one faulty
 * decoder cannot stop the others from being consulted.
 *
 * <p>Thread-safe: the registry keeps no per-call state.
 */
public class ParserRegistry {

    private final List<PatternParser> parsers;

    public ParserRegistry() {
        this(ImportSettings.defaults());
    }

    public ParserRegistry(ImportSettings settings) {
        this(List.of(
                new StandardFormatParser(settings),
                new IntelHexParser(settings),
                new EnhancedBinaryParser(settings),
                new RawRgbParser(settings)));
    }

    /**
     * @param parsers decoders in registration (tie-break) order
     */
    public ParserRegistry(List<PatternParser> parsers) {
        if (parsers == null || parsers.isEmpty()) {
            throw new IllegalArgumentException("At least one parser is required");
        }
        this.parsers = List.copyOf(parsers);
    }

    public List<PatternParser> getParsers() {
        return parsers;
    }

    /**
     * All decoders that recognise the data, in registration order.
     */
    public List<FormatMatch> rankFormats(byte[] data, String filename, Integer suggestedLeds, Integer suggestedFrames) {
        List<FormatMatch> matches = new ArrayList<>();
        if (data == null || data.length == 0) {
            return matches;
        }
        String name = filename != null ? filename : "";
        for (PatternParser parser : parsers) {
            try {
                if (!parser.detect(data, name, suggestedLeds, suggestedFrames)) {
                    continue;
                }
                double confidence = parser.getConfidence(data);
                if (Double.isNaN(confidence)) {
                    LoggerUtil.debug("[ParserRegistry] " + parser.getFormatName() + " reported NaN confidence, skipping");
                    continue;
                }
                matches.add(new FormatMatch(parser, Math.max(0.0, Math.min(1.0, confidence))));
            } catch (RuntimeException e) {
                LoggerUtil.debug("[ParserRegistry] Detection failed in " + safeName(parser) + ": " + e);
            }
        }
        return matches;
    }

    /**
     * The best matching decoder, or empty when none recognises the data.
     */
    public Optional<FormatMatch> detectFormat(byte[] data, String filename, Integer suggestedLeds,
                                              Integer suggestedFrames) {
        FormatMatch best = null;
        for (FormatMatch match : rankFormats(data, filename, suggestedLeds, suggestedFrames)) {
            if (best == null || match.confidence() > best.confidence()) {
                best = match;
            }
        }
        return Optional.ofNullable(best);
    }

    public Optional<FormatMatch> detectFormat(byte[] data, String filename) {
        return detectFormat(data, filename, null, null);
    }

    /**
     * Read and decode a pattern file.
     *
     * @param hints optional counts and manual dimensions, may be null
     */
    public ImportResult parseFile(Path path, ImportHints hints) throws PatternImportException {
        if (path == null || !Files.isRegularFile(path)) {
            throw new PatternImportException.FileNotFoundException(String.valueOf(path));
        }
        byte[] data;
        try {
            data = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new PatternImportException("Failed to read " + path + ": " + e.getMessage(), e);
        }
        return decode(data, path.getFileName().toString(), hints, path.toAbsolutePath().toString());
    }

    public ImportResult parseFile(Path path) throws PatternImportException {
        return parseFile(path, ImportHints.none());
    }

    /**
     * Decode an in-memory buffer; same pipeline as {@link #parseFile(Path, ImportHints)}
     * without a source path.
     */
    public ImportResult parseBytes(byte[] data, String filename, ImportHints hints) throws PatternImportException {
        return decode(data, filename != null ? filename : "", hints, null);
    }

    /**
     * Dry run: reports whether the file would be recognised and, when a decode succeeds,
     * its pattern statistics. Never throws for problems with the file itself.
     */
    public ValidationReport validateFile(Path path) {
        String filename = path != null && path.getFileName() != null ? path.getFileName().toString() : String.valueOf(path);
        if (path == null || !Files.isRegularFile(path)) {
            return ValidationReport.invalid(filename, "File not found: " + path);
        }
        byte[] data;
        ValidationReport report = new ValidationReport();
        report.setFilename(filename);
        try {
            data = Files.readAllBytes(path);
            report.setLastModified(Files.getLastModifiedTime(path).toInstant());
        } catch (IOException e) {
            return ValidationReport.invalid(filename, "Cannot read file: " + e.getMessage());
        }
        report.setFileSize((long) data.length);
        if (data.length == 0) {
            report.setValid(false);
            report.setMessage("File is empty");
            return report;
        }

        Optional<FormatMatch> match = detectFormat(data, filename);
        if (match.isEmpty()) {
            report.setValid(false);
            report.setMessage(new PatternImportException.UnknownFormatException(data.length, filename).getMessage());
            return report;
        }
        FormatMatch best = match.get();
        report.setValid(true);
        report.setFormat(best.formatName());
        report.setConfidence(best.confidence());
        report.setMessage("Detected as " + best.formatName());

        try {
            Pattern pattern = best.parser().parse(data, null, null);
            report.setLeds(pattern.getLedCount());
            report.setFrames(pattern.getFrameCount());
            report.setDurationMs(pattern.getDurationMs());
            report.setFps(pattern.getAverageFps());
        } catch (PatternImportException | RuntimeException e) {
            // validity comes from detection; decode problems only show up in the message
            report.setMessage("Detected as " + best.formatName() + ", but decoding failed: " + e.getMessage());
            LoggerUtil.debug("[ParserRegistry] Validation decode of " + filename + " failed: " + e.getMessage());
        }
        return report;
    }

    /**
     * Name and description of every registered decoder, in registration order.
     */
    public List<Map.Entry<String, String>> listSupportedFormats() {
        List<Map.Entry<String, String>> formats = new ArrayList<>();
        for (PatternParser parser : parsers) {
            formats.add(new AbstractMap.SimpleImmutableEntry<>(parser.getFormatName(), parser.getFormatDescription()));
        }
        return formats;
    }

    private ImportResult decode(byte[] data, String filename, ImportHints hints, String sourcePath)
            throws PatternImportException {
        ImportHints h = hints != null ? hints : ImportHints.none();
        if (data == null || data.length == 0) {
            throw new PatternImportException.EmptyFileException(filename);
        }

        FormatMatch match = detectFormat(data, filename, h.suggestedLeds(), h.suggestedFrames())
                .orElseThrow(() -> new PatternImportException.UnknownFormatException(data.length, filename));
        String formatName = match.formatName();
        LoggerUtil.debug(() -> String.format("[ParserRegistry] %s detected as %s (confidence %.2f)",
                filename, formatName, match.confidence()));

        Pattern pattern;
        try {
            pattern = match.parser().parse(data, h.suggestedLeds(), h.suggestedFrames());
        } catch (PatternImportException | RuntimeException e) {
            throw new PatternImportException.ParserFailedException(formatName, e);
        }

        PatternMetadata.Builder metadata = pattern.getMetadata().toBuilder()
                .sourceFormat(formatName.toLowerCase(Locale.ROOT))
                .sourcePath(sourcePath);
        WiringHints wiring = FilenameHintExtractor.extract(filename);
        if (!wiring.isEmpty()) {
            metadata.wiringHints(wiring.wiringMode(), wiring.dataInCorner(), wiring.confidence());
        }
        if (h.hasManualDimensions()) {
            int[] dims = manualDimensions(h, pattern.getLedCount());
            metadata.dimensions(dims[0], dims[1]).dimensionSource(DimensionSource.MANUAL, 1.0);
        }

        Pattern result = pattern.withName(stem(filename)).withMetadata(metadata.build());
        LoggerUtil.info(String.format("[ParserRegistry] Loaded pattern from %s: %s, %d LEDs x %d frames",
                filename, formatName, result.getLedCount(), result.getFrameCount()));
        return new ImportResult(result, formatName, match.confidence());
    }

    private static int[] manualDimensions(ImportHints hints, int ledCount) throws PatternImportException {
        Integer width = hints.width();
        Integer height = hints.height();
        if ((width != null && width <= 0) || (height != null && height <= 0)) {
            throw new PatternImportException.MalformedRecordException(
                    "Manual dimensions must be positive: " + width + "x" + height);
        }
        if (width == null) {
            if (ledCount % height != 0) {
                throw new PatternImportException.MalformedRecordException(String.format(
                        "Height %d does not divide %d LEDs", height, ledCount));
            }
            width = ledCount / height;
        } else if (height == null) {
            if (ledCount % width != 0) {
                throw new PatternImportException.MalformedRecordException(String.format(
                        "Width %d does not divide %d LEDs", width, ledCount));
            }
            height = ledCount / width;
        }
        if ((long) width * height != ledCount) {
            throw new PatternImportException.MalformedRecordException(String.format(
                    "Manual dimensions %dx%d = %d LEDs, pattern has %d LEDs",
                    width, height, (long) width * height, ledCount));
        }
        return new int[] {width, height};
    }

    static String stem(String filename) {
        if (filename == null || filename.isBlank()) {
            return "Untitled Pattern";
        }
        int dot = filename.lastIndexOf('.');
        return dot > 0 ? filename.substring(0, dot) : filename;
    }

    private static String safeName(PatternParser parser) {
        try {
            return parser.getFormatName();
        } catch (RuntimeException e) {
            return parser.getClass().getSimpleName();
        }
    }
}
