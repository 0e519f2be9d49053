/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.patternbridge.parsers;

import com.patternbridge.config.ImportSettings;
import com.patternbridge.layout.LayoutCandidate;
import com.patternbridge.layout.MatrixDetector;
import com.patternbridge.model.Frame;
import com.patternbridge.model.Pattern;
import com.patternbridge.utils.LoggerUtil;

import java.util.ArrayList;
import java.util.List;

/**
 * Decoder for the standard binary layout:
 * <pre>
 *   u16le led_count
 *   u16le frame_count
 *   frame_count x { u16le duration_ms, u8[led_count * 3] rgb }
 * </pre>
 * The header-declared size must equal the buffer size exactly. Detection ignores hints;
 * {@link #parse} rejects hints that contradict the header.
 */
public class StandardFormatParser implements PatternParser {

    static final int HEADER_SIZE = 4;
    static final int MAX_LED_COUNT = 10000;

    private final MatrixDetector detector;

    public StandardFormatParser() {
        this(ImportSettings.defaults());
    }

    public StandardFormatParser(ImportSettings settings) {
        this.detector = new MatrixDetector(settings);
    }

    @Override
    public boolean detect(byte[] data, String filename, Integer suggestedLeds, Integer suggestedFrames) {
        return isStructurallyValid(data);
    }

    @Override
    public double getConfidence(byte[] data) {
        return isStructurallyValid(data) ? 1.0 : 0.0;
    }

    @Override
    public Pattern parse(byte[] data, Integer suggestedLeds, Integer suggestedFrames) throws PatternImportException {
        if (data == null || data.length < HEADER_SIZE) {
            throw new PatternImportException.MalformedRecordException(String.format(
                    "File too small for standard header: %d bytes, need at least %d",
                    data == null ? 0 : data.length, HEADER_SIZE));
        }
        int ledCount = ParserSupport.readU16LE(data, 0);
        int frameCount = ParserSupport.readU16LE(data, 2);
        if (ledCount < 1 || ledCount > MAX_LED_COUNT) {
            throw new PatternImportException.MalformedRecordException(
                    "Invalid LED count in header: " + ledCount + " (expected 1-" + MAX_LED_COUNT + ")");
        }
        if (frameCount < 1) {
            throw new PatternImportException.MalformedRecordException("Header declares no frames");
        }
        long expected = expectedSize(ledCount, frameCount);
        if (expected != data.length) {
            throw new PatternImportException.MalformedRecordException(String.format(
                    "Size mismatch: header declares %d LEDs x %d frames = %d bytes, file has %d bytes",
                    ledCount, frameCount, expected, data.length));
        }
        ParserSupport.requireHintMatches("LED count", suggestedLeds, ledCount);
        ParserSupport.requireHintMatches("frame count", suggestedFrames, frameCount);

        int frameBytes = ledCount * 3;
        List<Frame> frames = new ArrayList<>(frameCount);
        int offset = HEADER_SIZE;
        for (int i = 0; i < frameCount; i++) {
            int duration = Math.max(1, ParserSupport.readU16LE(data, offset));
            frames.add(Frame.slice(data, offset + 2, ledCount, duration));
            offset += 2 + frameBytes;
        }

        LayoutCandidate layout = detector
                .pickBestDimensions(ledCount, data, HEADER_SIZE + 2, true)
                .orElse(null);
        LoggerUtil.debug(() -> "[StandardFormatParser] " + ledCount + " LEDs x " + frameCount
                + " frames, layout " + (layout == null ? "none" : layout.width() + "x" + layout.height()));

        return new Pattern(null, ParserSupport.shapeMetadata(layout, ledCount), frames);
    }

    @Override
    public String getFormatName() {
        return "Standard";
    }

    @Override
    public String getFormatDescription() {
        return "Standard binary: u16 LED count, u16 frame count, then per frame u16 duration and RGB data";
    }

    private static boolean isStructurallyValid(byte[] data) {
        if (data == null || data.length < HEADER_SIZE) {
            return false;
        }
        int ledCount = ParserSupport.readU16LE(data, 0);
        int frameCount = ParserSupport.readU16LE(data, 2);
        if (ledCount < 1 || ledCount > MAX_LED_COUNT || frameCount < 1) {
            return false;
        }
        return expectedSize(ledCount, frameCount) == data.length;
    }

    private static long expectedSize(int ledCount, int frameCount) {
        return HEADER_SIZE + (long) frameCount * (2 + ledCount * 3L);
    }
}
