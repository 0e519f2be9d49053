/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.patternbridge.parsers;

import com.patternbridge.config.ImportSettings;
import com.patternbridge.layout.LayoutCandidate;
import com.patternbridge.layout.MatrixDetector;
import com.patternbridge.model.DimensionSource;
import com.patternbridge.model.Frame;
import com.patternbridge.model.Pattern;
import com.patternbridge.model.PatternMetadata;
import com.patternbridge.utils.LoggerUtil;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decoder for the extended binary dialects.
 *
 * <p><b>LED Matrix Studio</b>:
 * <pre>
 *   "LEDM", u16le version (0-5), u16le led_count, u16le frame_count
 *   [u16le width, u16le height]   optional, present when width * height == led_count
 *   frame_count x { u16le duration_ms, u8[led_count * 3] rgb }
 * </pre>
 *
 * <p><b>Dimension header</b>:
 * <pre>
 *   u16le width, u16le height, u16le frame_count
 *   frame_count x { u16le duration_ms, u8[width * height * 3] rgb }
 * </pre>
 *
 * <p><b>Per-frame header</b>:
 * <pre>
 *   u16le frame_count
 *   frame_count x { u8[H] opaque header, u8[led_count * 3] rgb }
 * </pre>
 * H is the same for every frame of a file and at least 1. The header has to start with
 * bytes that repeat in every frame, and the pixels after it have to form a convincing
 * matrix. Without both, a headerless RGB file whose first bytes happen to divide the
 * length would be misread.
 *
 * <p>Detection looks at structure only. Hints that contradict the file are reported by
 * {@link #parse}.
 */
public class EnhancedBinaryParser implements PatternParser {

    private static final byte[] LEDM_MAGIC = {'L', 'E', 'D', 'M'};
    private static final int LEDM_BASIC_HEADER_SIZE = 10;
    private static final int LEDM_EXTENDED_HEADER_SIZE = 14;
    private static final int MAX_LEDM_VERSION = 5;
    private static final int MAX_LEDM_LED_COUNT = 10000;

    private static final int DIMENSION_HEADER_SIZE = 6;
    private static final int MAX_DIMENSION = 4096;
    private static final int MAX_DIMENSION_FRAMES = 20000;

    private static final int MIN_PER_FRAME_SIZE = 20;
    private static final int MIN_PER_FRAME_FRAMES = 2;
    private static final int MAX_PER_FRAME_FRAMES = 10000;
    private static final int MAX_COMPARED_FRAMES = 6;
    private static final int MIN_REPEATED_HEADER_BYTES = 2;
    private static final int SHORT_HEADER_BYTES = 16;
    private static final double SHORT_HEADER_BONUS = 0.05;

    private static final double LEDM_CONFIDENCE = 0.98;
    private static final double DIMENSION_HEADER_CONFIDENCE = 0.95;
    private static final double PER_FRAME_CONFIDENCE = 0.45;
    // below every raw RGB confidence
    private static final double PER_FRAME_TRIPLES_CONFIDENCE = 0.05;

    private final ImportSettings settings;
    private final MatrixDetector detector;

    public EnhancedBinaryParser() {
        this(ImportSettings.defaults());
    }

    public EnhancedBinaryParser(ImportSettings settings) {
        this.settings = settings;
        this.detector = new MatrixDetector(settings);
    }

    /** Header of an LED Matrix Studio file; width and height are 0 without the extension. */
    record LedmHeader(int ledCount, int frameCount, int width, int height, int headerSize) {
        boolean hasDimensions() {
            return width > 0;
        }
    }

    /** Layout of a per-frame-header file. */
    record PerFrameLayout(int frameCount, int headerBytes, int ledCount) {
        int frameStride() {
            return headerBytes + ledCount * 3;
        }
    }

    @Override
    public boolean detect(byte[] data, String filename, Integer suggestedLeds, Integer suggestedFrames) {
        return ledmHeader(data).isPresent()
                || isDimensionHeader(data)
                || perFrameLayout(data, null).isPresent();
    }

    @Override
    public double getConfidence(byte[] data) {
        if (ledmHeader(data).isPresent()) {
            return LEDM_CONFIDENCE;
        }
        if (isDimensionHeader(data)) {
            return DIMENSION_HEADER_CONFIDENCE;
        }
        if (perFrameLayout(data, null).isEmpty()) {
            return 0.0;
        }
        return data.length % 3 == 0 ? PER_FRAME_TRIPLES_CONFIDENCE : PER_FRAME_CONFIDENCE;
    }

    @Override
    public Pattern parse(byte[] data, Integer suggestedLeds, Integer suggestedFrames) throws PatternImportException {
        ParserSupport.requirePositiveHint("LED count", suggestedLeds);
        ParserSupport.requirePositiveHint("frame count", suggestedFrames);

        Optional<LedmHeader> ledm = ledmHeader(data);
        if (ledm.isPresent()) {
            return parseLedm(data, ledm.get(), suggestedLeds, suggestedFrames);
        }
        if (isDimensionHeader(data)) {
            return parseDimensionHeader(data, suggestedLeds, suggestedFrames);
        }
        if (!isPerFrameCandidate(data)) {
            throw new PatternImportException.MalformedRecordException(String.format(
                    "Not an enhanced binary file: %d bytes match no LED Matrix Studio, dimension header "
                            + "or per-frame header layout", data == null ? 0 : data.length));
        }
        ParserSupport.requireHintMatches("frame count", suggestedFrames, ParserSupport.readU16LE(data, 0));
        PerFrameLayout layout = perFrameLayout(data, suggestedLeds)
                .orElseThrow(() -> new PatternImportException.MalformedRecordException(String.format(
                        "No consistent per-frame header found for %d frames in %d bytes%s",
                        ParserSupport.readU16LE(data, 0), data.length,
                        suggestedLeds == null ? "" : " with " + suggestedLeds + " LEDs")));
        return parsePerFrame(data, layout);
    }

    @Override
    public String getFormatName() {
        return "Enhanced Binary";
    }

    @Override
    public String getFormatDescription() {
        return "LED Matrix Studio binary, binary with width/height header, "
                + "or binary with a fixed-length header before each frame";
    }

    private Pattern parseLedm(byte[] data, LedmHeader header, Integer suggestedLeds, Integer suggestedFrames)
            throws PatternImportException {
        ParserSupport.requireHintMatches("LED count", suggestedLeds, header.ledCount());
        ParserSupport.requireHintMatches("frame count", suggestedFrames, header.frameCount());

        List<Frame> frames = readTimedFrames(data, header.headerSize(), header.ledCount(), header.frameCount());
        PatternMetadata metadata;
        if (header.hasDimensions()) {
            metadata = PatternMetadata.builder()
                    .dimensions(header.width(), header.height())
                    .dimensionSource(DimensionSource.HEADER, 1.0)
                    .build();
        } else {
            LayoutCandidate layout = detector
                    .pickBestDimensions(header.ledCount(), data, header.headerSize() + 2, true)
                    .orElse(null);
            metadata = ParserSupport.shapeMetadata(layout, header.ledCount());
        }
        LoggerUtil.debug(() -> String.format("[EnhancedBinaryParser] LED Matrix Studio file, %d LEDs x %d frames%s",
                header.ledCount(), header.frameCount(),
                header.hasDimensions() ? ", " + header.width() + "x" + header.height() : ""));
        return new Pattern(null, metadata, frames);
    }

    private Pattern parseDimensionHeader(byte[] data, Integer suggestedLeds, Integer suggestedFrames)
            throws PatternImportException {
        int width = ParserSupport.readU16LE(data, 0);
        int height = ParserSupport.readU16LE(data, 2);
        int frameCount = ParserSupport.readU16LE(data, 4);
        int ledCount = width * height;
        ParserSupport.requireHintMatches("LED count", suggestedLeds, ledCount);
        ParserSupport.requireHintMatches("frame count", suggestedFrames, frameCount);

        List<Frame> frames = readTimedFrames(data, DIMENSION_HEADER_SIZE, ledCount, frameCount);
        PatternMetadata metadata = PatternMetadata.builder()
                .dimensions(width, height)
                .dimensionSource(DimensionSource.HEADER, 1.0)
                .build();
        return new Pattern(null, metadata, frames);
    }

    private List<Frame> readTimedFrames(byte[] data, int offset, int ledCount, int frameCount) {
        List<Frame> frames = new ArrayList<>(frameCount);
        for (int i = 0; i < frameCount; i++) {
            int duration = ParserSupport.readU16LE(data, offset);
            if (duration == 0) {
                duration = settings.getDefaultFrameDurationMs();
            }
            frames.add(Frame.slice(data, offset + 2, ledCount, duration));
            offset += 2 + ledCount * 3;
        }
        return frames;
    }

    private Pattern parsePerFrame(byte[] data, PerFrameLayout layout) {
        int duration = settings.getDefaultFrameDurationMs();
        List<Frame> frames = new ArrayList<>(layout.frameCount());
        for (int i = 0; i < layout.frameCount(); i++) {
            int offset = 2 + i * layout.frameStride() + layout.headerBytes();
            frames.add(Frame.slice(data, offset, layout.ledCount(), duration));
        }
        LayoutCandidate shape = detector
                .pickBestDimensions(layout.ledCount(), data, 2 + layout.headerBytes(), false)
                .orElse(null);
        LoggerUtil.debug(() -> String.format("[EnhancedBinaryParser] Per-frame header of %d bytes, %d LEDs x %d frames",
                layout.headerBytes(), layout.ledCount(), layout.frameCount()));
        return new Pattern(null, ParserSupport.shapeMetadata(shape, layout.ledCount()), frames);
    }

    /**
     * LED Matrix Studio header whose declared size matches the buffer, preferring the
     * width/height extension when it is consistent.
     */
    static Optional<LedmHeader> ledmHeader(byte[] data) {
        if (data == null || data.length < LEDM_BASIC_HEADER_SIZE) {
            return Optional.empty();
        }
        for (int i = 0; i < LEDM_MAGIC.length; i++) {
            if (data[i] != LEDM_MAGIC[i]) {
                return Optional.empty();
            }
        }
        int version = ParserSupport.readU16LE(data, 4);
        int ledCount = ParserSupport.readU16LE(data, 6);
        int frameCount = ParserSupport.readU16LE(data, 8);
        if (version > MAX_LEDM_VERSION || ledCount < 1 || ledCount > MAX_LEDM_LED_COUNT || frameCount < 1) {
            return Optional.empty();
        }
        long frameBytes = (long) frameCount * (2 + ledCount * 3L);
        if (data.length >= LEDM_EXTENDED_HEADER_SIZE) {
            int width = ParserSupport.readU16LE(data, 10);
            int height = ParserSupport.readU16LE(data, 12);
            if (width > 0 && height > 0 && width * height == ledCount
                    && LEDM_EXTENDED_HEADER_SIZE + frameBytes == data.length) {
                return Optional.of(new LedmHeader(ledCount, frameCount, width, height, LEDM_EXTENDED_HEADER_SIZE));
            }
        }
        if (LEDM_BASIC_HEADER_SIZE + frameBytes == data.length) {
            return Optional.of(new LedmHeader(ledCount, frameCount, 0, 0, LEDM_BASIC_HEADER_SIZE));
        }
        return Optional.empty();
    }

    private static boolean isDimensionHeader(byte[] data) {
        if (data == null || data.length < DIMENSION_HEADER_SIZE) {
            return false;
        }
        int width = ParserSupport.readU16LE(data, 0);
        int height = ParserSupport.readU16LE(data, 2);
        int frameCount = ParserSupport.readU16LE(data, 4);
        if (width < 1 || width > MAX_DIMENSION || height < 1 || height > MAX_DIMENSION
                || frameCount < 1 || frameCount > MAX_DIMENSION_FRAMES) {
            return false;
        }
        long expected = DIMENSION_HEADER_SIZE + (long) frameCount * (2 + (long) width * height * 3);
        return expected == data.length;
    }

    private static boolean isPerFrameCandidate(byte[] data) {
        if (data == null || data.length < MIN_PER_FRAME_SIZE) {
            return false;
        }
        int frameCount = ParserSupport.readU16LE(data, 0);
        if (frameCount < MIN_PER_FRAME_FRAMES || frameCount > MAX_PER_FRAME_FRAMES) {
            return false;
        }
        int remaining = data.length - 2;
        return remaining % frameCount == 0 && remaining / frameCount >= 4;
    }

    /**
     * Per-frame layout, with the header length taken from the LED hint when given and
     * inferred otherwise. Empty when no header length passes the checks.
     */
    Optional<PerFrameLayout> perFrameLayout(byte[] data, Integer suggestedLeds) {
        if (!isPerFrameCandidate(data)) {
            return Optional.empty();
        }
        int frameCount = ParserSupport.readU16LE(data, 0);
        int perFrame = (data.length - 2) / frameCount;
        int maxHeader = Math.min(settings.getMaxFrameHeaderBytes(), perFrame - 3);
        int repeated = repeatedHeaderBytes(data, frameCount, perFrame, maxHeader);

        if (suggestedLeds != null) {
            int headerBytes = perFrame - suggestedLeds * 3;
            if (headerBytes < 1 || headerBytes > maxHeader || !headerRepeats(headerBytes, repeated)) {
                return Optional.empty();
            }
            return Optional.of(new PerFrameLayout(frameCount, headerBytes, suggestedLeds));
        }

        PerFrameLayout best = null;
        double bestScore = -1.0;
        for (int headerBytes = 1; headerBytes <= maxHeader; headerBytes++) {
            if ((perFrame - headerBytes) % 3 != 0 || !headerRepeats(headerBytes, repeated)) {
                continue;
            }
            int ledCount = (perFrame - headerBytes) / 3;
            Optional<LayoutCandidate> candidate = detector.pickBestDimensions(ledCount, data, 2 + headerBytes, false);
            if (candidate.isEmpty() || candidate.get().score() < settings.getLayoutAcceptThreshold()) {
                continue;
            }
            double score = candidate.get().score() + (headerBytes <= SHORT_HEADER_BYTES ? SHORT_HEADER_BONUS : 0.0);
            if (score > bestScore) {
                bestScore = score;
                best = new PerFrameLayout(frameCount, headerBytes, ledCount);
            }
        }
        return Optional.ofNullable(best);
    }

    private static boolean headerRepeats(int headerBytes, int repeated) {
        return repeated >= Math.min(headerBytes, MIN_REPEATED_HEADER_BYTES);
    }

    /**
     * Number of leading bytes per frame that are identical in the first few frames.
     */
    private static int repeatedHeaderBytes(byte[] data, int frameCount, int perFrame, int limit) {
        int compared = Math.min(frameCount, MAX_COMPARED_FRAMES);
        int repeated = 0;
        for (int k = 0; k < limit; k++) {
            byte first = data[2 + k];
            for (int f = 1; f < compared; f++) {
                if (data[2 + f * perFrame + k] != first) {
                    return repeated;
                }
            }
            repeated++;
        }
        return repeated;
    }
}
