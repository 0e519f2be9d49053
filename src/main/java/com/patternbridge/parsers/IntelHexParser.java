/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.patternbridge.parsers;

import com.patternbridge.config.ImportSettings;
import com.patternbridge.model.Pattern;
import com.patternbridge.utils.LoggerUtil;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Decoder for Intel HEX dumps of pattern data.
 *
 * <p>Records look like {@code :LLAAAATT<data>CC}. Data records (type 00) are concatenated
 * in file order until the first end-of-file record (type 01); other record types are
 * ignored and checksums are not verified. The decoded bytes are then handed to the
 * standard binary decoder if they carry its header, otherwise to the raw RGB decoder.
 */
public class IntelHexParser implements PatternParser {

    private static final int DETECT_SAMPLE_BYTES = 8192;
    private static final int MIN_RECORD_LENGTH = 11;
    private static final int RECORD_DATA = 0x00;
    private static final int RECORD_EOF = 0x01;

    private final StandardFormatParser standardParser;
    private final RawRgbParser rawParser;

    public IntelHexParser() {
        this(ImportSettings.defaults());
    }

    public IntelHexParser(ImportSettings settings) {
        this(new StandardFormatParser(settings), new RawRgbParser(settings));
    }

    IntelHexParser(StandardFormatParser standardParser, RawRgbParser rawParser) {
        this.standardParser = standardParser;
        this.rawParser = rawParser;
    }

    @Override
    public boolean detect(byte[] data, String filename, Integer suggestedLeds, Integer suggestedFrames) {
        List<String> lines = sampleLines(data);
        if (!looksLikeHex(lines)) {
            return false;
        }
        if (filename != null && filename.toLowerCase().endsWith(".hex")) {
            return true;
        }
        return countRecordLines(lines, 10) >= 3;
    }

    @Override
    public double getConfidence(byte[] data) {
        List<String> lines = sampleLines(data);
        if (!looksLikeHex(lines)) {
            return 0.0;
        }
        int valid = 0;
        int checked = 0;
        for (String line : lines) {
            if (line.isEmpty()) {
                continue;
            }
            if (checked++ >= 20) {
                break;
            }
            if (isValidRecord(line)) {
                valid++;
            }
        }
        if (valid >= 10) {
            return 0.9;
        }
        if (valid >= 5) {
            return 0.7;
        }
        if (valid >= 2) {
            return 0.5;
        }
        return 0.3;
    }

    @Override
    public Pattern parse(byte[] data, Integer suggestedLeds, Integer suggestedFrames) throws PatternImportException {
        byte[] decoded = decodeRecords(data);
        if (decoded.length == 0) {
            throw new PatternImportException.MalformedRecordException("No data records found in Intel HEX file");
        }
        LoggerUtil.debug(() -> "[IntelHexParser] Decoded " + decoded.length + " bytes of record data");

        if (standardParser.detect(decoded, "", null, null)) {
            return standardParser.parse(decoded, suggestedLeds, suggestedFrames);
        }
        return rawParser.parse(decoded, suggestedLeds, suggestedFrames);
    }

    @Override
    public String getFormatName() {
        return "Intel HEX";
    }

    @Override
    public String getFormatDescription() {
        return "Intel HEX records wrapping standard binary or raw RGB pattern data";
    }

    /**
     * Concatenated payload of the data records up to the end-of-file record.
     */
    byte[] decodeRecords(byte[] data) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        String text = new String(data, StandardCharsets.US_ASCII);
        int lineNumber = 0;
        for (String raw : text.split("\r?\n|\r")) {
            lineNumber++;
            String line = raw.trim();
            if (line.isEmpty()) {
                continue;
            }
            if (!isValidRecord(line)) {
                int n = lineNumber;
                LoggerUtil.debug(() -> "[IntelHexParser] Skipping malformed line " + n);
                continue;
            }
            int length = Integer.parseInt(line.substring(1, 3), 16);
            int type = Integer.parseInt(line.substring(7, 9), 16);
            if (type == RECORD_EOF) {
                break;
            }
            if (type != RECORD_DATA) {
                continue;
            }
            if (line.length() < 9 + length * 2) {
                int n = lineNumber;
                LoggerUtil.debug(() -> "[IntelHexParser] Skipping truncated record on line " + n);
                continue;
            }
            for (int i = 0; i < length; i++) {
                int pos = 9 + i * 2;
                out.write(Integer.parseInt(line.substring(pos, pos + 2), 16));
            }
        }
        return out.toByteArray();
    }

    private static List<String> sampleLines(byte[] data) {
        List<String> lines = new ArrayList<>();
        if (data == null || data.length == 0) {
            return lines;
        }
        int length = Math.min(data.length, DETECT_SAMPLE_BYTES);
        String text = new String(data, 0, length, StandardCharsets.US_ASCII);
        for (String line : text.split("\r?\n|\r")) {
            lines.add(line.trim());
        }
        return lines;
    }

    private static boolean looksLikeHex(List<String> lines) {
        return lines.size() >= 2 && lines.get(0).startsWith(":");
    }

    private static int countRecordLines(List<String> lines, int limit) {
        int count = 0;
        for (int i = 0; i < Math.min(limit, lines.size()); i++) {
            if (lines.get(i).startsWith(":")) {
                count++;
            }
        }
        return count;
    }

    static boolean isValidRecord(String line) {
        if (line.length() < MIN_RECORD_LENGTH || line.charAt(0) != ':') {
            return false;
        }
        for (int i = 1; i < line.length(); i++) {
            if (Character.digit(line.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }
}
