/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.patternbridge.parsers;

/**
 * Base exception for pattern import failures.
 *
 * <p>Messages are meant to be shown to users as-is: they state expected vs. actual sizes
 * and, where it helps, what to try next.
 */
public class PatternImportException extends Exception {

    public PatternImportException(String message) {
        super(message);
    }

    public PatternImportException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Thrown when the file to import does not exist.
     */
    public static class FileNotFoundException extends PatternImportException {
        private final String path;

        public FileNotFoundException(String path) {
            super("File not found: " + path);
            this.path = path;
        }

        public String getPath() {
            return path;
        }
    }

    /**
     * Thrown when the file has zero length.
     */
    public static class EmptyFileException extends PatternImportException {
        public EmptyFileException(String filename) {
            super("File is empty: " + filename);
        }
    }

    /**
     * Thrown when no decoder recognises the data.
     */
    public static class UnknownFormatException extends PatternImportException {
        private final long fileSize;
        private final String filename;

        public UnknownFormatException(long fileSize, String filename) {
            super(String.format("Unknown format: %s (file size: %d bytes). "
                    + "Try specifying LED count and frame count manually.", filename, fileSize));
            this.fileSize = fileSize;
            this.filename = filename;
        }

        public long getFileSize() {
            return fileSize;
        }

        public String getFilename() {
            return filename;
        }
    }

    /**
     * Thrown when a decoder matched the data but its structure does not hold up, or when
     * caller hints contradict the data size.
     */
    public static class MalformedRecordException extends PatternImportException {
        public MalformedRecordException(String message) {
            super(message);
        }

        public MalformedRecordException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Thrown when headerless RGB data admits no convincing LED/frame split.
     */
    public static class AmbiguousDimensionsException extends PatternImportException {
        private final int totalPixels;

        public AmbiguousDimensionsException(int totalPixels) {
            super(String.format("Cannot auto-detect dimensions for %d pixels. "
                    + "Please specify LED count and/or frame count.", totalPixels));
            this.totalPixels = totalPixels;
        }

        public int getTotalPixels() {
            return totalPixels;
        }
    }

    /**
     * Wraps a failure raised by the decoder the registry selected, naming that decoder.
     */
    public static class ParserFailedException extends PatternImportException {
        private final String formatName;

        public ParserFailedException(String formatName, Throwable cause) {
            super("Failed to parse as " + formatName + ": " + cause.getMessage(), cause);
            this.formatName = formatName;
        }

        public String getFormatName() {
            return formatName;
        }
    }
}
