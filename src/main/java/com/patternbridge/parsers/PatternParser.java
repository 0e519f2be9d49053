/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.patternbridge.parsers;

import com.patternbridge.model.Pattern;

/**
 * Contract shared by every pattern file decoder.
 *
 * <p>Implementations hold no per-call state, so one instance may serve concurrent imports
 * of different files. Hints are nullable: {@code null} means the caller did not supply one.
 */
public interface PatternParser {

    /**
     * Cheap check whether the data looks like this format. Must not modify anything and
     * should only sample as much of the buffer as it needs.
     *
     * @param data whole file contents
     * @param filename original filename, may be empty
     * @param suggestedLeds caller's LED count, or null
     * @param suggestedFrames caller's frame count, or null
     * @return true if this decoder is willing to parse the data
     */
    boolean detect(byte[] data, String filename, Integer suggestedLeds, Integer suggestedFrames);

    /**
     * Decode the data.
     *
     * @param data whole file contents
     * @param suggestedLeds caller's LED count, or null
     * @param suggestedFrames caller's frame count, or null
     * @return a pattern with consistent frame sizes
     * @throws PatternImportException if the structure is invalid or hints contradict the data
     */
    Pattern parse(byte[] data, Integer suggestedLeds, Integer suggestedFrames) throws PatternImportException;

    /**
     * Confidence in [0,1] that the data is in this format; 0 when it is not a match.
     */
    double getConfidence(byte[] data);

    String getFormatName();

    String getFormatDescription();
}
