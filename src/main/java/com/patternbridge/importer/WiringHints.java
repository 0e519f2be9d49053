/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.patternbridge.importer;

/**
 * Wiring guesses taken from a filename.
 *
 * @param wiringMode Row-major, Serpentine, Column-major or Column-serpentine; null if unknown
 * @param dataInCorner LT, LB, RT or RB; null if unknown
 * @param confidence 0.0 when nothing was found
 */
public record WiringHints(String wiringMode, String dataInCorner, double confidence) {

    public static final WiringHints NONE = new WiringHints(null, null, 0.0);

    public boolean isEmpty() {
        return wiringMode == null && dataInCorner == null;
    }
}
