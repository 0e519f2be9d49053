/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.patternbridge.model;

/**
 * How a pattern's width x height was determined.
 */
public enum DimensionSource {
    /** Read verbatim from a file header. */
    HEADER,
    /** Inferred from pixel content by layout detection. */
    DETECTOR,
    /** Guessed without convincing evidence (strip or preferred-width table). */
    FALLBACK,
    /** Supplied by the user. */
    MANUAL,
    UNKNOWN;

    /** Lower-case name as shown to users and stored in reports. */
    public String label() {
        return name().toLowerCase();
    }
}
