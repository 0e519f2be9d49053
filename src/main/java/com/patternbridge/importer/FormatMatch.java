/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.patternbridge.importer;

import com.patternbridge.parsers.PatternParser;

/**
 * A decoder that recognised the data, with its confidence in [0,1].
 */
public record FormatMatch(PatternParser parser, double confidence) {

    public String formatName() {
        return parser.getFormatName();
    }
}
