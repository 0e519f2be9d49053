/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.patternbridge.importer;

import com.patternbridge.model.Pattern;

/**
 * Decoded pattern plus the decoder that produced it and how sure detection was.
 */
public record ImportResult(Pattern pattern, String formatName, double confidence) {
}
