/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.patternbridge.model;

/**
 * One LED colour, each channel 0-255.
 */
public record Rgb(int red, int green, int blue) {

    public Rgb {
        checkChannel("red", red);
        checkChannel("green", green);
        checkChannel("blue", blue);
    }

    private static void checkChannel(String name, int value) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException(String.format("Invalid %s value: %d (expected 0-255)", name, value));
        }
    }
}
