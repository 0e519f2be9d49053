/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.patternbridge.importer;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Guesses LED wiring and the data-in corner from words in a filename.
 *
 * <p>Exporters often name files after their settings, e.g.
 * {@code "12x6 left to right alternate up down 33 frames.bin"}. That one yields
 * Column-serpentine wiring entering at the bottom-left corner.
 */
public final class FilenameHintExtractor {

    public static final String ROW_MAJOR = "Row-major";
    public static final String SERPENTINE = "Serpentine";
    public static final String COLUMN_MAJOR = "Column-major";
    public static final String COLUMN_SERPENTINE = "Column-serpentine";

    private static final Set<String> SERPENTINE_WORDS =
            Set.of("serpentine", "serp", "snake", "zigzag", "alternate", "alternating", "alt");
    private static final Set<String> COLUMN_WORDS =
            Set.of("column", "columns", "col", "cols", "colmajor", "columnmajor", "vertical");
    private static final Set<String> ROW_WORDS =
            Set.of("row", "rows", "rowmajor", "progressive");
    private static final Set<String> COLUMN_SERPENTINE_WORDS =
            Set.of("colserp", "colserpentine", "columnserpentine", "columnserp");

    private FilenameHintExtractor() {}

    public static WiringHints extract(String filename) {
        if (filename == null || filename.isBlank()) {
            return WiringHints.NONE;
        }
        List<String> tokens = tokenize(filename);
        String wiring = wiringMode(tokens);
        String corner = corner(tokens);

        double confidence;
        if (wiring != null && corner != null) {
            confidence = 0.9;
        } else if (wiring != null) {
            confidence = 0.7;
        } else if (corner != null) {
            confidence = 0.6;
        } else {
            confidence = 0.0;
        }
        return new WiringHints(wiring, corner, confidence);
    }

    static List<String> tokenize(String filename) {
        String name = filename.toLowerCase(Locale.ROOT);
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        if (slash >= 0) {
            name = name.substring(slash + 1);
        }
        int dot = name.lastIndexOf('.');
        if (dot > 0) {
            name = name.substring(0, dot);
        }
        List<String> tokens = new ArrayList<>();
        for (String token : name.split("[^a-z0-9]+")) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    private static String wiringMode(List<String> tokens) {
        if (containsAny(tokens, COLUMN_SERPENTINE_WORDS)) {
            return COLUMN_SERPENTINE;
        }
        boolean columns = containsAny(tokens, COLUMN_WORDS);
        boolean verticalRun = verticalAlternation(tokens) != null;
        if (containsAny(tokens, SERPENTINE_WORDS)) {
            return columns || verticalRun ? COLUMN_SERPENTINE : SERPENTINE;
        }
        if (columns) {
            return verticalRun ? COLUMN_SERPENTINE : COLUMN_MAJOR;
        }
        if (containsAny(tokens, ROW_WORDS)) {
            return ROW_MAJOR;
        }
        return null;
    }

    private static String corner(List<String> tokens) {
        for (String token : tokens) {
            switch (token) {
                case "lt", "tl", "topleft", "lefttop":
                    return "LT";
                case "lb", "bl", "bottomleft", "leftbottom":
                    return "LB";
                case "rt", "tr", "topright", "righttop":
                    return "RT";
                case "rb", "br", "bottomright", "rightbottom":
                    return "RB";
                default:
                    break;
            }
        }

        String horizontal = null;
        if (phrase(tokens, "left", "to", "right")) {
            horizontal = "L";
        } else if (phrase(tokens, "right", "to", "left")) {
            horizontal = "R";
        }

        String vertical = null;
        if (phrase(tokens, "top", "to", "bottom")) {
            vertical = "T";
        } else if (phrase(tokens, "bottom", "to", "top")) {
            vertical = "B";
        } else {
            String first = verticalAlternation(tokens);
            if ("up".equals(first)) {
                vertical = "B";
            } else if ("down".equals(first)) {
                vertical = "T";
            }
        }

        if (vertical == null) {
            if (phrase(tokens, "top", "left")) return "LT";
            if (phrase(tokens, "bottom", "left")) return "LB";
            if (phrase(tokens, "top", "right")) return "RT";
            if (phrase(tokens, "bottom", "right")) return "RB";
        }
        if (horizontal != null && vertical != null) {
            return horizontal + vertical;
        }
        return null;
    }

    /**
     * First direction of an "up down" or "down up" run, or null when there is none.
     */
    private static String verticalAlternation(List<String> tokens) {
        for (int i = 0; i + 1 < tokens.size(); i++) {
            String a = tokens.get(i);
            String b = tokens.get(i + 1);
            if ((a.equals("up") && b.equals("down")) || (a.equals("down") && b.equals("up"))) {
                return a;
            }
        }
        for (String token : tokens) {
            if (token.equals("updown")) return "up";
            if (token.equals("downup")) return "down";
        }
        return null;
    }

    private static boolean phrase(List<String> tokens, String... words) {
        outer:
        for (int i = 0; i + words.length <= tokens.size(); i++) {
            for (int j = 0; j < words.length; j++) {
                if (!tokens.get(i + j).equals(words[j])) {
                    continue outer;
                }
            }
            return true;
        }
        return false;
    }

    private static boolean containsAny(List<String> tokens, Set<String> words) {
        for (String token : tokens) {
            if (words.contains(token)) {
                return true;
            }
        }
        return false;
    }
}
