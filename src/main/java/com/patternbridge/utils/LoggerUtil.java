/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.patternbridge.utils;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Minimal console logger shared by the import pipeline.
 *
 * <p>Lines look like {@code [2025-01-01 12:00:00.000][INFO] [ParserRegistry] message}.
 * Debug output is off unless enabled through {@link #setDebugEnabled(boolean)} or the
 * {@code log.debug.enabled} setting. Tests may redirect output with {@link #setSink(Consumer)}.
 */
public final class LoggerUtil {
    private static final DateTimeFormatter TS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");
    private static final Consumer<String> CONSOLE = System.out::println;

    private static volatile boolean silent = false;
    private static volatile boolean debugEnabled = false;
    private static volatile Consumer<String> sink = CONSOLE;

    public static void log(String level, String msg) {
        if (silent) return;
        sink.accept("[" + TS.format(LocalDateTime.now()) + "][" + level + "] " + msg);
    }

    public static void info(String msg) { log("INFO", msg); }
    public static void warn(String msg) { log("WARN", msg); }
    public static void error(String msg) { log("ERROR", msg); }
    public static void debug(String msg) { if (debugEnabled) log("DEBUG", msg); }
    public static void debug(Supplier<String> msgSupplier) {
        if (debugEnabled && !silent) {
            log("DEBUG", msgSupplier.get());
        }
    }

    public static boolean isDebugEnabled() { return debugEnabled && !silent; }
    public static void setDebugEnabled(boolean enabled) { debugEnabled = enabled; }

    public static void setSilent(boolean silent) { LoggerUtil.silent = silent; }

    /**
     * Redirects log lines, e.g. to collect them in a test.
     *
     * @param newSink receiver of formatted lines; {@code null} restores console output
     */
    public static void setSink(Consumer<String> newSink) {
        sink = newSink != null ? newSink : CONSOLE;
    }

    private LoggerUtil() {}
}
