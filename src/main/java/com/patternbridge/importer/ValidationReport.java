/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.patternbridge.importer;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.patternbridge.utils.JacksonConfig;

import java.time.Instant;

/**
 * Outcome of a dry-run validation of a pattern file.
 *
 * <p>{@code valid} reflects detection only; the pattern statistics are filled in when a
 * best-effort decode succeeds and stay null otherwise.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ValidationReport {

    @JsonProperty("valid")
    private boolean valid;

    @JsonProperty("message")
    private String message;

    @JsonProperty("filename")
    private String filename;

    @JsonProperty("file_size")
    private Long fileSize;

    @JsonProperty("last_modified")
    private Instant lastModified;

    @JsonProperty("format")
    private String format;

    @JsonProperty("confidence")
    private Double confidence;

    @JsonProperty("leds")
    private Integer leds;

    @JsonProperty("frames")
    private Integer frames;

    @JsonProperty("duration_ms")
    private Long durationMs;

    @JsonProperty("fps")
    private Double fps;

    public ValidationReport() {
    }

    static ValidationReport invalid(String filename, String message) {
        ValidationReport report = new ValidationReport();
        report.setValid(false);
        report.setFilename(filename);
        report.setMessage(message);
        return report;
    }

    public String toJson() throws JsonProcessingException {
        return JacksonConfig.mapper().writeValueAsString(this);
    }

    public boolean isValid() {
        return valid;
    }

    public void setValid(boolean valid) {
        this.valid = valid;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public String getFilename() {
        return filename;
    }

    public void setFilename(String filename) {
        this.filename = filename;
    }

    public Long getFileSize() {
        return fileSize;
    }

    public void setFileSize(Long fileSize) {
        this.fileSize = fileSize;
    }

    public Instant getLastModified() {
        return lastModified;
    }

    public void setLastModified(Instant lastModified) {
        this.lastModified = lastModified;
    }

    public String getFormat() {
        return format;
    }

    public void setFormat(String format) {
        this.format = format;
    }

    public Double getConfidence() {
        return confidence;
    }

    public void setConfidence(Double confidence) {
        this.confidence = confidence;
    }

    public Integer getLeds() {
        return leds;
    }

    public void setLeds(Integer leds) {
        this.leds = leds;
    }

    public Integer getFrames() {
        return frames;
    }

    public void setFrames(Integer frames) {
        this.frames = frames;
    }

    public Long getDurationMs() {
        return durationMs;
    }

    public void setDurationMs(Long durationMs) {
        this.durationMs = durationMs;
    }

    public Double getFps() {
        return fps;
    }

    public void setFps(Double fps) {
        this.fps = fps;
    }

    @Override
    public String toString() {
        return "ValidationReport{valid=" + valid + ", format=" + format + ", message='" + message + "'}";
    }
}
