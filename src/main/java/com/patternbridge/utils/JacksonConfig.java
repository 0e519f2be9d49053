/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.patternbridge.utils;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared ObjectMapper for import reports. ObjectMapper is thread-safe after configuration,
 * so the instance is reused by every caller.
 */
public final class JacksonConfig {

    private static final ObjectMapper INSTANCE = configure(new ObjectMapper());

    private JacksonConfig() {}

    private static ObjectMapper configure(ObjectMapper mapper) {
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        return mapper;
    }

    /** Compact mapper; timestamps as ISO-8601 strings, null fields omitted. */
    public static ObjectMapper mapper() {
        return INSTANCE;
    }
}
