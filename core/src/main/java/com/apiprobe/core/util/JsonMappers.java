package com.apiprobe.core.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/** 공용 ObjectMapper. 시간은 ISO-8601 문자열, 모르는 필드는 무시 */
public final class JsonMappers {
    private JsonMappers() {}

    private static final ObjectMapper SHARED = create();

    public static ObjectMapper shared() { return SHARED; }

    public static ObjectMapper create() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }
}
