package com.social.application.http;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

public final class JsonMappers {

    private JsonMappers() {}

    public static ObjectMapper standard() {
        ObjectMapper om = new ObjectMapper();
        om.registerModule(new JavaTimeModule());
        // 2024-05-01T10:15:30Z rather than epoch numbers
        om.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        om.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        // one value per body; anything after it makes the body malformed
        om.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        return om;
    }
}
