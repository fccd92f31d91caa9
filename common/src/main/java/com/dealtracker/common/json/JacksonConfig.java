package com.dealtracker.common.json;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.json.JsonMapper;

/**
 * Single place that decides how deal payloads are read and written. Upstream marketplace
 * responses carry many fields we do not model, and prices arrive as JSON floats or strings.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class JacksonConfig {

    public static JsonMapper createObjectMapper() {
        return JsonMapper.builder()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .build();
    }
}
