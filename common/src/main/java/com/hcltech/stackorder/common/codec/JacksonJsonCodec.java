package com.hcltech.stackorder.common.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.hcltech.stackorder.common.errorsor.ErrorsOr;

/**
 * Untyped JSON: anything Jackson can serialize goes out, maps and lists come back.
 * Property order follows the value being written, so callers control the output shape.
 */
public final class JacksonJsonCodec implements Codec<Object, String> {
    private final ObjectMapper mapper;

    public JacksonJsonCodec() {
        this.mapper = mapper();
    }

    /** Compact single-line output, so a plan is one line on stdout. */
    static ObjectMapper mapper() {
        ObjectMapper m = new ObjectMapper();
        m.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        return m;
    }

    @Override
    public ErrorsOr<String> encode(Object value) {
        return ErrorsOr.trying(() -> mapper.writeValueAsString(value), e -> describe("encode to", e));
    }

    @Override
    public ErrorsOr<Object> decode(String json) {
        return ErrorsOr.trying(() -> mapper.readValue(json, Object.class), e -> describe("decode from", e));
    }

    static String describe(String action, Exception e) {
        return "Failed to " + action + " JSON: " + e.getClass().getSimpleName() + ": " + e.getMessage();
    }
}
