package com.hcltech.stackorder.common.codec;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hcltech.stackorder.common.errorsor.ErrorsOr;

import java.util.Objects;

/** JSON bound to a generic target type, for example the list of plan entries the command prints. */
public final class JacksonTypedJsonCodec<T> implements Codec<T, String> {
    private final ObjectMapper mapper = JacksonJsonCodec.mapper();
    private final TypeReference<T> typeRef;

    public JacksonTypedJsonCodec(TypeReference<T> typeRef) {
        this.typeRef = Objects.requireNonNull(typeRef, "typeRef");
    }

    @Override
    public ErrorsOr<String> encode(T value) {
        return ErrorsOr.trying(() -> mapper.writeValueAsString(value), e -> JacksonJsonCodec.describe("encode to", e));
    }

    @Override
    public ErrorsOr<T> decode(String json) {
        return ErrorsOr.trying(() -> mapper.readValue(json, typeRef), e -> JacksonJsonCodec.describe("decode from", e));
    }
}
