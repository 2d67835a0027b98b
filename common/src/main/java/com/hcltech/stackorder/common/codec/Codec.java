package com.hcltech.stackorder.common.codec;

import com.fasterxml.jackson.core.type.TypeReference;
import com.hcltech.stackorder.common.errorsor.ErrorsOr;

public interface Codec<From, To> {

    ErrorsOr<To> encode(From from);

    ErrorsOr<From> decode(To to);

    static Codec<Object, String> json() {
        return new JacksonJsonCodec();
    }

    /** Use for generic targets such as {@code List<MyRecord>}. */
    static <T> Codec<T, String> typed(TypeReference<T> typeRef) {
        return new JacksonTypedJsonCodec<>(typeRef);
    }
}
