package com.sparrowlogic.reachability.model;

import java.util.function.Supplier;

public sealed interface LookupResult<T> permits LookupResult.Found, LookupResult.NotFound {

    record Found<T>(T value) implements LookupResult<T> {}

    record NotFound<T>(String reason) implements LookupResult<T> {}

    static <T> LookupResult<T> found(T value) {
        return new Found<>(value);
    }

    static <T> LookupResult<T> notFound(String reason) {
        return new NotFound<>(reason);
    }

    default LookupResult<T> orElse(Supplier<LookupResult<T>> fallback) {
        return this instanceof Found<T> ? this : fallback.get();
    }
}
