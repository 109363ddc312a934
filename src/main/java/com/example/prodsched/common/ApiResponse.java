package com.example.prodsched.common;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Common response envelope. The dashboard reads the {@code success} flag and
 * the {@code data} field on every endpoint.
 */
public record ApiResponse<T>(boolean success, String message, T data, Map<String, Object> meta) {

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(true, null, data, Collections.emptyMap());
    }

    public static <T> ApiResponse<T> success(String message, T data) {
        return new ApiResponse<>(true, message, data, Collections.emptyMap());
    }

    public static <T> ApiResponse<T> success(String message, T data, Map<String, Object> meta) {
        return new ApiResponse<>(true, message, data,
                meta == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(meta)));
    }

    public static <T> ApiResponse<T> failure(String message) {
        return new ApiResponse<>(false, message, null, Collections.emptyMap());
    }
}
