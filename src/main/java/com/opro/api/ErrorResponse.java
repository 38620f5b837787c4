package com.opro.api;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorResponse(
        boolean success,
        String error,
        String message,
        List<String> details
) {
    public static ErrorResponse of(String error, String message) {
        return new ErrorResponse(false, error, message, List.of());
    }

    public static ErrorResponse of(String error, String message, List<String> details) {
        return new ErrorResponse(false, error, message, details);
    }
}
