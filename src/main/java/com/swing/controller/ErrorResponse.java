package com.swing.controller;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Error body. {@code fetching} is only present while the first generation is being built.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String error, Boolean fetching) {

    public static ErrorResponse of(String message) {
        return new ErrorResponse(message, null);
    }

    public static ErrorResponse warmingUp(String message) {
        return new ErrorResponse(message, true);
    }
}
