package com.lbg.feedreader.api;

/**
 * Body of every error response: {@code {"error": "<message>"}}.
 */
public record ErrorResponse(String error) {

    public static ErrorResponse of(Throwable t) {
        return new ErrorResponse(t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName());
    }
}
