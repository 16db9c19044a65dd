package org.iceforge.strata.semantic.web;

import org.iceforge.strata.semantic.compiler.SemanticCompileException;

import java.time.Instant;

/**
 * Error body returned by the semantic endpoints. {@code error} is a stable machine-readable code.
 */
public record ErrorResponse(Instant timestamp, String error, String detail) {

    public static ErrorResponse of(String error, String detail) {
        return new ErrorResponse(Instant.now(), error, detail);
    }

    public static ErrorResponse of(SemanticCompileException e) {
        return of(e.code(), e.getMessage());
    }
}
