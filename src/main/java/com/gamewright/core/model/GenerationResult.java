package com.gamewright.core.model;

import com.gamewright.core.error.GenerationErrorKind;

import java.nio.file.Path;

/**
 * Terminal outcome of a generation request: either an artifact path or an error, never both.
 */
public record GenerationResult(
        boolean success,
        Path outputPath,
        String error,
        GenerationErrorKind errorKind
) {
    public GenerationResult {
        if (success) {
            if (outputPath == null) {
                throw new IllegalArgumentException("A successful result needs an output path");
            }
            if (error != null || errorKind != null) {
                throw new IllegalArgumentException("A successful result cannot carry an error");
            }
        } else {
            if (error == null || errorKind == null) {
                throw new IllegalArgumentException("A failed result needs an error message and kind");
            }
            if (outputPath != null) {
                throw new IllegalArgumentException("A failed result cannot carry an output path");
            }
        }
    }

    public static GenerationResult succeeded(Path outputPath) {
        return new GenerationResult(true, outputPath, null, null);
    }

    public static GenerationResult failed(GenerationErrorKind kind, String error) {
        return new GenerationResult(false, null, error == null || error.isBlank() ? kind.name() : error, kind);
    }
}
