package com.gamewright.core.model;

import com.gamewright.core.error.GenerationErrorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class GenerationResultTest {

    @Test
    @DisplayName("succeeded carries a path and no error")
    void succeeded() {
        var result = GenerationResult.succeeded(Path.of("out/Chem-spec.md"));
        assertTrue(result.success());
        assertEquals(Path.of("out/Chem-spec.md"), result.outputPath());
        assertNull(result.error());
        assertNull(result.errorKind());
    }

    @Test
    @DisplayName("failed carries kind and message and no path")
    void failed() {
        var result = GenerationResult.failed(GenerationErrorKind.UPLOAD_TIMEOUT, "Timed out");
        assertFalse(result.success());
        assertNull(result.outputPath());
        assertEquals("Timed out", result.error());
        assertEquals(GenerationErrorKind.UPLOAD_TIMEOUT, result.errorKind());
    }

    @Test
    @DisplayName("failed with a blank message falls back to the kind name")
    void failedWithoutMessage() {
        var result = GenerationResult.failed(GenerationErrorKind.INTERNAL, " ");
        assertEquals("INTERNAL", result.error());
    }

    @Test
    @DisplayName("a result cannot be both successful and failed")
    void rejectsMixedStates() {
        assertThrows(IllegalArgumentException.class,
                () -> new GenerationResult(true, null, null, null));
        assertThrows(IllegalArgumentException.class,
                () -> new GenerationResult(true, Path.of("a"), "boom", GenerationErrorKind.INTERNAL));
        assertThrows(IllegalArgumentException.class,
                () -> new GenerationResult(false, Path.of("a"), "boom", GenerationErrorKind.INTERNAL));
        assertThrows(IllegalArgumentException.class,
                () -> new GenerationResult(false, null, null, null));
    }
}
