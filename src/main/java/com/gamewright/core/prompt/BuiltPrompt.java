package com.gamewright.core.prompt;

/**
 * Rendered prompt plus the optional system instruction that accompanies it.
 */
public record BuiltPrompt(String prompt, String systemInstruction) {

    public boolean hasSystemInstruction() {
        return systemInstruction != null && !systemInstruction.isBlank();
    }
}
