package com.gamewright.core.llm;

/**
 * Single-shot text generation against a provider that takes the whole prompt inline.
 * Each call makes exactly one outbound request.
 */
public interface TextGenerationClient {

    /**
     * @param prompt            the rendered user prompt
     * @param systemInstruction optional system instruction, may be {@code null}
     * @return the generated text, possibly empty
     */
    String sendText(String prompt, String systemInstruction);
}
