package com.evolver.core.llm;

import com.evolver.core.config.JsonMappers;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.converter.BeanOutputConverter;

/**
 * Wraps Spring AI's {@link ChatClient} to produce structured (typed) or plain-text
 * output from LLM calls.
 * <p>
 * Structured calls use {@link BeanOutputConverter} to generate a JSON schema from the
 * target class, append format instructions to the user prompt, and deserialize the
 * response. When the converter rejects the response, a lenient Jackson parse that
 * strips Markdown fences is tried before giving up.
 */
public class LlmService {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private final ChatClient chatClient;
    private final ObjectMapper lenientMapper = JsonMappers.create();

    public LlmService(ChatClient chatClient) {
        this.chatClient = chatClient;
    }

    /**
     * Sends a system + user prompt and returns the response deserialized into {@code outputType}.
     *
     * @throws LlmEmptyResponseException when the model returns no content
     * @throws LlmParseException         when the content is not valid JSON for {@code outputType}
     */
    public <T> T structuredCall(String systemPrompt, String userPrompt, Class<T> outputType) {
        log.info("LLM call started -> {}", outputType.getSimpleName());
        long start = System.currentTimeMillis();
        var converter = new BeanOutputConverter<>(outputType);
        String response = chatClient.prompt()
                .system(systemPrompt)
                .user(userPrompt + "\n\n" + converter.getFormat())
                .call()
                .content();
        log.info("LLM call complete -> {} ({}s)", outputType.getSimpleName(),
                String.format("%.1f", (System.currentTimeMillis() - start) / 1000.0));
        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("LLM returned empty content for " + outputType.getSimpleName()
                    + ". Check that the model is running and supports structured JSON output.");
        }
        try {
            return converter.convert(response);
        } catch (RuntimeException e) {
            log.warn("Failed to parse LLM response to {}: {}", outputType.getSimpleName(), e.getMessage());
            log.debug("Raw LLM response: {}", response);
            return parseWithJackson(response, outputType);
        }
    }

    /**
     * Sends a system + user prompt and returns the raw text answer, trimmed.
     */
    public String textCall(String systemPrompt, String userPrompt) {
        String response = chatClient.prompt()
                .system(systemPrompt)
                .user(userPrompt)
                .call()
                .content();
        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("LLM returned empty text content");
        }
        return response.strip();
    }

    /**
     * Fallback JSON parsing with lenient settings.
     */
    <T> T parseWithJackson(String json, Class<T> outputType) {
        String cleaned = stripFences(json);
        try {
            T result = lenientMapper.readValue(cleaned, outputType);
            log.info("Jackson fallback parsing succeeded for {}", outputType.getSimpleName());
            return result;
        } catch (Exception e) {
            log.error("Jackson fallback parsing FAILED for {}: {}", outputType.getSimpleName(), e.getMessage());
            throw new LlmParseException("Failed to parse LLM response to " + outputType.getSimpleName()
                    + ": " + e.getMessage(), e);
        }
    }

    static String stripFences(String text) {
        String cleaned = text.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        return cleaned.trim();
    }
}
