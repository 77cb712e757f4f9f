package io.github.hide212131.langchain4j.mentor.runtime.provider;

import java.util.Locale;

/**
 * Chat model backend used by the LLM collaborators and the LLM intent classifier.
 */
public enum LlmProvider {
    MOCK,
    OPENAI;

    public static LlmProvider from(String value) {
        if (value == null || value.isBlank()) {
            return MOCK;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "openai" -> OPENAI;
            case "mock" -> MOCK;
            default -> throw new IllegalArgumentException("Unsupported LLM_PROVIDER: " + value);
        };
    }
}
