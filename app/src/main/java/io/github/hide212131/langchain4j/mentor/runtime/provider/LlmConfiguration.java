package io.github.hide212131.langchain4j.mentor.runtime.provider;

import java.time.Duration;
import java.util.Objects;

/** Resolved chat model settings. */
public record LlmConfiguration(LlmProvider provider, String openAiApiKey, String openAiModel, Duration timeout) {

    public static final String DEFAULT_MODEL = "gpt-4o-mini";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(120);

    private static final int MASK_THRESHOLD = 8;
    private static final int MASK_SUFFIX_LENGTH = 4;

    public LlmConfiguration {
        Objects.requireNonNull(provider, "provider");
        openAiModel = openAiModel == null || openAiModel.isBlank() ? DEFAULT_MODEL : openAiModel;
        timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;
    }

    public static LlmConfiguration mock() {
        return new LlmConfiguration(LlmProvider.MOCK, null, null, null);
    }

    public String maskedApiKey() {
        if (openAiApiKey == null || openAiApiKey.isBlank()) {
            return "(none)";
        }
        if (openAiApiKey.length() <= MASK_THRESHOLD) {
            return "****";
        }
        return "****" + openAiApiKey.substring(openAiApiKey.length() - MASK_SUFFIX_LENGTH);
    }

    @Override
    public String toString() {
        return "LlmConfiguration[provider=" + provider + ", model=" + openAiModel
                + ", apiKey=" + maskedApiKey() + ", timeout=" + timeout + "]";
    }
}
