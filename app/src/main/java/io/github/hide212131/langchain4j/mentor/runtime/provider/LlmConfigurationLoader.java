package io.github.hide212131.langchain4j.mentor.runtime.provider;

import io.github.cdimascio.dotenv.Dotenv;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Resolves LLM settings from environment variables, falling back to a {@code .env} file for keys
 * the environment does not define.
 */
public final class LlmConfigurationLoader {

    static final String ENV_LLM_PROVIDER = "LLM_PROVIDER";
    static final String ENV_OPENAI_API_KEY = "OPENAI_API_KEY";
    static final String ENV_OPENAI_MODEL_NAME = "OPENAI_MODEL_NAME";
    static final String ENV_OPENAI_TIMEOUT_SECONDS = "OPENAI_TIMEOUT_SECONDS";

    private final Map<String, String> environment;
    private final Dotenv dotenv;

    public LlmConfigurationLoader() {
        this(System.getenv(), Dotenv.configure().ignoreIfMalformed().ignoreIfMissing().load());
    }

    LlmConfigurationLoader(Map<String, String> environment, Dotenv dotenv) {
        this.environment = Map.copyOf(Objects.requireNonNull(environment, "environment"));
        this.dotenv = Objects.requireNonNull(dotenv, "dotenv");
    }

    public LlmConfiguration load() {
        return load(null);
    }

    public LlmConfiguration load(LlmProvider overrideProvider) {
        LlmProvider provider = overrideProvider != null
                ? overrideProvider
                : LlmProvider.from(resolveWithPriority(ENV_LLM_PROVIDER));
        String apiKey = trimToNull(resolveWithPriority(ENV_OPENAI_API_KEY));
        if (provider == LlmProvider.OPENAI && apiKey == null) {
            throw new IllegalStateException("OPENAI_API_KEY is required when LLM_PROVIDER=openai");
        }
        return new LlmConfiguration(
                provider,
                apiKey,
                trimToNull(resolveWithPriority(ENV_OPENAI_MODEL_NAME)),
                resolveTimeout(resolveWithPriority(ENV_OPENAI_TIMEOUT_SECONDS)));
    }

    private String resolveWithPriority(String key) {
        if (environment.containsKey(key)) {
            return environment.get(key);
        }
        return dotenv.get(key);
    }

    private static Duration resolveTimeout(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        long seconds;
        try {
            seconds = Long.parseLong(raw.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalStateException(ENV_OPENAI_TIMEOUT_SECONDS + " must be a positive integer (seconds)", ex);
        }
        if (seconds <= 0) {
            throw new IllegalStateException(ENV_OPENAI_TIMEOUT_SECONDS + " must be greater than zero");
        }
        return Duration.ofSeconds(seconds);
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
