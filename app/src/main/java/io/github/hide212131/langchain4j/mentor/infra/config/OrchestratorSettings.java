package io.github.hide212131.langchain4j.mentor.infra.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Tunables for the orchestration core, read from {@code orchestrator.yaml}.
 *
 * @param expandDownstream      whether auto-mode plans append consumers of artifacts produced this turn
 * @param unknownIntentPipeline whether an auto turn with no matched intent plans every declared agent
 * @param llmClassifierEnabled  whether the LLM intent classifier is tried before the keyword rules
 * @param classifierTimeout     upper bound for one LLM classification call
 * @param capabilitiesResource  classpath resource or file path of the capability table
 * @param intentsResource       classpath resource or file path of the intent patterns
 * @param storeDirectory        directory of the JSON session store, or {@code null} for in-memory only
 */
public record OrchestratorSettings(
        boolean expandDownstream,
        boolean unknownIntentPipeline,
        boolean llmClassifierEnabled,
        Duration classifierTimeout,
        String capabilitiesResource,
        String intentsResource,
        String storeDirectory) {

    public static final String DEFAULT_CAPABILITIES = "capabilities.yaml";
    public static final String DEFAULT_INTENTS = "intents.yaml";

    public OrchestratorSettings {
        Objects.requireNonNull(classifierTimeout, "classifierTimeout");
        if (classifierTimeout.isNegative() || classifierTimeout.isZero()) {
            throw new IllegalArgumentException("classifierTimeout must be positive");
        }
        capabilitiesResource = blankToDefault(capabilitiesResource, DEFAULT_CAPABILITIES);
        intentsResource = blankToDefault(intentsResource, DEFAULT_INTENTS);
        storeDirectory = storeDirectory == null || storeDirectory.isBlank() ? null : storeDirectory.trim();
    }

    public static OrchestratorSettings defaults() {
        return new OrchestratorSettings(
                true, false, true, Duration.ofSeconds(10), DEFAULT_CAPABILITIES, DEFAULT_INTENTS, null);
    }

    public OrchestratorSettings withStoreDirectory(String directory) {
        return new OrchestratorSettings(
                expandDownstream,
                unknownIntentPipeline,
                llmClassifierEnabled,
                classifierTimeout,
                capabilitiesResource,
                intentsResource,
                directory);
    }

    private static String blankToDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }
}
