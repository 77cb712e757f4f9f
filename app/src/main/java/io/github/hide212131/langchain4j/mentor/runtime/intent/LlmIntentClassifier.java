package io.github.hide212131.langchain4j.mentor.runtime.intent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.hide212131.langchain4j.mentor.runtime.capability.CapabilityEntry;
import io.github.hide212131.langchain4j.mentor.runtime.capability.CapabilityGraph;
import io.github.hide212131.langchain4j.mentor.runtime.capability.Phase;
import io.github.hide212131.langchain4j.mentor.runtime.provider.LangChain4jLlmClient;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Asks the chat model to pick the intent and collaborators for a message. The model must answer with
 * {@code {"primary_intent": ..., "requires_agents": [...], "confidence": ...}}; agent ids that are not
 * declared in the capability graph are dropped.
 */
public final class LlmIntentClassifier implements IntentClassifier {

    private final LangChain4jLlmClient llmClient;
    private final CapabilityGraph graph;
    private final List<IntentPattern> patterns;
    private final ObjectMapper objectMapper;

    public LlmIntentClassifier(
            LangChain4jLlmClient llmClient, CapabilityGraph graph, List<IntentPattern> patterns, ObjectMapper objectMapper) {
        this.llmClient = Objects.requireNonNull(llmClient, "llmClient");
        this.graph = Objects.requireNonNull(graph, "graph");
        this.patterns = List.copyOf(Objects.requireNonNull(patterns, "patterns"));
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    @Override
    public IntentResult classify(String userInput, Phase currentPhase) {
        String reply = llmClient.complete(buildPrompt(userInput, currentPhase)).content();
        return parse(reply);
    }

    String buildPrompt(String userInput, Phase currentPhase) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("You route messages in a project planning conversation to specialist agents.\n");
        prompt.append("Current project phase: ").append(currentPhase == null ? "unknown" : currentPhase.wireName());
        prompt.append("\n\nIntents:\n");
        for (IntentPattern pattern : patterns) {
            prompt.append("- ").append(pattern.name())
                    .append(" (keywords: ").append(String.join(", ", pattern.keywords()))
                    .append("; agents: ").append(String.join(", ", pattern.agents()))
                    .append(")\n");
        }
        prompt.append("\nAgents:\n");
        for (CapabilityEntry entry : graph.entries()) {
            prompt.append("- ").append(entry.id()).append(": ").append(entry.description()).append('\n');
        }
        prompt.append("\nAnswer with JSON only, for example ")
                .append("{\"primary_intent\": \"architecture_design\", \"requires_agents\": [\"project_architect\"], ")
                .append("\"confidence\": 0.8}. Use \"unknown\" and an empty list when no intent fits.\n\n");
        prompt.append("Message:\n").append(userInput == null ? "" : userInput.trim());
        return prompt.toString();
    }

    IntentResult parse(String reply) {
        if (reply == null || reply.isBlank()) {
            throw new IntentClassificationException("Chat model returned an empty classification");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(stripCodeFence(reply));
        } catch (JsonProcessingException e) {
            throw new IntentClassificationException("Classification is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new IntentClassificationException("Classification must be a JSON object");
        }
        String intent = root.path("primary_intent").asText("").trim();
        if (intent.isEmpty()) {
            throw new IntentClassificationException("Classification has no primary_intent");
        }
        Set<String> agents = new LinkedHashSet<>();
        for (JsonNode node : root.path("requires_agents")) {
            String id = node.asText("").trim();
            if (graph.contains(id)) {
                agents.add(id);
            }
        }
        double confidence = root.path("confidence").asDouble(0.0);
        return new IntentResult(intent, new ArrayList<>(agents), confidence, IntentSource.LLM);
    }

    private static String stripCodeFence(String reply) {
        String trimmed = reply.trim();
        if (!trimmed.startsWith("```")) {
            return trimmed;
        }
        int firstLineEnd = trimmed.indexOf('\n');
        int closing = trimmed.lastIndexOf("```");
        if (firstLineEnd < 0 || closing <= firstLineEnd) {
            return trimmed;
        }
        return trimmed.substring(firstLineEnd + 1, closing).trim();
    }
}
