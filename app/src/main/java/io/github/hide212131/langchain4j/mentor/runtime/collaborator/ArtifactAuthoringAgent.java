package io.github.hide212131.langchain4j.mentor.runtime.collaborator;

import dev.langchain4j.agentic.Agent;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * Typed LangChain4j agent behind every LLM collaborator. Implementation is created via
 * {@code AgenticServices.agentBuilder(ArtifactAuthoringAgent.class)}.
 */
public interface ArtifactAuthoringAgent {

    @SystemMessage("""
            You are one specialist in a small team that turns a product idea into a project plan.
            Answer with a single JSON object and nothing else:
            {"reply": "<short message to the user>", "artifact": <the artifact you produce, or null>}
            Base the artifact on the project context; do not invent requirements the user never mentioned.
            """)
    @UserMessage("""
            Role: {{role}}
            Artifact: {{artifactName}}
            Instructions: {{instructions}}

            Project context (JSON):
            {{context}}

            User message:
            {{message}}
            """)
    @Agent(value = "artifactAuthoringAgent", description = "Writes or revises one project artifact")
    String write(
            @V("role") String role,
            @V("artifactName") String artifactName,
            @V("instructions") String instructions,
            @V("context") String context,
            @V("message") String message);
}
