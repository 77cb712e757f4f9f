package io.github.hide212131.langchain4j.mentor.runtime.workflow;

import io.github.hide212131.langchain4j.mentor.runtime.plan.AgentAvailability;
import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Builds the single assistant message for a turn.
 *
 * <p>One reply is returned as is. Several replies are concatenated in plan order under the
 * collaborator's name, so the last collaborator's reply closes the message.
 */
final class ResponseSynthesizer {

    static final String SEPARATOR = "\n\n---\n\n";

    String synthesize(List<AgentResult> results, List<AgentAvailability> available) {
        List<AgentResult> replies = new ArrayList<>();
        for (AgentResult result : results) {
            if (result.status() == AgentStatus.SUCCESS && result.content() != null && !result.content().isBlank()) {
                replies.add(result);
            }
        }
        if (replies.size() == 1) {
            return replies.get(0).content();
        }
        if (!replies.isEmpty()) {
            StringJoiner joiner = new StringJoiner(SEPARATOR);
            for (AgentResult reply : replies) {
                joiner.add("**" + reply.agentName() + "**\n" + reply.content().strip());
            }
            return joiner.toString();
        }
        if (results.isEmpty()) {
            return "I could not tell which part of the project to work on. " + availableHint(available);
        }
        StringJoiner status = new StringJoiner("; ", "No collaborator had anything to add this time (", ").");
        for (AgentResult result : results) {
            String entry = result.agentName() + ": " + result.status().wireName();
            if (result.status() == AgentStatus.ERROR && result.content() != null) {
                entry += " - " + result.content();
            }
            status.add(entry);
        }
        return status.toString();
    }

    String selectionPrompt(List<AgentAvailability> available) {
        return "Please choose a collaborator for this request. " + availableHint(available);
    }

    private static String availableHint(List<AgentAvailability> available) {
        List<String> names = new ArrayList<>();
        for (AgentAvailability agent : available) {
            if (agent.available()) {
                names.add(agent.agentName() + " (" + agent.agentId() + ")");
            }
        }
        if (names.isEmpty()) {
            return "No collaborator is available in the current phase.";
        }
        return "Available now: " + String.join(", ", names) + ".";
    }
}
