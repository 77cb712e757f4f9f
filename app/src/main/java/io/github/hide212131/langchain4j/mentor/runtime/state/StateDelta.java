package io.github.hide212131.langchain4j.mentor.runtime.state;

import io.github.hide212131.langchain4j.mentor.runtime.capability.Phase;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A set of changes to apply to one {@link ProjectRecord} in a single atomic update.
 *
 * <p>Artifacts and the scalar fields are overwritten; conversation entries are appended.
 */
public final class StateDelta {

    public static final String PHASE = "phase";
    public static final String AGENT_SELECTION_MODE = "agent_selection_mode";
    public static final String SELECTED_AGENT_ID = "selected_agent_id";
    public static final String CONVERSATION_HISTORY = "conversation_history";

    private static final Map<String, MergeStrategy> FIELD_STRATEGIES = Map.of(
            PHASE, MergeStrategy.OVERWRITE,
            AGENT_SELECTION_MODE, MergeStrategy.OVERWRITE,
            SELECTED_AGENT_ID, MergeStrategy.OVERWRITE,
            CONVERSATION_HISTORY, MergeStrategy.APPEND);

    private final Map<String, Object> artifacts;
    private final Phase phase;
    private final SelectionMode agentSelectionMode;
    private final boolean selectedAgentIdChanged;
    private final String selectedAgentId;
    private final List<ConversationEntry> conversationEntries;

    private StateDelta(Builder builder) {
        this.artifacts = Collections.unmodifiableMap(new LinkedHashMap<>(builder.artifacts));
        this.phase = builder.phase;
        this.agentSelectionMode = builder.agentSelectionMode;
        this.selectedAgentIdChanged = builder.selectedAgentIdChanged;
        this.selectedAgentId = builder.selectedAgentId;
        this.conversationEntries = List.copyOf(builder.conversationEntries);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static StateDelta ofArtifacts(Map<String, Object> artifacts) {
        return builder().artifacts(artifacts).build();
    }

    /** Strategy for one of the named record fields; unknown names overwrite. */
    public static MergeStrategy strategyFor(String field) {
        return FIELD_STRATEGIES.getOrDefault(field, MergeStrategy.OVERWRITE);
    }

    /** Artifacts are always overwritten, whatever their name. */
    public static MergeStrategy artifactStrategy() {
        return MergeStrategy.OVERWRITE;
    }

    public Map<String, Object> artifacts() {
        return artifacts;
    }

    public Phase phase() {
        return phase;
    }

    public SelectionMode agentSelectionMode() {
        return agentSelectionMode;
    }

    public boolean selectedAgentIdChanged() {
        return selectedAgentIdChanged;
    }

    public String selectedAgentId() {
        return selectedAgentId;
    }

    public List<ConversationEntry> conversationEntries() {
        return conversationEntries;
    }

    /** Artifact names plus the record fields this delta touches, in application order. */
    public Set<String> keys() {
        Set<String> keys = new LinkedHashSet<>(artifacts.keySet());
        if (phase != null) {
            keys.add(PHASE);
        }
        if (agentSelectionMode != null) {
            keys.add(AGENT_SELECTION_MODE);
        }
        if (selectedAgentIdChanged) {
            keys.add(SELECTED_AGENT_ID);
        }
        if (!conversationEntries.isEmpty()) {
            keys.add(CONVERSATION_HISTORY);
        }
        return Collections.unmodifiableSet(keys);
    }

    public boolean isEmpty() {
        return keys().isEmpty();
    }

    @Override
    public String toString() {
        return "StateDelta" + keys();
    }

    public static final class Builder {
        private final Map<String, Object> artifacts = new LinkedHashMap<>();
        private Phase phase;
        private SelectionMode agentSelectionMode;
        private boolean selectedAgentIdChanged;
        private String selectedAgentId;
        private final List<ConversationEntry> conversationEntries = new ArrayList<>();

        private Builder() {
        }

        public Builder artifact(String name, Object value) {
            artifacts.put(Objects.requireNonNull(name, "name"), value);
            return this;
        }

        public Builder artifacts(Map<String, ?> values) {
            if (values != null) {
                values.forEach(this::artifact);
            }
            return this;
        }

        public Builder phase(Phase value) {
            this.phase = value;
            return this;
        }

        public Builder agentSelectionMode(SelectionMode value) {
            this.agentSelectionMode = value;
            return this;
        }

        public Builder selectedAgentId(String value) {
            this.selectedAgentIdChanged = true;
            this.selectedAgentId = value;
            return this;
        }

        public Builder append(ConversationEntry entry) {
            conversationEntries.add(Objects.requireNonNull(entry, "entry"));
            return this;
        }

        public StateDelta build() {
            return new StateDelta(this);
        }
    }
}
