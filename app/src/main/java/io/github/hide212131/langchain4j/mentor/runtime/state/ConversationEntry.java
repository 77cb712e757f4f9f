package io.github.hide212131.langchain4j.mentor.runtime.state;

import java.time.Instant;
import java.util.Objects;

/** One message in the append-only conversation log. */
public record ConversationEntry(String role, String content, Instant timestamp) {

    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";

    public ConversationEntry {
        Objects.requireNonNull(role, "role");
        content = content == null ? "" : content;
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public static ConversationEntry user(String content, Instant timestamp) {
        return new ConversationEntry(USER, content, timestamp);
    }

    public static ConversationEntry assistant(String content, Instant timestamp) {
        return new ConversationEntry(ASSISTANT, content, timestamp);
    }
}
