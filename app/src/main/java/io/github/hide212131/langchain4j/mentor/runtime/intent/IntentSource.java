package io.github.hide212131.langchain4j.mentor.runtime.intent;

/** Where an {@link IntentResult} came from. */
public enum IntentSource {
    RULES,
    LLM,
    MANUAL
}
