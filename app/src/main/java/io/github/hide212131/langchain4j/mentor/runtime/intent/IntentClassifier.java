package io.github.hide212131.langchain4j.mentor.runtime.intent;

import io.github.hide212131.langchain4j.mentor.runtime.capability.Phase;

/** Maps a user message to an intent and the collaborators that should handle it. */
@FunctionalInterface
public interface IntentClassifier {

    IntentResult classify(String userInput, Phase currentPhase);
}
