package io.github.hide212131.langchain4j.mentor.runtime.intent;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.hide212131.langchain4j.mentor.runtime.capability.CapabilityGraphLoader;
import io.github.hide212131.langchain4j.mentor.runtime.capability.Phase;
import io.github.hide212131.langchain4j.mentor.runtime.capability.PhaseCompatibility;
import java.util.List;
import org.junit.jupiter.api.Test;

class RuleBasedIntentClassifierTest {

    private final List<IntentPattern> patterns =
            new IntentPatternLoader(new CapabilityGraphLoader().load("capabilities.yaml")).load("intents.yaml");
    private final RuleBasedIntentClassifier classifier = new RuleBasedIntentClassifier(patterns);

    @Test
    void classify_shouldPickPatternWithMostHits() {
        IntentResult result = classifier.classify(
                "What architecture and database should we use for the API?", Phase.REQUIREMENTS_COMPLETE);

        assertThat(result.primaryIntent()).isEqualTo("architecture_design");
        assertThat(result.requiresAgents()).containsExactly("project_architect");
        assertThat(result.confidence()).isEqualTo(0.75);
        assertThat(result.source()).isEqualTo(IntentSource.RULES);
    }

    @Test
    void classify_shouldMatchWholeWordsOnly() {
        // "build" contains "ui" but must not count as a mockup keyword
        IntentResult result = classifier.classify("Let's build something", Phase.REQUIREMENTS_COMPLETE);

        assertThat(result.isUnknown()).isTrue();
    }

    @Test
    void classify_shouldMatchMultiWordPhrasesAcrossWhitespace() {
        IntentResult result = classifier.classify("Here is a USER   STORY for checkout", Phase.DISCOVERY);

        assertThat(result.primaryIntent()).isEqualTo("requirements_gathering");
    }

    @Test
    void classify_shouldSkipPatternsIncompatibleWithPhase() {
        // "roadmap" only routes once the architecture is complete
        IntentResult early = classifier.classify("Show me the roadmap", Phase.INITIALIZATION);
        IntentResult later = classifier.classify("Show me the roadmap", Phase.ARCHITECTURE_COMPLETE);

        assertThat(early.isUnknown()).isTrue();
        assertThat(later.requiresAgents()).containsExactly("execution_planner");
    }

    @Test
    void classify_withoutPhase_shouldConsiderEveryPattern() {
        IntentResult result = classifier.classify("Show me the roadmap", null);

        assertThat(result.primaryIntent()).isEqualTo("execution_planning");
    }

    @Test
    void classify_exportIsAvailableInEveryPhase() {
        assertThat(classifier.classify("Please export the plan", Phase.INITIALIZATION).requiresAgents())
                .containsExactly("exporter");
    }

    @Test
    void classify_onTie_shouldKeepEarlierDeclaration() {
        RuleBasedIntentClassifier tied = new RuleBasedIntentClassifier(List.of(
                new IntentPattern("first", List.of("alpha"), List.of(), PhaseCompatibility.any(), List.of("a")),
                new IntentPattern("second", List.of("beta"), List.of(), PhaseCompatibility.any(), List.of("b"))));

        IntentResult result = tied.classify("beta and alpha", Phase.DISCOVERY);

        assertThat(result.primaryIntent()).isEqualTo("first");
        assertThat(result.confidence()).isEqualTo(1.0);
    }

    @Test
    void classify_blankInput_shouldBeUnknown() {
        IntentResult result = classifier.classify("   ", Phase.DISCOVERY);

        assertThat(result.isUnknown()).isTrue();
        assertThat(result.confidence()).isZero();
    }
}
