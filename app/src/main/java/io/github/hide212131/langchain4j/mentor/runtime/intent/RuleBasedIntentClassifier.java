package io.github.hide212131.langchain4j.mentor.runtime.intent;

import io.github.hide212131.langchain4j.mentor.runtime.capability.Phase;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Deterministic keyword classifier.
 *
 * <p>Each keyword and trigger is matched as a whole word or phrase, case-insensitively. Patterns that
 * are not compatible with the current phase are skipped. The pattern with the most hits wins, earlier
 * declarations win ties, and confidence is {@code min(1, hits / keywordCount)}.
 */
public final class RuleBasedIntentClassifier implements IntentClassifier {

    private final List<CompiledPattern> patterns;

    public RuleBasedIntentClassifier(List<IntentPattern> patterns) {
        Objects.requireNonNull(patterns, "patterns");
        List<CompiledPattern> compiled = new ArrayList<>();
        for (IntentPattern pattern : patterns) {
            compiled.add(new CompiledPattern(pattern, compile(pattern.keywords()), compile(pattern.triggers())));
        }
        this.patterns = List.copyOf(compiled);
    }

    @Override
    public IntentResult classify(String userInput, Phase currentPhase) {
        if (userInput == null || userInput.isBlank()) {
            return IntentResult.unknown(IntentSource.RULES);
        }
        String text = userInput.trim().toLowerCase(Locale.ROOT);
        CompiledPattern best = null;
        int bestHits = 0;
        for (CompiledPattern candidate : patterns) {
            if (currentPhase != null && !candidate.pattern().phaseCompatibility().accepts(currentPhase)) {
                continue;
            }
            int hits = countMatches(candidate.keywords(), text) + countMatches(candidate.triggers(), text);
            if (hits > bestHits) {
                best = candidate;
                bestHits = hits;
            }
        }
        if (best == null) {
            return IntentResult.unknown(IntentSource.RULES);
        }
        int keywordCount = Math.max(1, best.pattern().keywords().size());
        double confidence = Math.min(1.0, (double) bestHits / keywordCount);
        return new IntentResult(best.pattern().name(), best.pattern().agents(), confidence, IntentSource.RULES);
    }

    private static int countMatches(List<Pattern> compiled, String text) {
        int hits = 0;
        for (Pattern pattern : compiled) {
            if (pattern.matcher(text).find()) {
                hits++;
            }
        }
        return hits;
    }

    private static List<Pattern> compile(List<String> phrases) {
        List<Pattern> compiled = new ArrayList<>();
        for (String phrase : phrases) {
            String normalized = phrase.trim().toLowerCase(Locale.ROOT);
            if (normalized.isEmpty()) {
                continue;
            }
            String body = Pattern.quote(normalized).replace(" ", "\\E\\s+\\Q");
            compiled.add(Pattern.compile("(?<![\\p{L}\\p{N}])" + body + "(?![\\p{L}\\p{N}])"));
        }
        return List.copyOf(compiled);
    }

    private record CompiledPattern(IntentPattern pattern, List<Pattern> keywords, List<Pattern> triggers) {}
}
