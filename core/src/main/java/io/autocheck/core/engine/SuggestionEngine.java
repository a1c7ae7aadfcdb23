package io.autocheck.core.engine;

import io.autocheck.core.config.CompilerSettings;
import java.util.Objects;
import org.apache.commons.text.similarity.JaroWinklerSimilarity;

/**
 * "Did you mean" lookup for unknown names. Scores each candidate with Jaro-Winkler similarity and
 * suggests the best one scoring above the threshold; ties go to the candidate met first.
 *
 * <p>
 * Thread-safe.
 */
public final class SuggestionEngine {

    /** Default minimum similarity a candidate must exceed. */
    public static final double DEFAULT_THRESHOLD = CompilerSettings.DEFAULT_SUGGESTION_THRESHOLD;

    private static final JaroWinklerSimilarity SIMILARITY = new JaroWinklerSimilarity();

    private final double threshold;

    public SuggestionEngine() {
        this(DEFAULT_THRESHOLD);
    }

    public SuggestionEngine(double threshold) {
        if (threshold < 0 || threshold > 1) {
            throw new IllegalArgumentException("threshold must be within [0, 1], got " + threshold);
        }
        this.threshold = threshold;
    }

    /** Similarity of two strings in {@code [0, 1]}; identical strings score {@code 1}. */
    public double similarity(String left, String right) {
        return SIMILARITY.apply(left, right);
    }

    /**
     * Returns {@code "Did you mean {best}?"} for the most similar candidate scoring above the
     * threshold, or an empty string if there is none.
     *
     * @param token      the unknown name
     * @param candidates known names, in the order used to break ties
     */
    public String suggest(String token, Iterable<String> candidates) {
        Objects.requireNonNull(candidates, "candidates must not be null");
        if (token == null) {
            return "";
        }
        String best = null;
        double bestScore = threshold;
        for (String candidate : candidates) {
            double score = similarity(token, candidate);
            if (score > bestScore) {
                best = candidate;
                bestScore = score;
            }
        }
        return best == null ? "" : "Did you mean " + best + "?";
    }
}
