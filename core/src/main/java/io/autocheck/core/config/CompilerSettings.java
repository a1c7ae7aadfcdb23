package io.autocheck.core.config;

import java.util.List;

/**
 * Tunables of the configuration compiler.
 *
 * <p>
 * All fields have defaults. Use {@link #builder()} to construct instances, or
 * {@link SettingsLoader} to read them from YAML and environment variables.
 *
 * @param suggestionThreshold minimum similarity a name must exceed to be suggested in a
 *                            "did you mean" hint, within {@code [0, 1]}
 * @param enabledProviders    ids of the built-in environment providers to register
 */
public record CompilerSettings(double suggestionThreshold, List<String> enabledProviders) {

    /** Default minimum similarity for "did you mean" hints. */
    public static final double DEFAULT_SUGGESTION_THRESHOLD = 0.8;

    /** Ids of every built-in provider, the default provider set. */
    public static final List<String> ALL_PROVIDERS = List.of("custom", "elixir", "java");

    public CompilerSettings {
        if (Double.isNaN(suggestionThreshold) || suggestionThreshold < 0 || suggestionThreshold > 1) {
            throw new IllegalArgumentException(
                    "suggestionThreshold must be within [0, 1], got " + suggestionThreshold);
        }
        enabledProviders = enabledProviders == null ? ALL_PROVIDERS : List.copyOf(enabledProviders);
    }

    /** Settings with every field at its default. */
    public static CompilerSettings defaults() {
        return builder().build();
    }

    /** Creates a new builder with defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link CompilerSettings}. */
    public static final class Builder {
        private double suggestionThreshold = DEFAULT_SUGGESTION_THRESHOLD;
        private List<String> enabledProviders = ALL_PROVIDERS;

        Builder() {}

        public Builder suggestionThreshold(double suggestionThreshold) {
            this.suggestionThreshold = suggestionThreshold;
            return this;
        }

        public Builder enabledProviders(List<String> enabledProviders) {
            this.enabledProviders = enabledProviders;
            return this;
        }

        public CompilerSettings build() {
            return new CompilerSettings(suggestionThreshold, enabledProviders);
        }
    }
}
