package io.autocheck.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.autocheck.core.error.SettingsLoadException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

/**
 * Loads {@link CompilerSettings} from a YAML file with an environment variable overlay.
 *
 * <pre>
 * suggestions:
 *   threshold: 0.85
 * providers:
 *   enabled: [custom, elixir, java]
 * </pre>
 *
 * <p>
 * Environment variables take precedence over YAML values:
 * {@value #ENV_SUGGESTION_THRESHOLD} and {@value #ENV_PROVIDERS} (comma-separated ids). An env var
 * is considered "set" if and only if it is defined AND its trimmed value is non-empty; otherwise
 * the YAML value (or default) is used.
 */
public final class SettingsLoader {

    public static final String ENV_SUGGESTION_THRESHOLD = "AUTOCHECK_SUGGESTION_THRESHOLD";
    public static final String ENV_PROVIDERS = "AUTOCHECK_PROVIDERS";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private SettingsLoader() {
        // utility class
    }

    /**
     * Loads settings from the given YAML file, applying overrides from {@link System#getenv}.
     *
     * @throws SettingsLoadException if the file is missing, is not valid YAML or holds an invalid
     *     value
     */
    public static CompilerSettings load(Path settingsPath) {
        return load(settingsPath, System::getenv);
    }

    /**
     * Loads settings from the given YAML file, applying overrides from the supplied lookup
     * function. Returning {@code null} from {@code envLookup} means the variable is not defined.
     */
    public static CompilerSettings load(Path settingsPath, Function<String, String> envLookup) {
        if (!Files.exists(settingsPath)) {
            throw new SettingsLoadException("Settings file not found: " + settingsPath);
        }
        try (InputStream in = Files.newInputStream(settingsPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return mapToSettings(root == null ? YAML_MAPPER.createObjectNode() : root, envLookup);
        } catch (IOException e) {
            throw new SettingsLoadException("Failed to parse YAML settings: " + settingsPath, e);
        }
    }

    /** Builds settings from defaults and environment variables only. */
    public static CompilerSettings fromEnvironment(Function<String, String> envLookup) {
        return mapToSettings(YAML_MAPPER.createObjectNode(), envLookup);
    }

    private static CompilerSettings mapToSettings(JsonNode root, Function<String, String> envLookup) {
        CompilerSettings.Builder builder = CompilerSettings.builder();

        JsonNode suggestions = root.path("suggestions");
        if (suggestions.has("threshold")) {
            JsonNode threshold = suggestions.get("threshold");
            if (!threshold.isNumber()) {
                throw new SettingsLoadException("suggestions.threshold must be a number, got: " + threshold);
            }
            builder.suggestionThreshold(threshold.asDouble());
        }

        JsonNode providers = root.path("providers");
        if (providers.has("enabled")) {
            JsonNode enabled = providers.get("enabled");
            if (!enabled.isArray()) {
                throw new SettingsLoadException("providers.enabled must be a list of provider ids");
            }
            List<String> ids = new ArrayList<>();
            enabled.forEach(id -> ids.add(id.asText()));
            builder.enabledProviders(ids);
        }

        if (isSet(envLookup, ENV_SUGGESTION_THRESHOLD)) {
            String value = envLookup.apply(ENV_SUGGESTION_THRESHOLD).trim();
            try {
                builder.suggestionThreshold(Double.parseDouble(value));
            } catch (NumberFormatException e) {
                throw new SettingsLoadException(ENV_SUGGESTION_THRESHOLD + " must be a number, got: " + value, e);
            }
        }
        if (isSet(envLookup, ENV_PROVIDERS)) {
            builder.enabledProviders(Arrays.stream(
                            envLookup.apply(ENV_PROVIDERS).split(","))
                    .map(String::trim)
                    .filter(id -> !id.isEmpty())
                    .toList());
        }

        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new SettingsLoadException("Invalid settings: " + e.getMessage(), e);
        }
    }

    /**
     * Returns {@code true} if the env var is "set": defined AND non-blank after trimming.
     */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }
}
