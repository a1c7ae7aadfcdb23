package io.autocheck.core.model;

import java.util.List;

/**
 * Compiled configuration handed to the external executor. Immutable once returned by
 * {@code ConfigurationCompiler}.
 *
 * <p>
 * {@code image}, {@code environmentId} and {@code grade} are {@code null} when the script does
 * not declare them.
 *
 * @param image                 container image resolved by the environment provider
 * @param environmentId         id of the declared environment provider
 * @param requiredFiles         files a submission must contain, in declaration order
 * @param allowedFileExtensions extensions a submission may use, in declaration order
 * @param grade                 grade weight within {@code [0, 1]}
 * @param networkAccess         whether steps may access the network
 * @param steps                 steps in declaration order
 */
public record Configuration(
        String image,
        String environmentId,
        List<String> requiredFiles,
        List<String> allowedFileExtensions,
        Double grade,
        boolean networkAccess,
        List<Step> steps) {

    public Configuration {
        requiredFiles = requiredFiles == null ? List.of() : List.copyOf(requiredFiles);
        allowedFileExtensions = allowedFileExtensions == null ? List.of() : List.copyOf(allowedFileExtensions);
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    /** Configuration with every field at its default. */
    public static Configuration empty() {
        return new Configuration(null, null, List.of(), List.of(), null, false, List.of());
    }

    /** Returns the step with the given name, or {@code null}. */
    public Step step(String name) {
        for (Step step : steps) {
            if (step.name().equals(name)) {
                return step;
            }
        }
        return null;
    }
}
