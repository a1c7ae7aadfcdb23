package io.autocheck.core.spi;

import io.autocheck.core.model.Node;
import java.util.List;
import java.util.Optional;

/**
 * Pluggable execution environment SPI. A provider describes one environment (typically a
 * language runtime image) selected with {@code @env "<id>", ...}, and the functions it adds to
 * steps. Providers only describe commands; they never run anything.
 *
 * <p>
 * Implementations are registered with {@code ProviderRegistry} and MUST be stateless and
 * thread-safe.
 */
public interface EnvironmentProvider {

    /**
     * Returns the provider identifier used in {@code @env}, e.g. {@code "elixir"}.
     *
     * @return a non-null, non-empty identifier
     */
    String id();

    /** Number of keyword parameters {@code @env} must pass to {@link #image(List)}. */
    default int imageArity() {
        return 1;
    }

    /**
     * Matches the parameter shapes this provider recognizes.
     *
     * @param params resolved {@code @env} parameters, exactly {@link #imageArity()} of them
     * @return the result for a recognized shape, or empty to fall through to
     *     {@link #unmatchedImage(List)}
     */
    Optional<ProviderResult<String>> matchImage(List<Node> params);

    /**
     * Resolves the container image for the given {@code @env} parameters. Shapes not recognized by
     * {@link #matchImage(List)} fall through to {@link #unmatchedImage(List)}.
     */
    default ProviderResult<String> image(List<Node> params) {
        return matchImage(params).orElseGet(() -> unmatchedImage(params));
    }

    /**
     * Failure for parameter shapes the provider does not recognize: a keyword parameter with an
     * unknown key reports {@code "incorrect parameter: "} with the key; anything else is a syntax
     * error.
     */
    default ProviderResult<String> unmatchedImage(List<Node> params) {
        if (params.size() == 1 && params.get(0) instanceof Node.Pair pair) {
            return ProviderResult.failure("incorrect parameter: ", pair.key());
        }
        return ProviderResult.failure("syntax error", "");
    }

    /** Functions this provider adds to steps. Empty by default. */
    default List<Capability> capabilities() {
        return List.of();
    }
}
