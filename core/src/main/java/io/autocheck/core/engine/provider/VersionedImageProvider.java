package io.autocheck.core.engine.provider;

import io.autocheck.core.engine.TokenRenderer;
import io.autocheck.core.model.Node;
import io.autocheck.core.spi.EnvironmentProvider;
import io.autocheck.core.spi.ProviderResult;
import java.util.List;
import java.util.Optional;

/**
 * Base for language runtime providers selected with {@code version: <v>}. The version must be a
 * string or a number; any other value is reported as an unsupported image version.
 */
public abstract class VersionedImageProvider implements EnvironmentProvider {

    static final String VERSION = "version";

    /** Image reference for a version, e.g. {@code openjdk:17-slim}. */
    protected abstract String imageFor(String version);

    @Override
    public Optional<ProviderResult<String>> matchImage(List<Node> params) {
        if (params.size() != 1 || !(params.get(0) instanceof Node.Pair pair) || !VERSION.equals(pair.key())) {
            return Optional.empty();
        }
        if (pair.value() instanceof Node.Literal literal
                && (literal.value() instanceof String || literal.value() instanceof Number)) {
            return Optional.of(ProviderResult.ok(imageFor(TokenRenderer.render(literal))));
        }
        return Optional.of(ProviderResult.failure("unsupported image version: ", pair.value()));
    }
}
