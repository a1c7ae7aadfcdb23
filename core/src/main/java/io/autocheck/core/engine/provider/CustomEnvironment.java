package io.autocheck.core.engine.provider;

import io.autocheck.core.engine.TokenRenderer;
import io.autocheck.core.model.Node;
import io.autocheck.core.spi.EnvironmentProvider;
import io.autocheck.core.spi.ProviderResult;
import java.util.List;
import java.util.Optional;

/** Arbitrary image: {@code @env "custom", image: "haskell"} uses the image as given. */
public final class CustomEnvironment implements EnvironmentProvider {

    public static final String ID = "custom";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Optional<ProviderResult<String>> matchImage(List<Node> params) {
        if (params.size() != 1 || !(params.get(0) instanceof Node.Pair pair) || !"image".equals(pair.key())) {
            return Optional.empty();
        }
        if (pair.value() instanceof Node.Literal literal
                && (literal.value() instanceof String || literal.value() instanceof Number)) {
            return Optional.of(ProviderResult.ok(TokenRenderer.render(literal)));
        }
        return Optional.of(ProviderResult.failure("unsupported image: ", pair.value()));
    }
}
