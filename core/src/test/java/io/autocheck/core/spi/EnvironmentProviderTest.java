package io.autocheck.core.spi;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.autocheck.core.model.Command;
import io.autocheck.core.model.Node;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

/** Default methods of {@link EnvironmentProvider} and the {@link Capability} contract. */
class EnvironmentProviderTest {

    private final EnvironmentProvider matchesNothing = new EnvironmentProvider() {
        @Override
        public String id() {
            return "none";
        }

        @Override
        public Optional<ProviderResult<String>> matchImage(List<Node> params) {
            return Optional.empty();
        }
    };

    @Test
    void defaults() {
        assertThat(matchesNothing.imageArity()).isEqualTo(1);
        assertThat(matchesNothing.capabilities()).isEmpty();
    }

    @Test
    void unmatchedPairReportsItsKey() {
        ProviderResult<String> result =
                matchesNothing.image(List.of(new Node.Pair("tag", Node.Literal.of("x", 1), 1)));
        assertThat(result.isOk()).isFalse();
        assertThat(result.description()).isEqualTo("incorrect parameter: ");
        assertThat(result.token()).isEqualTo(Node.Literal.of("tag", 0));
    }

    @Test
    void unmatchedShapeIsSyntaxError() {
        ProviderResult<String> result = matchesNothing.image(List.of(Node.Literal.of("x", 1)));
        assertThat(result.description()).isEqualTo("syntax error");
    }

    @Test
    void capabilityEnforcesArity() {
        Capability capability = new Capability("run", 1, args -> ProviderResult.ok(new Command("run", args)));
        assertThat(capability.invoke(List.of("make")).value()).isEqualTo(Command.run("make"));
        assertThatThrownBy(() -> capability.invoke(List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("run/1");
    }

    @Test
    void capabilityRejectsNegativeArity() {
        assertThatThrownBy(() -> new Capability("x", -1, args -> ProviderResult.ok(Command.run("x"))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void resultRequiresValueOrToken() {
        assertThatThrownBy(() -> ProviderResult.ok(null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> ProviderResult.failure("bad", (Node) null))
                .isInstanceOf(NullPointerException.class);
    }
}
