package io.autocheck.core.engine;

import static io.autocheck.core.support.Nodes.call;
import static io.autocheck.core.support.Nodes.ident;
import static io.autocheck.core.support.Nodes.lit;
import static org.assertj.core.api.Assertions.assertThat;

import io.autocheck.core.model.Command;
import io.autocheck.core.model.CompileError;
import io.autocheck.core.model.Node;
import io.autocheck.core.spi.Capability;
import io.autocheck.core.spi.EnvironmentProvider;
import io.autocheck.core.spi.ProviderResult;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class CommandResolverTest {

    private final CommandResolver resolver = new CommandResolver(new SuggestionEngine());
    private final ProviderRegistry registry = ProviderRegistry.withBuiltIns();
    private final ProviderRegistry.Registration elixir = registry.getRegistration("elixir").orElseThrow();

    @Test
    void builtInResolvesWithoutEnvironment() {
        CommandResolver.Resolution resolution =
                resolver.resolve(call("print", 1, lit("hi")), VariableTable.empty(), null);
        assertThat(resolution.isOk()).isTrue();
        assertThat(resolution.command()).isEqualTo(new Command("print", List.of("hi")));
    }

    @Test
    void argumentsAreResolvedBeforeInvocation() {
        VariableTable variables = VariableTable.empty().bind("f", lit("lib/a.ex"));
        CommandResolver.Resolution resolution = resolver.resolve(call("format", 2, ident("f")), variables, elixir);
        assertThat(resolution.command()).isEqualTo(Command.run("mix format lib/a.ex"));
    }

    @Test
    void unknownFunctionSuggestsBuiltInsToo() {
        CommandResolver.Resolution resolution =
                resolver.resolve(call("prnt", 4, lit("x")), VariableTable.empty(), elixir);
        assertThat(resolution.isOk()).isFalse();
        assertThat(resolution.error())
                .isEqualTo(new CompileError(4, "undefined function: ", "prnt", "Did you mean print?"));
    }

    @Test
    void providerFailureBecomesError() {
        EnvironmentProvider strict = new EnvironmentProvider() {
            @Override
            public String id() {
                return "strict";
            }

            @Override
            public Optional<ProviderResult<String>> matchImage(List<Node> params) {
                return Optional.empty();
            }

            @Override
            public List<Capability> capabilities() {
                return List.of(new Capability(
                        "compile", 1, args -> ProviderResult.failure("unknown target: ", args.get(0))));
            }
        };
        registry.register(strict);

        CommandResolver.Resolution resolution = resolver.resolve(
                call("compile", 7, lit("arm")),
                VariableTable.empty(),
                registry.getRegistration("strict").orElseThrow());

        assertThat(resolution.error()).isEqualTo(new CompileError(7, "unknown target: ", "arm", ""));
    }
}
