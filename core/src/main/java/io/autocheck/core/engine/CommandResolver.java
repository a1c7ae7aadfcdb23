package io.autocheck.core.engine;

import io.autocheck.core.model.Command;
import io.autocheck.core.model.CompileError;
import io.autocheck.core.model.Node;
import io.autocheck.core.spi.Capability;
import io.autocheck.core.spi.ProviderResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves one call inside a step into a {@link Command}.
 *
 * <ol>
 * <li>Built-ins ({@code run}, {@code print}) resolve regardless of the declared environment.
 * <li>Without a declared environment any other name is an undefined function.
 * <li>Otherwise the call is looked up by name and arity in the environment's capability table.
 * </ol>
 *
 * <p>
 * Arguments are resolved through the {@link VariableTable} and rendered to text before a handler
 * sees them. Thread-safe.
 */
public final class CommandResolver {

    /** Functions available in every step. */
    public static final CapabilityTable BUILT_INS = CapabilityTable.of(List.of(
            new Capability("run", 1, args -> ProviderResult.ok(new Command("run", args))),
            new Capability("print", 1, args -> ProviderResult.ok(new Command("print", args)))));

    private final SuggestionEngine suggestions;

    public CommandResolver(SuggestionEngine suggestions) {
        this.suggestions = Objects.requireNonNull(suggestions, "suggestions must not be null");
    }

    /**
     * Outcome of resolving one call: exactly one of {@code command} and {@code error} is set.
     */
    public record Resolution(Command command, CompileError error) {

        static Resolution ok(Command command) {
            return new Resolution(command, null);
        }

        static Resolution failed(CompileError error) {
            return new Resolution(null, error);
        }

        public boolean isOk() {
            return error == null;
        }
    }

    /**
     * Resolves a call.
     *
     * @param call        the call to resolve
     * @param variables   bindings visible at the call
     * @param environment the declared environment, or {@code null} if none was declared yet
     */
    public Resolution resolve(Node.Call call, VariableTable variables, ProviderRegistry.Registration environment) {
        if (!BUILT_INS.named(call.name()).isEmpty()) {
            return invoke(BUILT_INS, call, variables);
        }
        if (environment == null) {
            return Resolution.failed(new CompileError(call.line(), "undefined function: ", call.name(), ""));
        }
        CapabilityTable capabilities = environment.capabilities();
        if (!capabilities.named(call.name()).isEmpty()) {
            return invoke(capabilities, call, variables);
        }
        List<String> candidates = new ArrayList<>(BUILT_INS.names());
        candidates.addAll(capabilities.names());
        return Resolution.failed(new CompileError(
                call.line(), "undefined function: ", call.name(), suggestions.suggest(call.name(), candidates)));
    }

    private Resolution invoke(CapabilityTable table, Node.Call call, VariableTable variables) {
        Optional<Capability> capability = table.find(call.name(), call.args().size());
        if (capability.isEmpty()) {
            int required = table.named(call.name()).get(0).arity();
            return Resolution.failed(new CompileError(
                    call.line(), "incorrect amount of parameters for function: ", call.name() + "/" + required, ""));
        }
        List<String> args = variables.resolveAll(call.args()).stream()
                .map(TokenRenderer::render)
                .toList();
        ProviderResult<Command> result = capability.get().invoke(args);
        if (result.isOk()) {
            return Resolution.ok(result.value());
        }
        return Resolution.failed(new CompileError(
                call.line(), result.description(), TokenRenderer.render(result.token()), ""));
    }
}
