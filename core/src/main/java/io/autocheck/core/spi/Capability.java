package io.autocheck.core.spi;

import io.autocheck.core.model.Command;
import java.util.List;
import java.util.Objects;

/**
 * A named function an environment provider offers inside steps, with an exact arity.
 *
 * @param name    function name as written in scripts
 * @param arity   exact number of arguments
 * @param handler produces the command from already-resolved arguments
 */
public record Capability(String name, int arity, Handler handler) {

    public Capability {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(handler, "handler must not be null");
        if (arity < 0) {
            throw new IllegalArgumentException("arity must not be negative");
        }
    }

    /** Invokes the handler. */
    public ProviderResult<Command> invoke(List<String> args) {
        if (args.size() != arity) {
            throw new IllegalArgumentException(
                    "Capability " + name + "/" + arity + " invoked with " + args.size() + " arguments");
        }
        return handler.invoke(args);
    }

    /** Builds a command from resolved arguments. Must be pure. */
    @FunctionalInterface
    public interface Handler {
        ProviderResult<Command> invoke(List<String> args);
    }
}
