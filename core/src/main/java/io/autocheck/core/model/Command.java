package io.autocheck.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One resolved action inside a step. {@code kind} is either a built-in ({@code run},
 * {@code print}) or the kind a provider capability expands to.
 *
 * @param kind command kind
 * @param args resolved textual arguments
 */
public record Command(String kind, List<String> args) {

    public Command {
        Objects.requireNonNull(kind, "kind must not be null");
        args = args == null ? List.of() : List.copyOf(args);
    }

    /** Creates a {@code run} command wrapping a single shell script. */
    public static Command run(String script) {
        return new Command("run", List.of(script));
    }
}
