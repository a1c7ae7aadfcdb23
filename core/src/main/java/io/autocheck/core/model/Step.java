package io.autocheck.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Named, ordered group of commands. Step names are unique within a {@link Configuration}.
 */
public record Step(String name, List<Command> commands) {

    public Step {
        Objects.requireNonNull(name, "name must not be null");
        commands = commands == null ? List.of() : List.copyOf(commands);
    }
}
