package io.autocheck.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of compiling a configuration script. Exactly one of two states:
 *
 * <ul>
 * <li>{@link Type#SUCCESS}: no errors were found; {@code configuration} holds the result.
 * <li>{@link Type#ERROR}: at least one error was found; {@code errors} holds all of them in
 * discovery order.
 * </ul>
 */
public final class CompileResult {

    /** The type of compile outcome. */
    public enum Type {
        SUCCESS,
        ERROR
    }

    private final Type type;
    private final Configuration configuration;
    private final List<CompileError> errors;

    private CompileResult(Type type, Configuration configuration, List<CompileError> errors) {
        this.type = type;
        this.configuration = configuration;
        this.errors = errors;
    }

    /** Creates a SUCCESS result. */
    public static CompileResult success(Configuration configuration) {
        Objects.requireNonNull(configuration, "configuration must not be null for SUCCESS");
        return new CompileResult(Type.SUCCESS, configuration, List.of());
    }

    /**
     * Creates an ERROR result.
     *
     * @throws IllegalArgumentException if {@code errors} is empty
     */
    public static CompileResult error(List<CompileError> errors) {
        Objects.requireNonNull(errors, "errors must not be null for ERROR");
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("ERROR result requires at least one error");
        }
        return new CompileResult(Type.ERROR, null, List.copyOf(errors));
    }

    public Type type() {
        return type;
    }

    /** Returns the compiled configuration. Only valid when {@code type() == SUCCESS}. */
    public Configuration configuration() {
        return configuration;
    }

    /** Returns the errors; empty on SUCCESS. */
    public List<CompileError> errors() {
        return errors;
    }

    public boolean isSuccess() {
        return type == Type.SUCCESS;
    }

    public boolean isError() {
        return type == Type.ERROR;
    }

    @Override
    public String toString() {
        return switch (type) {
            case SUCCESS -> "CompileResult[SUCCESS, steps=" + configuration.steps().size() + "]";
            case ERROR -> "CompileResult[ERROR, errors=" + errors.size() + "]";
        };
    }
}
