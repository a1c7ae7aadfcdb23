package io.autocheck.core.model;

import java.util.Objects;

/**
 * One semantic (or tree production) error found while compiling a configuration script.
 *
 * <p>
 * The description carries its own separator when a token follows it, e.g.
 * {@code "incorrect field: "} + {@code "gradee"}, so that {@link #format()} can simply concatenate
 * the parts.
 *
 * @param line        source line, {@code 0} when unknown
 * @param description human-readable description
 * @param token       rendered offending token, possibly empty
 * @param suggestion  "did you mean" hint or fixed advice, possibly empty
 */
public record CompileError(int line, String description, String token, String suggestion) {

    public CompileError {
        Objects.requireNonNull(description, "description must not be null");
        token = token == null ? "" : token;
        suggestion = suggestion == null ? "" : suggestion;
    }

    /** Creates an error without token or suggestion. */
    public static CompileError of(int line, String description) {
        return new CompileError(line, description, "", "");
    }

    /** Renders this error as {@code "Line {line}: {description}{token}. {suggestion}"}. */
    public String format() {
        return "Line " + line + ": " + description + token + ". " + suggestion;
    }
}
