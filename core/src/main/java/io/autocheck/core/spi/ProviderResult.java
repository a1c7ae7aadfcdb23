package io.autocheck.core.spi;

import io.autocheck.core.model.Node;
import java.util.Objects;

/**
 * Outcome of a provider operation: either a value or a failure made of a description and the
 * offending token. The caller attaches the source line and renders the token.
 *
 * @param <T> the value type
 */
public final class ProviderResult<T> {

    private final T value;
    private final String description;
    private final Node token;

    private ProviderResult(T value, String description, Node token) {
        this.value = value;
        this.description = description;
        this.token = token;
    }

    /** Creates a successful result. */
    public static <T> ProviderResult<T> ok(T value) {
        Objects.requireNonNull(value, "value must not be null");
        return new ProviderResult<>(value, null, null);
    }

    /**
     * Creates a failed result.
     *
     * @param description error description, ending with its separator when a token follows
     * @param token       offending token
     */
    public static <T> ProviderResult<T> failure(String description, Node token) {
        Objects.requireNonNull(description, "description must not be null");
        Objects.requireNonNull(token, "token must not be null");
        return new ProviderResult<>(null, description, token);
    }

    /** Creates a failed result whose token is plain text. */
    public static <T> ProviderResult<T> failure(String description, String token) {
        return failure(description, Node.Literal.of(token, 0));
    }

    public boolean isOk() {
        return description == null;
    }

    /** Returns the value. Only valid when {@link #isOk()}. */
    public T value() {
        return value;
    }

    /** Returns the failure description. Only valid when not {@link #isOk()}. */
    public String description() {
        return description;
    }

    /** Returns the offending token. Only valid when not {@link #isOk()}. */
    public Node token() {
        return token;
    }

    @Override
    public String toString() {
        return isOk() ? "ProviderResult[ok=" + value + "]" : "ProviderResult[failure=" + description + "]";
    }
}
