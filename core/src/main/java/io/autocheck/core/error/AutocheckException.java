package io.autocheck.core.error;

/**
 * Abstract base for all autocheck exceptions. Never thrown directly; use the concrete
 * subclasses.
 *
 * <p>
 * Semantic errors in a script are not exceptions; they are collected as
 * {@link io.autocheck.core.model.CompileError} records. Exceptions are reserved for the strict
 * compile API and for failures to load the inputs of a compile.
 */
public abstract class AutocheckException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected AutocheckException(String message) {
        super(message);
    }

    protected AutocheckException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }
}
