package io.autocheck.core.error;

import io.autocheck.core.model.CompileError;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown by {@code ConfigurationCompiler.compileOrFail} when the script has errors. The message
 * lists every error, one per line, in discovery order.
 */
public final class ConfigurationCompileException extends AutocheckException {

    private static final long serialVersionUID = 1L;

    private final transient List<CompileError> errors;

    public ConfigurationCompileException(List<CompileError> errors) {
        super(formatErrors(errors));
        this.errors = List.copyOf(errors);
    }

    /** The errors that caused the failure, in discovery order. */
    public List<CompileError> errors() {
        return errors;
    }

    private static String formatErrors(List<CompileError> errors) {
        return errors.stream().map(CompileError::format).collect(Collectors.joining("\n"));
    }
}
