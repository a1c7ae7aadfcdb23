package io.autocheck.core.error;

/**
 * Thrown when compiler settings cannot be read or hold an invalid value.
 */
public final class SettingsLoadException extends AutocheckException {

    private static final long serialVersionUID = 1L;

    public SettingsLoadException(String message) {
        super(message);
    }

    public SettingsLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
