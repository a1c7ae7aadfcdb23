package io.autocheck.core.error;

/**
 * Thrown when a node tree document cannot be read: invalid YAML/JSON or a document that does not
 * match the node tree schema.
 */
public final class NodeTreeException extends AutocheckException {

    private static final long serialVersionUID = 1L;

    private final String source;
    private final int line;

    public NodeTreeException(String message, String source) {
        this(message, null, source, 0);
    }

    public NodeTreeException(String message, Throwable cause, String source) {
        this(message, cause, source, 0);
    }

    /**
     * @param line document line the parser stopped at, {@code 0} when unknown
     */
    public NodeTreeException(String message, Throwable cause, String source, int line) {
        super(message, cause);
        this.source = source;
        this.line = Math.max(line, 0);
    }

    /** The file path or resource identifier of the document, or {@code null}. */
    public String source() {
        return source;
    }

    /** Document line the failure was detected at, {@code 0} when unknown. */
    public int line() {
        return line;
    }
}
