package io.docmirror.core.error;

/**
 * Abstract base for all doc-mirror exceptions. Never thrown directly; use the concrete
 * subclasses under {@link MirrorLoadException} or {@link SchemaDefinitionException}.
 */
public abstract class MirrorException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        LOAD,
        EXTRACTION
    }

    private final Phase phase;

    protected MirrorException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    protected MirrorException(String message, Throwable cause, Phase phase) {
        super(message, cause);
        this.phase = phase;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
