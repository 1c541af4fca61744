package io.docmirror.core.error;

/**
 * Abstract parent for load-time errors: schema files and input documents that cannot be read
 * into the engine's model. Carries a {@code source} field identifying the file, resource or
 * input line that caused the error.
 */
public abstract class MirrorLoadException extends MirrorException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected MirrorLoadException(String message, String source) {
        super(message, Phase.LOAD);
        this.source = source;
    }

    protected MirrorLoadException(String message, Throwable cause, String source) {
        super(message, cause, Phase.LOAD);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error, or {@code null} if unknown. */
    public String source() {
        return source;
    }
}
