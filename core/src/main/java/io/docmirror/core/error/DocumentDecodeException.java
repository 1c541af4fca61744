package io.docmirror.core.error;

/** Thrown when an input document cannot be decoded into an input record. */
public final class DocumentDecodeException extends MirrorLoadException {

    private static final long serialVersionUID = 1L;

    public DocumentDecodeException(String message, String source) {
        super(message, source);
    }

    public DocumentDecodeException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}
