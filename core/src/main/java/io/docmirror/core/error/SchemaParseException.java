package io.docmirror.core.error;

/** Thrown when a schema file is unreadable or does not have the expected structure. */
public final class SchemaParseException extends MirrorLoadException {

    private static final long serialVersionUID = 1L;

    public SchemaParseException(String message, String source) {
        super(message, source);
    }

    public SchemaParseException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}
