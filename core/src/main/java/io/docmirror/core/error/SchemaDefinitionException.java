package io.docmirror.core.error;

import io.docmirror.core.model.FieldDescriptor;

/**
 * Thrown when a field definition is malformed: an unrecognized {@code type}, {@code fields} on a
 * non-map type, a map without {@code fields}, or duplicate sibling names.
 *
 * <p>
 * Unlike invalid field values, which only produce warnings, this indicates a misconfigured schema
 * and aborts the whole extraction call. When raised by the engine it carries the offending
 * {@link FieldDescriptor}; when raised while parsing a schema file the descriptor may be
 * {@code null} and {@link #definition()} holds the raw definition text instead.
 */
public final class SchemaDefinitionException extends MirrorException {

    private static final long serialVersionUID = 1L;

    private final transient FieldDescriptor descriptor;
    private final String definition;

    /** Engine-side error for a descriptor that reached extraction. */
    public SchemaDefinitionException(String message, FieldDescriptor descriptor) {
        super(message, Phase.EXTRACTION);
        this.descriptor = descriptor;
        this.definition = descriptor != null ? descriptor.toString() : null;
    }

    /** Load-side error for a raw definition found in a schema file. */
    public SchemaDefinitionException(String message, String definition) {
        super(message, Phase.LOAD);
        this.descriptor = null;
        this.definition = definition;
    }

    /** The offending descriptor, or {@code null} when raised from a schema file. */
    public FieldDescriptor descriptor() {
        return descriptor;
    }

    /** Text of the offending definition. */
    public String definition() {
        return definition;
    }
}
