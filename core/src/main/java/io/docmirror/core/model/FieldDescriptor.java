package io.docmirror.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One schema entry: a named, typed field, optionally repeated, with child descriptors for
 * {@code map} fields.
 *
 * <p>
 * The declared {@code type} is kept verbatim so that a schema built from external data can
 * carry a type name the engine does not recognize; {@link #fieldType()} resolves it.
 *
 * @param name        field name, unique among siblings; input lookup key and output key
 * @param type        declared type name (see {@link FieldType})
 * @param repeated    whether the field holds an array of {@code type} values
 * @param fields      child descriptors for {@code map} fields; empty for other types
 * @param description optional free text, ignored by the engine
 */
public record FieldDescriptor(
        String name, String type, boolean repeated, List<FieldDescriptor> fields, String description) {

    public FieldDescriptor {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    public static FieldDescriptor of(String name, FieldType type) {
        return new FieldDescriptor(name, type.typeName(), false, List.of(), null);
    }

    public static FieldDescriptor repeated(String name, FieldType type) {
        return new FieldDescriptor(name, type.typeName(), true, List.of(), null);
    }

    public static FieldDescriptor map(String name, List<FieldDescriptor> fields) {
        return new FieldDescriptor(name, FieldType.MAP.typeName(), false, fields, null);
    }

    public static FieldDescriptor repeatedMap(String name, List<FieldDescriptor> fields) {
        return new FieldDescriptor(name, FieldType.MAP.typeName(), true, fields, null);
    }

    /** The recognized field type, or empty if {@link #type()} is not a known type name. */
    public Optional<FieldType> fieldType() {
        return FieldType.fromName(type);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{name=").append(name).append(", type=").append(type);
        if (repeated) {
            sb.append(", repeated=true");
        }
        if (!fields.isEmpty()) {
            sb.append(", fields=").append(fields);
        }
        return sb.append('}').toString();
    }
}
