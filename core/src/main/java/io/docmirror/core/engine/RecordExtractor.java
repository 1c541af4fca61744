package io.docmirror.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.docmirror.core.error.SchemaDefinitionException;
import io.docmirror.core.model.FieldDescriptor;
import io.docmirror.core.model.FieldType;
import io.docmirror.core.model.StoreDocument;
import io.docmirror.core.model.ValueKind;
import io.docmirror.core.spi.ExtractionListener;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies a field schema to a dynamic input record and produces a sanitized, strictly typed
 * output record.
 *
 * <p>
 * Per-field failures never abort the record:
 * <ul>
 * <li>missing or {@code null} values are omitted silently</li>
 * <li>a repeated field without an array value is omitted with a warning</li>
 * <li>an invalid scalar value is omitted with a warning</li>
 * <li>an invalid array element is replaced by {@link #HOLE} with a warning, so the output
 * array keeps the input's length and order</li>
 * </ul>
 * Only an unrecognized declared type is fatal: it raises {@link SchemaDefinitionException} and
 * no partial output is returned. The whole descriptor tree is checked before any value is read,
 * so nested definitions fail even when the record has no value for their parent.
 *
 * <p>
 * {@code map} fields recurse into {@link #extractRecord} with the child schema, so the
 * traversal depth equals the schema's nesting depth.
 *
 * <p>
 * Thread-safe: holds no mutable state; every call builds its own output.
 */
public final class RecordExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(RecordExtractor.class);
    private static final JsonNodeFactory NODES = JsonNodeFactory.withExactBigDecimals(true);

    /**
     * Placeholder occupying the position of an array element that failed validation. No
     * converter produces JSON {@code null}, so a hole is always distinguishable from a value.
     */
    public static final JsonNode HOLE = NullNode.getInstance();

    private final ExtractionListener listener;

    /** Creates an extractor that only logs warnings. */
    public RecordExtractor() {
        this(ExtractionListener.NONE);
    }

    /**
     * Creates an extractor that logs warnings and forwards them to {@code listener}.
     *
     * @param listener warning listener, must be thread-safe if this extractor is shared
     */
    public RecordExtractor(ExtractionListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
    }

    /**
     * Extracts the fields named by {@code schema} from {@code input}.
     *
     * @param input  the input record; {@code null} is treated as an empty record
     * @param schema ordered field descriptors
     * @return a new output record holding only the successfully extracted fields
     * @throws SchemaDefinitionException if a descriptor declares an unrecognized type
     */
    public ObjectNode extractRecord(Map<String, ?> input, List<FieldDescriptor> schema) {
        Objects.requireNonNull(schema, "schema must not be null");
        validateSchema(schema, null);
        return extractRecord(input, schema, null);
    }

    /**
     * Extracts the fields named by {@code schema} from a decoded document's data.
     *
     * @see #extractRecord(Map, List)
     */
    public ObjectNode extractDocument(StoreDocument document, List<FieldDescriptor> schema) {
        Objects.requireNonNull(document, "document must not be null");
        return extractRecord(document.data(), schema);
    }

    /**
     * Validates and converts a single present value against {@code descriptor}.
     *
     * @param descriptor the field descriptor
     * @param value      the field's input value
     * @return the converted value, or empty if the field must be omitted (null value, invalid
     *         scalar, or repeated field without an array)
     * @throws SchemaDefinitionException if the descriptor declares an unrecognized type
     */
    public Optional<JsonNode> extractField(FieldDescriptor descriptor, Object value) {
        Objects.requireNonNull(descriptor, "descriptor must not be null");
        FieldType type = resolveType(descriptor, descriptor.name());
        validateSchema(descriptor.fields(), descriptor.name());
        if (value == null) {
            return Optional.empty();
        }
        if (descriptor.repeated() && !isArray(value)) {
            warnNotArray(descriptor, descriptor.name(), value);
            return Optional.empty();
        }
        return extractField(descriptor, type, value, descriptor.name());
    }

    // --- Whole-record traversal ---

    private ObjectNode extractRecord(Map<?, ?> input, List<FieldDescriptor> schema, String parentPath) {
        ObjectNode output = NODES.objectNode();
        for (FieldDescriptor descriptor : schema) {
            String path = parentPath == null ? descriptor.name() : parentPath + "." + descriptor.name();
            FieldType type = resolveType(descriptor, path);

            Object value = input == null ? null : input.get(descriptor.name());
            if (value == null) {
                continue;
            }
            if (descriptor.repeated() && !isArray(value)) {
                warnNotArray(descriptor, path, value);
                continue;
            }
            extractField(descriptor, type, value, path).ifPresent(node -> output.set(descriptor.name(), node));
        }
        return output;
    }

    // --- Single-field processing ---

    private Optional<JsonNode> extractField(FieldDescriptor descriptor, FieldType type, Object value, String path) {
        FieldType.StructConverter structs = (nested, fields) -> extractRecord(nested, fields, path);

        if (descriptor.repeated()) {
            List<?> elements = asList(value);
            ArrayNode array = NODES.arrayNode(elements.size());
            for (int i = 0; i < elements.size(); i++) {
                Object element = elements.get(i);
                if (type.accepts(element)) {
                    array.add(type.convert(element, descriptor, structs));
                } else {
                    warnInvalid(descriptor, path, element, i);
                    array.add(HOLE);
                }
            }
            return Optional.of(array);
        }

        if (!type.accepts(value)) {
            warnInvalid(descriptor, path, value, null);
            return Optional.empty();
        }
        return Optional.of(type.convert(value, descriptor, structs));
    }

    /** Resolves every descriptor in the tree, whether or not the record reaches it. */
    private static void validateSchema(List<FieldDescriptor> schema, String parentPath) {
        for (FieldDescriptor descriptor : schema) {
            String path = parentPath == null ? descriptor.name() : parentPath + "." + descriptor.name();
            resolveType(descriptor, path);
            validateSchema(descriptor.fields(), path);
        }
    }

    private static FieldType resolveType(FieldDescriptor descriptor, String path) {
        return descriptor.fieldType().orElseThrow(() -> {
            LOG.error("schema.invalid_type field={} type={}: invalid field definition {}", path, descriptor.type(),
                    descriptor);
            return new SchemaDefinitionException(
                    "Invalid field definition at '" + path + "': unknown type '" + descriptor.type()
                            + "', expected one of " + FieldType.typeNames(),
                    descriptor);
        });
    }

    private static boolean isArray(Object value) {
        return value instanceof List<?> || value instanceof Object[];
    }

    private static List<?> asList(Object value) {
        return value instanceof Object[] objects ? Arrays.asList(objects) : (List<?>) value;
    }

    // --- Warnings ---

    private void warnNotArray(FieldDescriptor descriptor, String path, Object value) {
        ValueKind observed = ValueKind.of(value);
        LOG.warn(
                "field.not_array field={} type={} observed={}: array field does not contain an array, skipping",
                path,
                descriptor.type(),
                observed.label());
        try {
            listener.onArrayShapeMismatch(
                    new ExtractionListener.ArrayShapeMismatchEvent(path, descriptor.type(), observed));
        } catch (Exception e) {
            LOG.warn("ExtractionListener.onArrayShapeMismatch failed", e);
        }
    }

    private void warnInvalid(FieldDescriptor descriptor, String path, Object value, Integer index) {
        ValueKind observed = ValueKind.of(value);
        if (index != null) {
            LOG.warn(
                    "field.invalid field={} type={} index={} observed={}: invalid array element, inserting hole",
                    path,
                    descriptor.type(),
                    index,
                    observed.label());
        } else {
            LOG.warn(
                    "field.invalid field={} type={} observed={}: invalid data type, dropping field",
                    path,
                    descriptor.type(),
                    observed.label());
        }
        try {
            listener.onInvalidValue(
                    new ExtractionListener.InvalidValueEvent(path, descriptor.type(), observed, index));
        } catch (Exception e) {
            LOG.warn("ExtractionListener.onInvalidValue failed", e);
        }
    }
}
