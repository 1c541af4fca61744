package io.docmirror.core.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed set of field types a schema may declare. Each constant pairs a validator (does the
 * dynamic value have the right kind?) with a converter (turn a valid value into its output
 * form).
 *
 * <p>
 * Converters are total over the values their validator accepts. Calling
 * {@link #convert} with a value that {@link #accepts} rejects is a programming error and fails
 * with {@link ClassCastException}.
 *
 * <p>
 * Thread-safe: constants are stateless.
 */
public enum FieldType {
    BOOLEAN("boolean") {
        @Override
        public boolean accepts(Object value) {
            return value instanceof Boolean;
        }

        @Override
        public JsonNode convert(Object value, FieldDescriptor descriptor, StructConverter structs) {
            return NODES.booleanNode((Boolean) value);
        }
    },

    NUMBER("number") {
        @Override
        public boolean accepts(Object value) {
            return value instanceof Number;
        }

        @Override
        public JsonNode convert(Object value, FieldDescriptor descriptor, StructConverter structs) {
            return numberNode((Number) value);
        }
    },

    STRING("string") {
        @Override
        public boolean accepts(Object value) {
            return value instanceof String;
        }

        @Override
        public JsonNode convert(Object value, FieldDescriptor descriptor, StructConverter structs) {
            return NODES.textNode((String) value);
        }
    },

    JSON("json") {
        @Override
        public boolean accepts(Object value) {
            ValueKind kind = ValueKind.of(value);
            return kind == ValueKind.OBJECT
                    || kind == ValueKind.ARRAY
                    || kind == ValueKind.BYTES
                    || kind == ValueKind.GEOPOINT
                    || kind == ValueKind.TIMESTAMP
                    || kind == ValueKind.REFERENCE;
        }

        @Override
        public JsonNode convert(Object value, FieldDescriptor descriptor, StructConverter structs) {
            try {
                return NODES.textNode(MAPPER.writeValueAsString(toTree(value)));
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("Failed to serialize json field '" + descriptor.name() + "'", e);
            }
        }
    },

    GEOPOINT("geopoint") {
        @Override
        public boolean accepts(Object value) {
            return value instanceof GeoPoint;
        }

        @Override
        public JsonNode convert(Object value, FieldDescriptor descriptor, StructConverter structs) {
            return geoPointNode((GeoPoint) value);
        }
    },

    TIMESTAMP("timestamp") {
        @Override
        public boolean accepts(Object value) {
            return value instanceof Timestamp;
        }

        @Override
        public JsonNode convert(Object value, FieldDescriptor descriptor, StructConverter structs) {
            return NODES.numberNode(((Timestamp) value).seconds());
        }
    },

    REFERENCE("reference") {
        @Override
        public boolean accepts(Object value) {
            return value instanceof DocumentReference;
        }

        @Override
        public JsonNode convert(Object value, FieldDescriptor descriptor, StructConverter structs) {
            return NODES.textNode(((DocumentReference) value).path());
        }
    },

    MAP("map") {
        @Override
        public boolean accepts(Object value) {
            return value instanceof Map<?, ?>;
        }

        @Override
        public JsonNode convert(Object value, FieldDescriptor descriptor, StructConverter structs) {
            return structs.convert((Map<?, ?>) value, descriptor.fields());
        }
    };

    /**
     * Callback used by {@link #MAP} to re-enter whole-record extraction for a nested value.
     */
    @FunctionalInterface
    public interface StructConverter {

        /**
         * Extracts the nested record described by {@code fields} from {@code value}.
         *
         * @param value  nested input object
         * @param fields child descriptors of the map field
         * @return the nested output record
         */
        ObjectNode convert(Map<?, ?> value, List<FieldDescriptor> fields);
    }

    private static final JsonNodeFactory NODES = JsonNodeFactory.withExactBigDecimals(true);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Map<String, FieldType> BY_NAME =
            Arrays.stream(values()).collect(Collectors.toUnmodifiableMap(FieldType::typeName, Function.identity()));

    private final String typeName;

    FieldType(String typeName) {
        this.typeName = typeName;
    }

    /** The name used for this type in schema definitions. */
    public String typeName() {
        return typeName;
    }

    /** Resolves a schema type name. Matching is exact and case-sensitive. */
    public static Optional<FieldType> fromName(String name) {
        return Optional.ofNullable(name == null ? null : BY_NAME.get(name));
    }

    /** Names of all recognized types, in declaration order. */
    public static List<String> typeNames() {
        return Arrays.stream(values()).map(FieldType::typeName).toList();
    }

    /** Whether {@code value} is a valid input for this type. */
    public abstract boolean accepts(Object value);

    /**
     * Converts a value accepted by {@link #accepts} into its output form.
     *
     * @param value      a value for which {@link #accepts} returned {@code true}
     * @param descriptor the field being converted
     * @param structs    nested-record callback, only used by {@link #MAP}
     * @return the converted value, never {@code null}
     */
    public abstract JsonNode convert(Object value, FieldDescriptor descriptor, StructConverter structs);

    // --- Output node helpers ---

    private static JsonNode numberNode(Number number) {
        if (number instanceof Integer i) {
            return NODES.numberNode(i);
        }
        if (number instanceof Long l) {
            return NODES.numberNode(l);
        }
        if (number instanceof Double d) {
            return NODES.numberNode(d);
        }
        if (number instanceof Float f) {
            return NODES.numberNode(f);
        }
        if (number instanceof Short s) {
            return NODES.numberNode(s);
        }
        if (number instanceof Byte b) {
            return NODES.numberNode(b.intValue());
        }
        if (number instanceof BigDecimal bd) {
            return NODES.numberNode(bd);
        }
        if (number instanceof BigInteger bi) {
            return NODES.numberNode(bi);
        }
        // AtomicInteger, AtomicLong, LongAdder and friends
        if (number.doubleValue() == number.longValue()) {
            return NODES.numberNode(number.longValue());
        }
        return NODES.numberNode(number.doubleValue());
    }

    private static ObjectNode geoPointNode(GeoPoint point) {
        ObjectNode node = NODES.objectNode();
        node.put("latitude", point.latitude());
        node.put("longitude", point.longitude());
        return node;
    }

    /**
     * Builds a JSON tree for any dynamic value, used by {@link #JSON}. Maps keep their
     * iteration order; store-native values use their component names.
     */
    static JsonNode toTree(Object value) {
        if (value == null) {
            return NODES.nullNode();
        }
        if (value instanceof Boolean b) {
            return NODES.booleanNode(b);
        }
        if (value instanceof Number n) {
            return numberNode(n);
        }
        if (value instanceof CharSequence s) {
            return NODES.textNode(s.toString());
        }
        if (value instanceof byte[] bytes) {
            return NODES.binaryNode(bytes);
        }
        if (value instanceof GeoPoint point) {
            return geoPointNode(point);
        }
        if (value instanceof Timestamp ts) {
            ObjectNode node = NODES.objectNode();
            node.put("seconds", ts.seconds());
            node.put("nanos", ts.nanos());
            return node;
        }
        if (value instanceof DocumentReference ref) {
            ObjectNode node = NODES.objectNode();
            node.put("path", ref.path());
            return node;
        }
        if (value instanceof Map<?, ?> map) {
            ObjectNode node = NODES.objectNode();
            map.forEach((k, v) -> node.set(String.valueOf(k), toTree(v)));
            return node;
        }
        if (value instanceof List<?> list) {
            var array = NODES.arrayNode();
            list.forEach(element -> array.add(toTree(element)));
            return array;
        }
        if (value instanceof Object[] objects) {
            var array = NODES.arrayNode();
            Arrays.stream(objects).forEach(element -> array.add(toTree(element)));
            return array;
        }
        return MAPPER.valueToTree(value);
    }
}
