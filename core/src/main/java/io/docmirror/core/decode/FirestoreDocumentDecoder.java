package io.docmirror.core.decode;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.docmirror.core.error.DocumentDecodeException;
import io.docmirror.core.model.DocumentReference;
import io.docmirror.core.model.GeoPoint;
import io.docmirror.core.model.StoreDocument;
import io.docmirror.core.model.Timestamp;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Decodes documents in the Firestore REST encoding into {@link StoreDocument}s.
 *
 * <p>
 * A document looks like:
 *
 * <pre>
 * {
 *   "name": "projects/p/databases/(default)/documents/users/alice",
 *   "fields": {
 *     "active": {"booleanValue": true},
 *     "loc": {"geoPointValue": {"latitude": 1, "longitude": 2}},
 *     "tags": {"arrayValue": {"values": [{"stringValue": "x"}, {"integerValue": "5"}]}}
 *   },
 *   "createTime": "2019-08-21T10:15:30.123456Z",
 *   "updateTime": "2019-08-21T10:15:30.123456Z"
 * }
 * </pre>
 *
 * <p>
 * Each typed value object must carry exactly one of the recognized value keys. Integers
 * (encoded as decimal strings) decode to {@link Long}, doubles to {@link Double}, timestamps to
 * {@link Timestamp}, references to {@link DocumentReference} with the database prefix removed,
 * bytes to {@code byte[]}, arrays to {@link List}, maps to insertion-ordered {@link Map}.
 *
 * <p>
 * Thread-safe: stateless apart from an immutable {@link ObjectMapper}.
 */
public final class FirestoreDocumentDecoder implements DocumentDecoder {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String DOCUMENTS_SEGMENT = "/documents/";
    private static final Set<String> KNOWN_DOCUMENT_KEYS = Set.of("name", "fields", "createTime", "updateTime");

    @Override
    public StoreDocument decode(String json, String source) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new DocumentDecodeException("Document is not valid JSON: " + e.getOriginalMessage(), e, source);
        }
        return decode(root, source);
    }

    /**
     * Decodes an already-parsed document tree.
     *
     * @param root   the document object
     * @param source identifier used in error messages
     */
    public StoreDocument decode(JsonNode root, String source) {
        if (root == null || !root.isObject()) {
            throw new DocumentDecodeException("Document must be a JSON object", source);
        }
        List<String> unknown = new ArrayList<>();
        root.fieldNames().forEachRemaining(key -> {
            if (!KNOWN_DOCUMENT_KEYS.contains(key)) {
                unknown.add(key);
            }
        });
        if (!unknown.isEmpty()) {
            throw new DocumentDecodeException(
                    "Unknown document key" + (unknown.size() > 1 ? "s" : "") + ": " + unknown, source);
        }

        DocumentReference reference = null;
        if (root.hasNonNull("name")) {
            reference = decodeReference(root.get("name").asText(), "name", source);
        }

        Map<String, Object> data = new LinkedHashMap<>();
        JsonNode fields = root.get("fields");
        if (fields != null && !fields.isNull()) {
            data = decodeFields(fields, null, source);
        }

        return new StoreDocument(
                reference,
                data,
                decodeOptionalTimestamp(root, "createTime", source),
                decodeOptionalTimestamp(root, "updateTime", source));
    }

    private Map<String, Object> decodeFields(JsonNode fields, String parentPath, String source) {
        if (!fields.isObject()) {
            throw new DocumentDecodeException(
                    "'fields' of " + (parentPath == null ? "document" : "'" + parentPath + "'") + " must be an object",
                    source);
        }
        Map<String, Object> data = new LinkedHashMap<>();
        for (Map.Entry<String, JsonNode> entry : fields.properties()) {
            String path = parentPath == null ? entry.getKey() : parentPath + "." + entry.getKey();
            data.put(entry.getKey(), decodeValue(entry.getValue(), path, source));
        }
        return data;
    }

    private Object decodeValue(JsonNode value, String path, String source) {
        if (value == null || !value.isObject() || value.size() != 1) {
            throw new DocumentDecodeException(
                    "Value at '" + path + "' must be an object with exactly one typed value key", source);
        }
        Map.Entry<String, JsonNode> typed = value.fields().next();
        JsonNode content = typed.getValue();
        try {
            return switch (typed.getKey()) {
                case "nullValue" -> null;
                case "booleanValue" -> requireBoolean(content, path, source);
                case "integerValue" -> decodeInteger(content, path, source);
                case "doubleValue" -> decodeDouble(content, path, source);
                case "timestampValue" -> Timestamp.parse(requireText(content, path, source));
                case "stringValue" -> requireText(content, path, source);
                case "bytesValue" -> Base64.getDecoder().decode(requireText(content, path, source));
                case "referenceValue" -> decodeReference(requireText(content, path, source), path, source);
                case "geoPointValue" -> decodeGeoPoint(content, path, source);
                case "arrayValue" -> decodeArray(content, path, source);
                case "mapValue" -> decodeMap(content, path, source);
                default -> throw new DocumentDecodeException(
                        "Unknown value type '" + typed.getKey() + "' at '" + path + "'", source);
            };
        } catch (IllegalArgumentException e) {
            throw new DocumentDecodeException(
                    "Invalid " + typed.getKey() + " at '" + path + "': " + e.getMessage(), e, source);
        }
    }

    private List<Object> decodeArray(JsonNode content, String path, String source) {
        List<Object> values = new ArrayList<>();
        JsonNode items = content.get("values");
        if (items == null || items.isNull()) {
            return values;
        }
        if (!items.isArray()) {
            throw new DocumentDecodeException("arrayValue.values at '" + path + "' must be an array", source);
        }
        int index = 0;
        for (JsonNode item : items) {
            values.add(decodeValue(item, path + "[" + index++ + "]", source));
        }
        return values;
    }

    private Map<String, Object> decodeMap(JsonNode content, String path, String source) {
        JsonNode fields = content.get("fields");
        if (fields == null || fields.isNull()) {
            return new LinkedHashMap<>();
        }
        return decodeFields(fields, path, source);
    }

    private static Long decodeInteger(JsonNode content, String path, String source) {
        if (content.isIntegralNumber() && content.canConvertToLong()) {
            return content.longValue();
        }
        if (content.isTextual()) {
            try {
                return Long.parseLong(content.asText());
            } catch (NumberFormatException e) {
                throw new DocumentDecodeException(
                        "integerValue at '" + path + "' is not a 64-bit integer: '" + content.asText() + "'",
                        e,
                        source);
            }
        }
        throw new DocumentDecodeException("integerValue at '" + path + "' must be a decimal string", source);
    }

    private static Double decodeDouble(JsonNode content, String path, String source) {
        if (content.isNumber()) {
            return content.doubleValue();
        }
        if (content.isTextual()) {
            switch (content.asText()) {
                case "NaN":
                    return Double.NaN;
                case "Infinity":
                    return Double.POSITIVE_INFINITY;
                case "-Infinity":
                    return Double.NEGATIVE_INFINITY;
                default:
                    break;
            }
        }
        throw new DocumentDecodeException("doubleValue at '" + path + "' must be a number", source);
    }

    private static GeoPoint decodeGeoPoint(JsonNode content, String path, String source) {
        if (!content.isObject()) {
            throw new DocumentDecodeException("geoPointValue at '" + path + "' must be an object", source);
        }
        return new GeoPoint(
                coordinate(content, "latitude", path, source), coordinate(content, "longitude", path, source));
    }

    /** Zero coordinates are omitted from the wire format. */
    private static double coordinate(JsonNode content, String name, String path, String source) {
        JsonNode component = content.get(name);
        if (component == null) {
            return 0d;
        }
        if (!component.isNumber()) {
            throw new DocumentDecodeException(
                    "geoPointValue." + name + " at '" + path + "' must be a number", source);
        }
        return component.doubleValue();
    }

    private static Boolean requireBoolean(JsonNode content, String path, String source) {
        if (!content.isBoolean()) {
            throw new DocumentDecodeException("booleanValue at '" + path + "' must be a boolean", source);
        }
        return content.booleanValue();
    }

    private static String requireText(JsonNode content, String path, String source) {
        if (!content.isTextual()) {
            throw new DocumentDecodeException("Value at '" + path + "' must be a string", source);
        }
        return content.asText();
    }

    /**
     * Strips the {@code projects/../databases/../documents/} prefix from a resource name. Names
     * without the prefix are taken as relative document paths.
     */
    private static DocumentReference decodeReference(String resourceName, String path, String source) {
        int idx = resourceName.indexOf(DOCUMENTS_SEGMENT);
        String documentPath = idx >= 0 ? resourceName.substring(idx + DOCUMENTS_SEGMENT.length()) : resourceName;
        try {
            return new DocumentReference(documentPath);
        } catch (IllegalArgumentException e) {
            throw new DocumentDecodeException(
                    "Invalid document reference at '" + path + "': " + e.getMessage(), e, source);
        }
    }

    private static Timestamp decodeOptionalTimestamp(JsonNode root, String key, String source) {
        if (!root.hasNonNull(key)) {
            return null;
        }
        try {
            return Timestamp.parse(root.get(key).asText());
        } catch (IllegalArgumentException e) {
            throw new DocumentDecodeException("Invalid " + key + ": " + e.getMessage(), e, source);
        }
    }
}
