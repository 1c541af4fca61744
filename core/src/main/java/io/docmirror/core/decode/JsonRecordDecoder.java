package io.docmirror.core.decode;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.docmirror.core.error.DocumentDecodeException;
import io.docmirror.core.model.StoreDocument;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decodes a plain JSON object into an input record. Objects become insertion-ordered maps,
 * arrays become lists, integral numbers become {@link Long} (or {@link java.math.BigInteger}
 * beyond 64 bits) and other numbers keep the type Jackson reads them as.
 *
 * <p>
 * Plain JSON cannot express store-native values, so geopoint, timestamp and reference fields
 * are never valid in records decoded here.
 */
public final class JsonRecordDecoder implements DocumentDecoder {

    private static final ObjectMapper MAPPER =
            new ObjectMapper().enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    @Override
    public StoreDocument decode(String json, String source) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new DocumentDecodeException("Record is not valid JSON: " + e.getOriginalMessage(), e, source);
        }
        if (root == null || !root.isObject()) {
            throw new DocumentDecodeException("Record must be a JSON object", source);
        }
        return StoreDocument.of(toMap(root));
    }

    private static Map<String, Object> toMap(JsonNode object) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (Map.Entry<String, JsonNode> entry : object.properties()) {
            map.put(entry.getKey(), toValue(entry.getValue()));
        }
        return map;
    }

    private static Object toValue(JsonNode node) {
        if (node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isIntegralNumber()) {
            return node.canConvertToLong() ? (Object) node.longValue() : node.bigIntegerValue();
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isArray()) {
            List<Object> list = new ArrayList<>(node.size());
            node.forEach(element -> list.add(toValue(element)));
            return list;
        }
        if (node.isObject()) {
            return toMap(node);
        }
        return node.toString();
    }
}
