package io.docmirror.core.model;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Observed kind of a dynamic input value. Used for diagnostics when a value does not match the
 * declared field type.
 */
public enum ValueKind {
    NULL,
    BOOLEAN,
    NUMBER,
    STRING,
    BYTES,
    ARRAY,
    OBJECT,
    GEOPOINT,
    TIMESTAMP,
    REFERENCE,
    UNKNOWN;

    /** Classifies a dynamic value. Never returns {@code null}. */
    public static ValueKind of(Object value) {
        if (value == null) {
            return NULL;
        }
        if (value instanceof Boolean) {
            return BOOLEAN;
        }
        if (value instanceof Number) {
            return NUMBER;
        }
        if (value instanceof String) {
            return STRING;
        }
        if (value instanceof byte[]) {
            return BYTES;
        }
        if (value instanceof List<?> || value instanceof Object[]) {
            return ARRAY;
        }
        if (value instanceof Map<?, ?>) {
            return OBJECT;
        }
        if (value instanceof GeoPoint) {
            return GEOPOINT;
        }
        if (value instanceof Timestamp) {
            return TIMESTAMP;
        }
        if (value instanceof DocumentReference) {
            return REFERENCE;
        }
        return UNKNOWN;
    }

    /** Lower-case label used in log lines. */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
