package io.docmirror.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A decoded input document: its field data plus the metadata the store attaches to it.
 *
 * @param reference  document reference, or {@code null} when the source carries none
 * @param data       field data, the input record handed to the extraction engine
 * @param createTime creation time, or {@code null} if unknown
 * @param updateTime last update time, or {@code null} if unknown
 */
public record StoreDocument(
        DocumentReference reference, Map<String, Object> data, Timestamp createTime, Timestamp updateTime) {

    public StoreDocument {
        Objects.requireNonNull(data, "data must not be null");
        data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    /** Creates a document with data only. */
    public static StoreDocument of(Map<String, Object> data) {
        return new StoreDocument(null, data, null, null);
    }
}
