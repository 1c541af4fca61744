package io.docmirror.core.testkit;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Builders for input records. Unlike {@code Map.of}, these accept {@code null} values. */
public final class TestRecords {

    private TestRecords() {}

    /** Builds an insertion-ordered record from alternating keys and values. */
    public static Map<String, Object> record(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("keyValues must alternate key, value");
        }
        Map<String, Object> record = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            record.put((String) keyValues[i], keyValues[i + 1]);
        }
        return record;
    }

    /** Builds a list that may contain {@code null} elements. */
    public static List<Object> list(Object... elements) {
        return new ArrayList<>(Arrays.asList(elements));
    }
}
