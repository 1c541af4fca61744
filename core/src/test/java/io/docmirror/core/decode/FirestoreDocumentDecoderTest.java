package io.docmirror.core.decode;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.docmirror.core.error.DocumentDecodeException;
import io.docmirror.core.model.DocumentReference;
import io.docmirror.core.model.GeoPoint;
import io.docmirror.core.model.StoreDocument;
import io.docmirror.core.model.Timestamp;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("FirestoreDocumentDecoder")
class FirestoreDocumentDecoderTest {

    private final FirestoreDocumentDecoder decoder = new FirestoreDocumentDecoder();

    @Nested
    @DisplayName("Typed values")
    class TypedValues {

        @Test
        @DisplayName("Decodes every value type into its store-native form")
        void decodesAllValueTypes() {
            StoreDocument document = decoder.decode("""
                    {
                      "name": "projects/p/databases/(default)/documents/users/alice",
                      "fields": {
                        "nothing": {"nullValue": null},
                        "active": {"booleanValue": true},
                        "age": {"integerValue": "42"},
                        "ratio": {"doubleValue": 0.5},
                        "big": {"doubleValue": "Infinity"},
                        "seen": {"timestampValue": "2019-08-21T10:15:30.123Z"},
                        "title": {"stringValue": "Hello"},
                        "raw": {"bytesValue": "aGk="},
                        "manager": {"referenceValue": "projects/p/databases/(default)/documents/users/bob"},
                        "loc": {"geoPointValue": {"latitude": 1, "longitude": 2}},
                        "tags": {"arrayValue": {"values": [{"stringValue": "x"}, {"integerValue": "5"}]}},
                        "address": {"mapValue": {"fields": {"city": {"stringValue": "Oslo"}}}}
                      },
                      "createTime": "2019-08-21T10:15:30Z",
                      "updateTime": "2019-08-22T10:15:30Z"
                    }
                    """, "line 1");

            Map<String, Object> data = document.data();
            assertThat(document.reference()).isEqualTo(new DocumentReference("users/alice"));
            assertThat(document.createTime()).isEqualTo(Timestamp.ofEpochSeconds(1566382530L));
            assertThat(document.updateTime().seconds()).isEqualTo(1566468930L);
            assertThat(data).containsEntry("nothing", null);
            assertThat(data).containsEntry("active", true);
            assertThat(data).containsEntry("age", 42L);
            assertThat(data).containsEntry("ratio", 0.5d);
            assertThat(data).containsEntry("big", Double.POSITIVE_INFINITY);
            assertThat(data).containsEntry("seen", new Timestamp(1566382530L, 123_000_000));
            assertThat(data).containsEntry("title", "Hello");
            assertThat((byte[]) data.get("raw")).isEqualTo("hi".getBytes(StandardCharsets.UTF_8));
            assertThat(data).containsEntry("manager", new DocumentReference("users/bob"));
            assertThat(data).containsEntry("loc", new GeoPoint(1, 2));
            assertThat(data).containsEntry("tags", List.of("x", 5L));
            assertThat(data.get("address")).isEqualTo(Map.of("city", "Oslo"));
        }

        @Test
        @DisplayName("Field order follows the document")
        void preservesFieldOrder() {
            StoreDocument document = decoder.decode(
                    "{\"fields\": {\"z\": {\"stringValue\": \"1\"}, \"a\": {\"stringValue\": \"2\"}}}", "line 1");

            assertThat(document.data().keySet()).containsExactly("z", "a");
            assertThat(document.reference()).isNull();
        }

        @Test
        @DisplayName("Empty array and map values decode to empty containers")
        void emptyContainers() {
            StoreDocument document = decoder.decode(
                    "{\"fields\": {\"a\": {\"arrayValue\": {}}, \"m\": {\"mapValue\": {}}}}", "line 1");

            assertThat((List<?>) document.data().get("a")).isEmpty();
            assertThat((Map<?, ?>) document.data().get("m")).isEmpty();
        }

        @Test
        @DisplayName("Document without fields has empty data")
        void documentWithoutFields() {
            assertThat(decoder.decode("{\"name\": \"users/a\"}", "line 1").data()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Malformed documents")
    class MalformedDocuments {

        @Test
        void invalidJsonIsRejected() {
            assertThatThrownBy(() -> decoder.decode("{not json", "line 3"))
                    .isInstanceOf(DocumentDecodeException.class)
                    .hasMessageStartingWith("Document is not valid JSON")
                    .satisfies(e -> assertThat(((DocumentDecodeException) e).source()).isEqualTo("line 3"));
        }

        @Test
        void nonObjectIsRejected() {
            assertThatThrownBy(() -> decoder.decode("[1]", "line 1"))
                    .isInstanceOf(DocumentDecodeException.class)
                    .hasMessage("Document must be a JSON object");
        }

        @Test
        void unknownDocumentKeyIsRejected() {
            assertThatThrownBy(() -> decoder.decode("{\"fields\": {}, \"extra\": 1}", "line 1"))
                    .isInstanceOf(DocumentDecodeException.class)
                    .hasMessage("Unknown document key: [extra]");
        }

        @Test
        void untypedValueIsRejected() {
            assertThatThrownBy(() -> decoder.decode("{\"fields\": {\"a\": \"plain\"}}", "line 1"))
                    .isInstanceOf(DocumentDecodeException.class)
                    .hasMessage("Value at 'a' must be an object with exactly one typed value key");
        }

        @Test
        void unknownValueTypeIsRejected() {
            assertThatThrownBy(() -> decoder.decode(
                            "{\"fields\": {\"m\": {\"mapValue\": {\"fields\": {\"x\": {\"decimalValue\": \"1\"}}}}}}",
                            "line 1"))
                    .isInstanceOf(DocumentDecodeException.class)
                    .hasMessage("Unknown value type 'decimalValue' at 'm.x'");
        }

        @Test
        void badIntegerIsRejected() {
            assertThatThrownBy(() -> decoder.decode("{\"fields\": {\"n\": {\"integerValue\": \"1.5\"}}}", "line 1"))
                    .isInstanceOf(DocumentDecodeException.class)
                    .hasMessageContaining("is not a 64-bit integer");
        }

        @Test
        void badTimestampIsRejected() {
            assertThatThrownBy(() -> decoder.decode(
                            "{\"fields\": {\"t\": {\"timestampValue\": \"tomorrow\"}}}", "line 1"))
                    .isInstanceOf(DocumentDecodeException.class)
                    .hasMessageStartingWith("Invalid timestampValue at 't'");
        }

        @Test
        void outOfRangeGeoPointIsRejected() {
            assertThatThrownBy(() -> decoder.decode(
                            "{\"fields\": {\"g\": {\"geoPointValue\": {\"latitude\": 95, \"longitude\": 0}}}}",
                            "line 1"))
                    .isInstanceOf(DocumentDecodeException.class)
                    .hasMessageContaining("latitude");
        }

        @Test
        void nonNumericGeoPointComponentIsRejected() {
            assertThatThrownBy(() -> decoder.decode(
                            "{\"fields\": {\"loc\": {\"geoPointValue\": {\"latitude\": \"abc\", \"longitude\": true}}}}",
                            "line 1"))
                    .isInstanceOf(DocumentDecodeException.class)
                    .hasMessage("geoPointValue.latitude at 'loc' must be a number");
        }

        @Test
        void nonObjectGeoPointIsRejected() {
            assertThatThrownBy(() -> decoder.decode(
                            "{\"fields\": {\"m\": {\"mapValue\": {\"fields\": {\"loc\": {\"geoPointValue\": \"oops\"}}}}}}",
                            "line 1"))
                    .isInstanceOf(DocumentDecodeException.class)
                    .hasMessage("geoPointValue at 'm.loc' must be an object");
        }

        @Test
        void omittedGeoPointComponentsDefaultToZero() {
            StoreDocument document = decoder.decode(
                    "{\"fields\": {\"loc\": {\"geoPointValue\": {\"longitude\": 12.5}}}}", "line 1");

            assertThat(document.data()).containsEntry("loc", new GeoPoint(0, 12.5));
        }

        @Test
        void malformedReferenceIsRejected() {
            assertThatThrownBy(() -> decoder.decode(
                            "{\"fields\": {\"r\": {\"referenceValue\": \"projects/p/databases/d/documents/users\"}}}",
                            "line 1"))
                    .isInstanceOf(DocumentDecodeException.class)
                    .hasMessageStartingWith("Invalid document reference at 'r'");
        }
    }
}
