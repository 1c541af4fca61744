package io.docmirror.core.decode;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.docmirror.core.error.DocumentDecodeException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonRecordDecoderTest {

    private final JsonRecordDecoder decoder = new JsonRecordDecoder();

    @Test
    void decodesPlainJsonIntoDynamicValues() {
        Map<String, Object> data = decoder.decode("""
                {"s": "x", "b": false, "n": null, "i": 7, "huge": 123456789012345678901234,
                 "f": 1.25, "arr": [1, "two"], "obj": {"k": [true]}}
                """, "line 1").data();

        assertThat(data.keySet()).containsExactly("s", "b", "n", "i", "huge", "f", "arr", "obj");
        assertThat(data).containsEntry("s", "x").containsEntry("b", false).containsEntry("n", null);
        assertThat(data).containsEntry("i", 7L);
        assertThat(data.get("huge")).isEqualTo(new BigInteger("123456789012345678901234"));
        assertThat(data.get("f")).isEqualTo(new BigDecimal("1.25"));
        assertThat(data).containsEntry("arr", List.of(1L, "two"));
        assertThat(data).containsEntry("obj", Map.of("k", List.of(true)));
    }

    @Test
    void rejectsInvalidJson() {
        assertThatThrownBy(() -> decoder.decode("{", "line 9"))
                .isInstanceOf(DocumentDecodeException.class)
                .hasMessageStartingWith("Record is not valid JSON");
    }

    @Test
    void rejectsNonObjectRoots() {
        assertThatThrownBy(() -> decoder.decode("\"text\"", "line 2"))
                .isInstanceOf(DocumentDecodeException.class)
                .hasMessage("Record must be a JSON object");
    }
}
