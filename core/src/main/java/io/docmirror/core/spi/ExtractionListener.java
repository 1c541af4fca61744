package io.docmirror.core.spi;

import io.docmirror.core.model.ValueKind;

/**
 * SPI for observing data warnings raised while extracting records.
 *
 * <p>
 * The engine always logs these warnings; a listener lets hosts count or forward them. All
 * methods receive immutable event objects. Implementations MUST be thread-safe when the
 * extractor is shared between threads. Exceptions thrown by listeners are caught by the engine
 * and logged; they do NOT affect extraction.
 */
public interface ExtractionListener {

    /** Listener that ignores all events. */
    ExtractionListener NONE = new ExtractionListener() {};

    /**
     * Called when a present value does not match its field's declared type. For repeated
     * fields this fires once per invalid element.
     */
    default void onInvalidValue(InvalidValueEvent event) {}

    /** Called when a repeated field holds something other than an array. */
    default void onArrayShapeMismatch(ArrayShapeMismatchEvent event) {}

    // --- Event records ---

    /**
     * An invalid scalar value (dropped) or array element (replaced by a hole).
     *
     * @param fieldPath    dotted path of the field ({@code address.city})
     * @param declaredType declared type name
     * @param observed     kind of the rejected value
     * @param elementIndex array index for repeated fields, {@code null} for scalars
     */
    record InvalidValueEvent(String fieldPath, String declaredType, ValueKind observed, Integer elementIndex) {

        public boolean isArrayElement() {
            return elementIndex != null;
        }
    }

    /**
     * A repeated field whose value is not an array; the field is dropped.
     *
     * @param fieldPath    dotted path of the field
     * @param declaredType declared element type name
     * @param observed     kind of the value found instead
     */
    record ArrayShapeMismatchEvent(String fieldPath, String declaredType, ValueKind observed) {}
}
