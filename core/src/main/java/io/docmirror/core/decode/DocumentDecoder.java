package io.docmirror.core.decode;

import io.docmirror.core.error.DocumentDecodeException;
import io.docmirror.core.model.StoreDocument;

/** Decodes one serialized document into a {@link StoreDocument}. Implementations are thread-safe. */
public interface DocumentDecoder {

    /**
     * Decodes a single document.
     *
     * @param json   the serialized document
     * @param source identifier used in error messages (file and line, for example)
     * @return the decoded document
     * @throws DocumentDecodeException if the text is not a valid document
     */
    StoreDocument decode(String json, String source);
}
