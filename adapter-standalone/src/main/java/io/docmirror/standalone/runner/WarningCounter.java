package io.docmirror.standalone.runner;

import io.docmirror.core.spi.ExtractionListener;
import java.util.concurrent.atomic.AtomicLong;

/** Counts data warnings raised by the extractor. Thread-safe. */
public final class WarningCounter implements ExtractionListener {

    private final AtomicLong invalidValues = new AtomicLong();
    private final AtomicLong shapeMismatches = new AtomicLong();

    @Override
    public void onInvalidValue(InvalidValueEvent event) {
        invalidValues.incrementAndGet();
    }

    @Override
    public void onArrayShapeMismatch(ArrayShapeMismatchEvent event) {
        shapeMismatches.incrementAndGet();
    }

    public long invalidValues() {
        return invalidValues.get();
    }

    public long shapeMismatches() {
        return shapeMismatches.get();
    }

    public long total() {
        return invalidValues.get() + shapeMismatches.get();
    }
}
