package io.docmirror.standalone.runner;

/**
 * Counts reported at the end of a mirror run.
 *
 * @param records  non-blank input lines read
 * @param rows     output rows written
 * @param rejected input lines that could not be decoded
 * @param warnings data warnings raised during extraction (invalid values and array shape mismatches)
 */
public record RunSummary(long records, long rows, long rejected, long warnings) {

    /** One-line description used in logs and notifications. */
    public String describe() {
        return "records=" + records + " rows=" + rows + " rejected=" + rejected + " warnings=" + warnings;
    }
}
