package com.datalab.export;

import java.io.IOException;
import java.util.Locale;

/**
 * An export failed after it started. Output already written stays written; the stream simply ends early.
 */
public class ExportStreamException extends IOException {
    private static final long serialVersionUID = 1L;

    public enum Failure {
        /** Reading from the record source failed. */
        SOURCE,
        /** Writing to the output sink failed, usually because the consumer went away. */
        SINK
    }

    private final Failure failure;
    private final long linesWritten;

    public ExportStreamException(Failure failure, long linesWritten, IOException cause) {
        super("export " + failure.name().toLowerCase(Locale.ROOT) + " failure after " + linesWritten + " lines: "
                + cause.getMessage(), cause);
        this.failure = failure;
        this.linesWritten = linesWritten;
    }

    public Failure failure() {
        return failure;
    }

    public long linesWritten() {
        return linesWritten;
    }
}
