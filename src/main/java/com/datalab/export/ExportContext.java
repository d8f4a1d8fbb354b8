package com.datalab.export;

import java.util.function.BooleanSupplier;

/**
 * Per-request generation state: the line cap, counters and the cancellation signal. Owned by exactly one
 * export call and never shared.
 */
final class ExportContext {
    private final int maxExamples;
    private final BooleanSupplier cancellation;
    private long recordsRead;
    private long linesWritten;
    private ExportReport.StopReason stopReason = ExportReport.StopReason.EXHAUSTED;

    ExportContext(int maxExamples, BooleanSupplier cancellation) {
        this.maxExamples = maxExamples;
        this.cancellation = cancellation;
    }

    /**
     * Checked before each source record and before each output line.
     */
    boolean shouldStop() {
        if (stopReason != ExportReport.StopReason.EXHAUSTED) {
            return true;
        }
        if (maxExamples > 0 && linesWritten >= maxExamples) {
            stopReason = ExportReport.StopReason.LIMIT_REACHED;
            return true;
        }
        if (cancellation.getAsBoolean() || Thread.currentThread().isInterrupted()) {
            stopReason = ExportReport.StopReason.CANCELLED;
            return true;
        }
        return false;
    }

    void recordRead() {
        recordsRead++;
    }

    void lineWritten() {
        linesWritten++;
    }

    long linesWritten() {
        return linesWritten;
    }

    ExportReport report(ExportMode mode) {
        return new ExportReport(mode, recordsRead, linesWritten, stopReason);
    }
}
