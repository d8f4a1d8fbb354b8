package com.datalab.export;

public record ExportReport(ExportMode mode, long recordsRead, long linesWritten, StopReason stopReason) {

    public enum StopReason {
        EXHAUSTED,
        LIMIT_REACHED,
        CANCELLED
    }
}
