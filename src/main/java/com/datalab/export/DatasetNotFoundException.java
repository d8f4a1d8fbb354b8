package com.datalab.export;

public class DatasetNotFoundException extends ExportConfigurationException {
    private static final long serialVersionUID = 1L;

    private final long datasetId;

    public DatasetNotFoundException(long datasetId) {
        super("dataset not found: " + datasetId);
        this.datasetId = datasetId;
    }

    public long datasetId() {
        return datasetId;
    }
}
