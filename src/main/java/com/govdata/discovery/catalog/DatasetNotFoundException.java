package com.govdata.discovery.catalog;

public class DatasetNotFoundException extends RuntimeException {
    private final String datasetId;

    public DatasetNotFoundException(String datasetId) {
        super("Dataset not found: " + datasetId);
        this.datasetId = datasetId;
    }

    public String getDatasetId() {
        return datasetId;
    }
}
