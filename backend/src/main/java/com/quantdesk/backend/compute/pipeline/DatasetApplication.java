package com.quantdesk.backend.compute.pipeline;

/**
 * Result for one dataset of a multi-dataset application. {@code report} is null when the pass could
 * not start, for example because the dataset does not exist.
 */
public record DatasetApplication(String dataset, ApplicationReport report, String error) {

    public static DatasetApplication applied(ApplicationReport report) {
        return new DatasetApplication(report.dataset(), report, null);
    }

    public static DatasetApplication notApplied(String dataset, String error) {
        return new DatasetApplication(dataset, null, error);
    }

    public boolean started() {
        return report != null;
    }
}
