package com.quantdesk.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.quantdesk.backend.compute.pipeline.DatasetApplication;

import java.util.List;

public record BatchApplyIndicatorsResponse(
        int datasetsApplied,
        int datasetsFailed,
        List<DatasetResult> results
) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record DatasetResult(String dataset, boolean success, String error, ApplyIndicatorsResponse report) {

        static DatasetResult from(DatasetApplication application) {
            return new DatasetResult(
                    application.dataset(),
                    application.started(),
                    application.error(),
                    application.started() ? ApplyIndicatorsResponse.from(application.report()) : null);
        }
    }

    public static BatchApplyIndicatorsResponse from(List<DatasetApplication> applications) {
        List<DatasetResult> results = applications.stream().map(DatasetResult::from).toList();
        int applied = (int) results.stream().filter(DatasetResult::success).count();
        return new BatchApplyIndicatorsResponse(applied, results.size() - applied, results);
    }
}
