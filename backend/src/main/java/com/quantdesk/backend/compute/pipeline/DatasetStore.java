package com.quantdesk.backend.compute.pipeline;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Backing store of tabular datasets. Column writes merge into the existing column set and never
 * drop unrelated columns.
 */
public interface DatasetStore {

    List<String> datasetNames();

    boolean exists(String dataset);

    /**
     * Current rows, read fresh on every call.
     *
     * @throws com.quantdesk.backend.exception.NotFoundException when the dataset does not exist
     */
    List<Map<String, Object>> readRows(String dataset);

    List<String> columns(String dataset);

    /**
     * Creates the dataset or replaces all of its rows.
     */
    void importRows(String dataset, List<Map<String, Object>> rows);

    void writeColumn(String dataset, String column, List<Double> values);

    /**
     * Writes one column per entry, named {@code "{groupName}:{output}"}.
     */
    void writeGroupColumns(String dataset, String groupName, Map<String, List<Double>> values);

    /**
     * Renames columns in every dataset.
     *
     * @return number of datasets touched
     */
    int renameColumns(Map<String, String> renames);

    /**
     * Removes columns from every dataset.
     *
     * @return number of datasets touched
     */
    int removeColumns(Collection<String> columns);
}
