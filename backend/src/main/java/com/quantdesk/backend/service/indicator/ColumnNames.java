package com.quantdesk.backend.service.indicator;

/**
 * Column naming grammar shared by the detector, the rewriter and the dataset store.
 * <ul>
 *     <li>bare: {@code column}</li>
 *     <li>group output: {@code group:output}</li>
 *     <li>cross-dataset: {@code dataset@column}</li>
 * </ul>
 */
public final class ColumnNames {

    public static final String GROUP_SEPARATOR = ":";
    public static final String DATASET_SEPARATOR = "@";

    private ColumnNames() {
    }

    public static String groupColumn(String groupName, String output) {
        return groupName + GROUP_SEPARATOR + output;
    }

    public static String qualified(String dataset, String column) {
        return dataset + DATASET_SEPARATOR + column;
    }

    public static boolean isPlainName(String name) {
        return name != null
                && !name.isBlank()
                && !name.contains(GROUP_SEPARATOR)
                && !name.contains(DATASET_SEPARATOR)
                && !name.contains("'")
                && !name.contains("\"");
    }
}
