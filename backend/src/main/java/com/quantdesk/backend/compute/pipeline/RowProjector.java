package com.quantdesk.backend.compute.pipeline;

import com.quantdesk.backend.config.IndicatorProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shapes dataset rows into script input records: the time field as text, then the price fields,
 * then every other column, each coerced to a number or null.
 */
@Component
@RequiredArgsConstructor
public class RowProjector {

    private final IndicatorProperties properties;

    public List<Map<String, Object>> project(List<Map<String, Object>> rows) {
        IndicatorProperties.Dataset layout = properties.getDataset();
        String timeField = layout.getTimeField();
        List<String> priceFields = layout.getPriceFields();

        List<Map<String, Object>> records = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, Object> record = new LinkedHashMap<>();
            Object time = row.get(timeField);
            record.put(timeField, time == null ? null : String.valueOf(time));
            for (String field : priceFields) {
                record.put(field, toNumber(row.get(field)));
            }
            for (Map.Entry<String, Object> column : row.entrySet()) {
                String key = column.getKey();
                if (!key.equals(timeField) && !priceFields.contains(key)) {
                    record.put(key, toNumber(column.getValue()));
                }
            }
            records.add(record);
        }
        return records;
    }

    static Double toNumber(Object value) {
        double number;
        if (value instanceof Number n) {
            number = n.doubleValue();
        } else if (value instanceof String text && !text.isBlank()) {
            try {
                number = Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        return Double.isFinite(number) ? number : null;
    }
}
