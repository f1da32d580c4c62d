package com.billing.leakdetector.engine;

import com.billing.leakdetector.exception.InvalidRowException;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Map;

/**
 * Structural checks applied to every row before it reaches the inference adapter.
 * Column-specific checks are the adapter's business.
 */
@Component
public class RowValidator {

    public void validate(int rowIndex, Map<String, Object> row) {
        if (row == null || row.isEmpty()) {
            throw new InvalidRowException("Row " + rowIndex + " is empty");
        }
        for (Map.Entry<String, Object> cell : row.entrySet()) {
            String column = cell.getKey();
            Object value = cell.getValue();
            if (column == null || column.isBlank()) {
                throw new InvalidRowException("Row " + rowIndex + " has a column without a name");
            }
            if (value instanceof Map<?, ?> || value instanceof Collection<?>) {
                throw new InvalidRowException("Row " + rowIndex + " column " + column + " holds a nested value");
            }
            if (value instanceof Double d && !Double.isFinite(d)) {
                throw new InvalidRowException("Row " + rowIndex + " column " + column + " is not a finite number");
            }
            if (value instanceof Float f && !Float.isFinite(f)) {
                throw new InvalidRowException("Row " + rowIndex + " column " + column + " is not a finite number");
            }
        }
    }
}
