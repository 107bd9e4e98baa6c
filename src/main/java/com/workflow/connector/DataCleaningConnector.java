package com.workflow.connector;

import com.workflow.action.ActionParameters;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import static com.workflow.service.impl.PlanTemplates.CLEAN_DATA;

/**
 * Normalizes tabular data before analysis: trims every key and value, lower-cases e-mail
 * addresses, and drops blank, incomplete and duplicate rows. Row order is preserved.
 */
@Component
@Slf4j
public class DataCleaningConnector {

    private static final String EMAIL_COLUMN = "email";

    /**
     * Handler for {@code clean_data}.
     * <p>
     * Requires {@code rows}; {@code requiredColumns} optionally names columns that must be non-blank.
     */
    public List<Map<String, String>> clean(Map<String, Object> parameters) {
        ActionParameters params = ActionParameters.of(CLEAN_DATA, parameters);
        List<Map<String, String>> rows = params.requireRows("rows");
        List<String> requiredColumns = params.optionalStringList("requiredColumns");

        Set<Map<String, String>> cleaned = new LinkedHashSet<>();
        int incomplete = 0;
        for (Map<String, String> row : rows) {
            Map<String, String> normalized = normalize(row);
            if (normalized.values().stream().allMatch(String::isEmpty)) {
                continue;
            }
            if (requiredColumns.stream().anyMatch(column -> normalized.getOrDefault(column, "").isEmpty())) {
                incomplete++;
                continue;
            }
            cleaned.add(normalized);
        }
        log.info("Cleaned {} row(s) down to {} ({} incomplete).", rows.size(), cleaned.size(), incomplete);
        return new ArrayList<>(cleaned);
    }

    private static Map<String, String> normalize(Map<String, String> row) {
        Map<String, String> normalized = new LinkedHashMap<>();
        row.forEach((column, value) -> {
            String key = column.trim();
            String cell = value == null ? "" : value.trim();
            if (EMAIL_COLUMN.equalsIgnoreCase(key)) {
                cell = cell.toLowerCase(Locale.ROOT);
            }
            normalized.put(key, cell);
        });
        return normalized;
    }
}
