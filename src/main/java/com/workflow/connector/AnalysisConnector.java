package com.workflow.connector;

import com.workflow.action.ActionParameters;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import static com.workflow.service.impl.PlanTemplates.ANALYZE;

/**
 * Summarizes tabular data by grouping on one column and totalling a numeric one.
 */
@Component
@Slf4j
public class AnalysisConnector {

    static final String UNGROUPED = "(none)";

    /**
     * Handler for {@code analyze}.
     * <p>
     * Requires {@code rows}. {@code groupBy} defaults to {@code stage} and {@code valueColumn}
     * to {@code amount}. Values that are not numbers are counted but not totalled.
     *
     * @return An ordered summary with {@code rowCount}, {@code groupBy}, {@code valueColumn},
     *         {@code total} and {@code groups} (sorted by group name, each with {@code count} and {@code total}).
     */
    public Map<String, Object> analyze(Map<String, Object> parameters) {
        ActionParameters params = ActionParameters.of(ANALYZE, parameters);
        List<Map<String, String>> rows = params.requireRows("rows");
        String groupBy = params.optionalString("groupBy", "stage");
        String valueColumn = params.optionalString("valueColumn", "amount");

        Map<String, Integer> counts = new TreeMap<>();
        Map<String, BigDecimal> totals = new TreeMap<>();
        BigDecimal total = BigDecimal.ZERO;
        int unparseable = 0;
        for (Map<String, String> row : rows) {
            String group = row.getOrDefault(groupBy, "").trim();
            if (group.isEmpty()) {
                group = UNGROUPED;
            }
            counts.merge(group, 1, Integer::sum);
            BigDecimal value = parse(row.get(valueColumn));
            if (value == null) {
                unparseable++;
                totals.putIfAbsent(group, BigDecimal.ZERO);
                continue;
            }
            totals.merge(group, value, BigDecimal::add);
            total = total.add(value);
        }

        Map<String, Object> groups = new LinkedHashMap<>();
        counts.forEach((group, count) -> {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("count", count);
            entry.put("total", totals.get(group));
            groups.put(group, entry);
        });

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("rowCount", rows.size());
        summary.put("groupBy", groupBy);
        summary.put("valueColumn", valueColumn);
        summary.put("total", total);
        summary.put("groups", groups);
        log.info("Analyzed {} row(s) into {} group(s) by '{}'.", rows.size(), groups.size(), groupBy);
        if (unparseable > 0) {
            log.debug("{} value(s) in column '{}' were not numeric and were left out of totals.", unparseable, valueColumn);
        }
        return summary;
    }

    private static BigDecimal parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
