package com.workflow.connector;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.workflow.action.ActionParameters;
import com.workflow.exception.ActionParameterException;
import com.workflow.exception.WorkflowException;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import static com.workflow.service.impl.PlanTemplates.FETCH_CRM;

/**
 * Reads customer records from a CSV export of the CRM.
 * <p>
 * The dataset location is injected, so the same connector can read a classpath sample, a
 * file on disk, or any other Spring {@link Resource}.
 */
@Component
@Slf4j
public class CrmConnector {

    private final Resource dataFile;
    private final CsvMapper csvMapper = new CsvMapper();

    public CrmConnector(@Value("${workflow.crm.data-file:classpath:data/crm-sample.csv}") Resource dataFile) {
        this.dataFile = dataFile;
    }

    /**
     * Handler for {@code fetch_crm}.
     * <p>
     * Optional parameters: {@code filter} (field to expected value, matched case-insensitively)
     * and {@code limit} (maximum number of rows returned).
     *
     * @return The matching rows, each a map from column name to value, in file order.
     */
    public List<Map<String, String>> fetch(Map<String, Object> parameters) {
        ActionParameters params = ActionParameters.of(FETCH_CRM, parameters);
        Map<String, String> filter = params.optionalStringMap("filter");
        Integer limit = params.optionalInt("limit");
        if (limit != null && limit < 0) {
            throw new ActionParameterException(FETCH_CRM, "limit", "must not be negative");
        }

        List<Map<String, String>> records = readDataset();
        Stream<Map<String, String>> matching = records.stream().filter(row -> matches(row, filter));
        if (limit != null) {
            matching = matching.limit(limit);
        }
        List<Map<String, String>> result = matching.toList();
        log.info("Fetched {} CRM record(s) from {} ({} after filtering).", records.size(), dataFile.getDescription(), result.size());
        return result;
    }

    private List<Map<String, String>> readDataset() {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (InputStream in = dataFile.getInputStream();
             MappingIterator<Map<String, String>> rows = csvMapper.readerFor(Map.class).with(schema).readValues(in)) {
            return rows.readAll();
        } catch (IOException e) {
            throw new WorkflowException("Could not read CRM dataset " + dataFile.getDescription(), e);
        }
    }

    private static boolean matches(Map<String, String> row, Map<String, String> filter) {
        for (Map.Entry<String, String> criterion : filter.entrySet()) {
            String actual = row.get(criterion.getKey());
            if (actual == null || !actual.trim().equalsIgnoreCase(criterion.getValue())) {
                return false;
            }
        }
        return true;
    }
}
