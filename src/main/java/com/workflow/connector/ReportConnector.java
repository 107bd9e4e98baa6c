package com.workflow.connector;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.workflow.action.ActionParameters;
import com.workflow.exception.ActionParameterException;
import com.workflow.exception.WorkflowException;
import com.workflow.model.GeneratedReport;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import static com.workflow.service.impl.PlanTemplates.GENERATE_REPORT;

/**
 * Renders rows and an optional analysis summary into a report file.
 * Supported formats are {@code csv}, {@code json} and {@code markdown}.
 */
@Component
@Slf4j
public class ReportConnector {

    private final Path outputDir;
    private final ObjectMapper jsonMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private final CsvMapper csvMapper = new CsvMapper();

    public ReportConnector(@Value("${workflow.report.output-dir:${java.io.tmpdir}/workflow-reports}") String outputDir) {
        this.outputDir = Path.of(outputDir);
    }

    /**
     * Handler for {@code generate_report}.
     * <p>
     * Requires {@code rows}; accepts {@code summary}, {@code format} (default {@code csv}) and
     * {@code title}. Each call writes a new, uniquely named file.
     */
    public GeneratedReport generate(Map<String, Object> parameters) {
        ActionParameters params = ActionParameters.of(GENERATE_REPORT, parameters);
        List<Map<String, String>> rows = params.requireRows("rows");
        Map<String, Object> summary = params.optionalMap("summary");
        String format = normalizeFormat(params.optionalString("format", "csv"));
        String title = params.optionalString("title", "Report");

        Path file;
        try {
            Files.createDirectories(outputDir);
            file = Files.createTempFile(outputDir, slug(title) + "-", "." + extension(format));
        } catch (IOException e) {
            throw new WorkflowException("Failed to create report '" + title + "' in " + outputDir, e);
        }

        try {
            switch (format) {
                case "csv" -> writeCsv(file, rows);
                case "json" -> writeJson(file, title, summary, rows);
                default -> Files.writeString(file, renderMarkdown(title, summary, rows), StandardCharsets.UTF_8);
            }
        } catch (IOException | RuntimeException e) {
            discard(file);
            throw new WorkflowException("Failed to write report '" + title + "' to " + file, e);
        }
        log.info("Wrote {} report '{}' with {} row(s) to {}", format, title, rows.size(), file);
        return new GeneratedReport(file, format, rows.size());
    }

    private static void discard(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete incomplete report {}", file, e);
        }
    }

    private void writeCsv(Path file, List<Map<String, String>> rows) throws IOException {
        Set<String> columns = columnsOf(rows);
        if (columns.isEmpty()) {
            // no columns to put in a header; the file stays empty
            return;
        }
        CsvSchema.Builder schema = CsvSchema.builder();
        columns.forEach(schema::addColumn);
        csvMapper.writer(schema.build().withHeader()).writeValue(file.toFile(), rows);
    }

    private void writeJson(Path file, String title, Map<String, Object> summary, List<Map<String, String>> rows) throws IOException {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("title", title);
        if (summary != null) {
            document.put("summary", summary);
        }
        document.put("rows", rows);
        jsonMapper.writeValue(file.toFile(), document);
    }

    String renderMarkdown(String title, Map<String, Object> summary, List<Map<String, String>> rows) {
        StringBuilder md = new StringBuilder();
        md.append("# ").append(title).append("\n\n");

        if (summary != null) {
            md.append("## Summary\n\n");
            md.append("- Rows: ").append(summary.get("rowCount")).append('\n');
            md.append("- Total ").append(summary.get("valueColumn")).append(": ").append(summary.get("total")).append("\n\n");
            if (summary.get("groups") instanceof Map<?, ?> groups && !groups.isEmpty()) {
                md.append("| ").append(cell(summary.get("groupBy"))).append(" | count | total |\n");
                md.append("|---|---|---|\n");
                groups.forEach((group, stats) -> {
                    Map<?, ?> values = stats instanceof Map<?, ?> m ? m : Map.of();
                    md.append("| ").append(cell(group))
                            .append(" | ").append(cell(values.get("count")))
                            .append(" | ").append(cell(values.get("total")))
                            .append(" |\n");
                });
                md.append('\n');
            }
        }

        md.append("## Records\n\n");
        List<String> columns = List.copyOf(columnsOf(rows));
        if (columns.isEmpty()) {
            md.append("_No records._\n");
            return md.toString();
        }
        md.append("| ").append(String.join(" | ", columns)).append(" |\n");
        md.append("|").append("---|".repeat(columns.size())).append('\n');
        for (Map<String, String> row : rows) {
            md.append('|');
            for (String column : columns) {
                md.append(' ').append(cell(row.get(column))).append(" |");
            }
            md.append('\n');
        }
        return md.toString();
    }

    private static Set<String> columnsOf(List<Map<String, String>> rows) {
        Set<String> columns = new LinkedHashSet<>();
        rows.forEach(row -> columns.addAll(row.keySet()));
        return columns;
    }

    private static String cell(Object value) {
        return value == null ? "" : String.valueOf(value).replace("|", "\\|");
    }

    private static String normalizeFormat(String format) {
        String normalized = format.toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "csv", "json" -> normalized;
            case "markdown", "md" -> "markdown";
            default -> throw new ActionParameterException(GENERATE_REPORT, "format", "unsupported format '" + format + "' (expected csv, json or markdown)");
        };
    }

    private static String extension(String format) {
        return "markdown".equals(format) ? "md" : format;
    }

    private static String slug(String title) {
        String slug = title.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-").replaceAll("(^-|-$)", "");
        // createTempFile requires a prefix of at least three characters
        return slug.length() < 3 ? "report" : slug;
    }
}
