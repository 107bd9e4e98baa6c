package com.workflow.connector;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.workflow.exception.ActionParameterException;
import com.workflow.model.GeneratedReport;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReportConnectorTest {

    @TempDir
    Path outputDir;

    private ReportConnector reportConnector;

    private final List<Map<String, String>> rows = List.of(
            row("1", "Alice", "won", "100"),
            row("2", "Bob", "lost", "50"));

    @BeforeEach
    void setUp() {
        reportConnector = new ReportConnector(outputDir.resolve("reports").toString());
    }

    @Test
    void generate_shouldWriteCsvWithHeaderByDefault() throws Exception {
        GeneratedReport report = reportConnector.generate(Map.of("rows", rows, "title", "Pipeline"));

        assertThat(report.format()).isEqualTo("csv");
        assertThat(report.rowCount()).isEqualTo(2);
        assertThat(report.path()).startsWith(outputDir.resolve("reports"));
        assertThat(report.path().getFileName().toString()).startsWith("pipeline-").endsWith(".csv");
        assertThat(Files.readAllLines(report.path()))
                .containsExactly("id,name,stage,amount", "1,Alice,won,100", "2,Bob,lost,50");
    }

    @Test
    void generate_shouldWriteJsonWithSummary() throws Exception {
        Map<String, Object> summary = summary();

        GeneratedReport report = reportConnector.generate(Map.of("rows", rows, "summary", summary, "format", "JSON", "title", "Pipeline"));

        JsonNode document = new ObjectMapper().readTree(report.path().toFile());
        assertThat(report.path().toString()).endsWith(".json");
        assertThat(document.get("title").asText()).isEqualTo("Pipeline");
        assertThat(document.get("summary").get("rowCount").asInt()).isEqualTo(2);
        assertThat(document.get("rows")).hasSize(2);
        assertThat(document.get("rows").get(1).get("name").asText()).isEqualTo("Bob");
    }

    @Test
    void generate_shouldWriteMarkdownFile() throws Exception {
        GeneratedReport report = reportConnector.generate(Map.of("rows", rows, "summary", summary(), "format", "md", "title", "Pipeline"));

        assertThat(report.format()).isEqualTo("markdown");
        assertThat(report.path().toString()).endsWith(".md");
        assertThat(Files.readString(report.path())).startsWith("# Pipeline").contains("| Alice |");
    }

    @Test
    void generate_shouldWriteDistinctFilesForRepeatedCalls() {
        GeneratedReport first = reportConnector.generate(Map.of("rows", rows, "title", "Pipeline"));
        GeneratedReport second = reportConnector.generate(Map.of("rows", rows, "title", "Pipeline"));

        assertThat(first.path()).isNotEqualTo(second.path());
    }

    @Test
    void generate_shouldWriteEmptyCsvForNoRows() throws Exception {
        GeneratedReport report = reportConnector.generate(Map.of("rows", List.of(), "format", "csv"));

        assertThat(report.rowCount()).isZero();
        assertThat(report.path()).exists();
        assertThat(Files.size(report.path())).isZero();
    }

    @Test
    void generate_shouldRejectUnsupportedFormat() {
        assertThatThrownBy(() -> reportConnector.generate(Map.of("rows", rows, "format", "pdf")))
                .isInstanceOf(ActionParameterException.class)
                .hasMessageContaining("unsupported format 'pdf'");
    }

    @Test
    void renderMarkdown_shouldIncludeSummaryTableAndRecords() {
        String markdown = reportConnector.renderMarkdown("Pipeline", summary(), rows);

        assertThat(markdown).contains(
                "## Summary",
                "- Rows: 2",
                "- Total amount: 150",
                "| stage | count | total |",
                "| won | 1 | 100 |",
                "| id | name | stage | amount |",
                "| 2 | Bob | lost | 50 |");
    }

    @Test
    void renderMarkdown_shouldNoteEmptyDataset() {
        String markdown = reportConnector.renderMarkdown("Empty", null, List.of());

        assertThat(markdown).isEqualTo("# Empty\n\n## Records\n\n_No records._\n");
    }

    private static Map<String, String> row(String id, String name, String stage, String amount) {
        Map<String, String> row = new LinkedHashMap<>();
        row.put("id", id);
        row.put("name", name);
        row.put("stage", stage);
        row.put("amount", amount);
        return row;
    }

    private static Map<String, Object> summary() {
        Map<String, Object> groups = new LinkedHashMap<>();
        groups.put("lost", Map.of("count", 1, "total", new BigDecimal("50")));
        groups.put("won", Map.of("count", 1, "total", new BigDecimal("100")));
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("rowCount", 2);
        summary.put("groupBy", "stage");
        summary.put("valueColumn", "amount");
        summary.put("total", new BigDecimal("150"));
        summary.put("groups", groups);
        return summary;
    }
}
