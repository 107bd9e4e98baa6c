package com.workflow.model;

import java.nio.file.Path;

/**
 * The artifact produced by the {@code generate_report} action.
 *
 * @param path     Where the report was written.
 * @param format   The output format ({@code csv}, {@code json} or {@code markdown}).
 * @param rowCount The number of data rows in the report.
 */
public record GeneratedReport(Path path, String format, int rowCount) {
}
