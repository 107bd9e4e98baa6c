package com.workflow.service.impl;

import com.workflow.model.PlanTemplate;
import com.workflow.model.StepReference;
import com.workflow.model.StepTemplate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The built-in workflow categories and the step recipes used to plan them.
 */
public final class PlanTemplates {

    public static final String GENERATE_AND_SEND_REPORT = "generate-and-send-report";
    public static final String GENERATE_AND_POST_REPORT = "generate-and-post-report";
    public static final String ANALYZE_CRM_DATA = "analyze-crm-data";
    public static final String SEND_NOTIFICATION = "send-notification";

    public static final String FETCH_CRM = "fetch_crm";
    public static final String CLEAN_DATA = "clean_data";
    public static final String ANALYZE = "analyze";
    public static final String GENERATE_REPORT = "generate_report";
    public static final String SEND_EMAIL = "send_email";
    public static final String SEND_CHAT_MESSAGE = "send_chat_message";

    static final String DEFAULT_GROUP_BY = "stage";
    static final String DEFAULT_VALUE_COLUMN = "amount";
    static final String DEFAULT_FORMAT = "csv";
    static final String DEFAULT_TITLE = "CRM Report";
    static final String DEFAULT_EMAIL_BODY = "Please find the requested report attached.";

    private PlanTemplates() {
    }

    public static List<PlanTemplate> builtIn() {
        return List.of(
                new PlanTemplate(GENERATE_AND_SEND_REPORT,
                        "Fetch CRM data, clean and analyze it, build a report and e-mail it.",
                        List.of("to"),
                        List.of(fetch(), clean(0), analyze(1), report(1, 2), email(3))),
                new PlanTemplate(GENERATE_AND_POST_REPORT,
                        "Fetch CRM data, clean and analyze it, build a report and post it to a chat channel.",
                        List.of("channel"),
                        List.of(fetch(), clean(0), analyze(1), report(1, 2), chatAboutReport(2, 3))),
                new PlanTemplate(ANALYZE_CRM_DATA,
                        "Fetch CRM data, clean it and summarize it.",
                        List.of(),
                        List.of(fetch(), clean(0), analyze(1))),
                new PlanTemplate(SEND_NOTIFICATION,
                        "Post a message to a chat channel.",
                        List.of("channel", "message"),
                        List.of(new StepTemplate(SEND_CHAT_MESSAGE, p -> params(
                                "channel", p.get("channel"),
                                "message", p.get("message")))))
        );
    }

    private static StepTemplate fetch() {
        return new StepTemplate(FETCH_CRM, p -> params(
                "filter", p.get("filter"),
                "limit", p.get("limit")));
    }

    private static StepTemplate clean(int rowsFrom) {
        return new StepTemplate(CLEAN_DATA, p -> params(
                "rows", StepReference.to(rowsFrom),
                "requiredColumns", p.get("requiredColumns")));
    }

    private static StepTemplate analyze(int rowsFrom) {
        return new StepTemplate(ANALYZE, p -> params(
                "rows", StepReference.to(rowsFrom),
                "groupBy", valueOr(p, "groupBy", DEFAULT_GROUP_BY),
                "valueColumn", valueOr(p, "valueColumn", DEFAULT_VALUE_COLUMN)));
    }

    private static StepTemplate report(int rowsFrom, int summaryFrom) {
        return new StepTemplate(GENERATE_REPORT, p -> params(
                "rows", StepReference.to(rowsFrom),
                "summary", StepReference.to(summaryFrom),
                "format", valueOr(p, "format", DEFAULT_FORMAT),
                "title", valueOr(p, "title", DEFAULT_TITLE)));
    }

    private static StepTemplate email(int reportFrom) {
        return new StepTemplate(SEND_EMAIL, p -> params(
                "to", p.get("to"),
                "subject", valueOr(p, "subject", valueOr(p, "title", DEFAULT_TITLE)),
                "body", valueOr(p, "body", DEFAULT_EMAIL_BODY),
                "attachment", StepReference.to(reportFrom)));
    }

    private static StepTemplate chatAboutReport(int summaryFrom, int reportFrom) {
        return new StepTemplate(SEND_CHAT_MESSAGE, p -> params(
                "channel", p.get("channel"),
                "message", valueOr(p, "message", valueOr(p, "title", DEFAULT_TITLE) + " is ready"),
                "rowCount", StepReference.to(summaryFrom, "$.rowCount"),
                "attachment", StepReference.to(reportFrom)));
    }

    private static Object valueOr(Map<String, Object> intentParameters, String name, Object defaultValue) {
        Object value = intentParameters.get(name);
        if (value == null || (value instanceof String s && s.isBlank())) {
            return defaultValue;
        }
        return value;
    }

    // Null values are left out so absent optional parameters stay absent.
    private static Map<String, Object> params(Object... keysAndValues) {
        Map<String, Object> bound = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            if (keysAndValues[i + 1] != null) {
                bound.put((String) keysAndValues[i], keysAndValues[i + 1]);
            }
        }
        return bound;
    }
}
