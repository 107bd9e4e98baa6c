package com.workflow.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.workflow.cli.ui.Spinner;
import com.workflow.dto.response.CommandResponse;
import com.workflow.exception.WorkflowException;
import com.workflow.model.CancellationToken;
import com.workflow.model.ExecutionLog;
import com.workflow.model.GeneratedReport;
import com.workflow.model.IntentSpecification;
import com.workflow.model.Plan;
import com.workflow.model.StepResult;
import com.workflow.service.api.ActionHandlerRegistry;
import com.workflow.service.api.ExecutionEngine;
import com.workflow.service.api.PlanBuilder;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jline.reader.LineReader;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Lazy;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * A Spring Shell component for planning and running workflows from the console.
 * <p>
 * {@code plan} shows what a workflow would do. {@code run} builds the plan, asks for
 * confirmation, executes it and prints the outcome of every attempted step.
 */
@ShellComponent
public class WorkflowCommand {

    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_RED = "\u001B[31m";
    public static final String ANSI_GREEN = "\u001B[32m";
    public static final String ANSI_YELLOW = "\u001B[33m";
    public static final String ANSI_PURPLE = "\u001B[35m";
    public static final String ANSI_CYAN = "\u001B[36m";

    private static final String FILTER_PREFIX = "filter.";
    private static final int MAX_PAYLOAD_PREVIEW = 160;

    private final PlanBuilder planBuilder;
    private final ExecutionEngine executionEngine;
    private final ActionHandlerRegistry registry;
    private final LineReader lineReader;
    private final Spinner spinner;
    private final ObjectMapper jsonMapper = new ObjectMapper();

    public WorkflowCommand(PlanBuilder planBuilder,
                           ExecutionEngine executionEngine,
                           ActionHandlerRegistry registry,
                           @Lazy LineReader lineReader,
                           Spinner spinner) {
        this.planBuilder = planBuilder;
        this.executionEngine = executionEngine;
        this.registry = registry;
        this.lineReader = lineReader;
        this.spinner = spinner;
    }

    /**
     * Builds the plan for a workflow and shows it without executing anything.
     *
     * @param category The workflow category, e.g. {@code generate-and-send-report}.
     * @param params   Parameters as {@code key=value}; {@code filter.<field>=<value>} adds a filter criterion.
     * @return The rendered plan, or the planning error.
     */
    @ShellMethod(key = "plan", value = "Shows the plan for a workflow without running it.")
    public String plan(
            @ShellOption(value = {"--category", "-c"}, help = "The workflow category.") String category,
            @ShellOption(value = {"--param", "-p"}, arity = Integer.MAX_VALUE, defaultValue = ShellOption.NULL,
                    help = "Parameters as key=value.") String[] params
    ) {
        try {
            Plan plan = planBuilder.build(toIntent(category, params));
            if (plan.isEmpty()) {
                return unknownCategory(category).toAnsiString();
            }
            return describePlan(plan);
        } catch (Exception e) {
            return CommandResponse.error("Planning failed: " + e.getMessage()).toAnsiString();
        }
    }

    /**
     * Plans and executes a workflow.
     *
     * @param category The workflow category.
     * @param params   Parameters as {@code key=value}.
     * @param yes      Skip the confirmation prompt.
     * @param verbose  Enable DEBUG logging while the command runs.
     * @return The per-step outcome and the overall run status.
     */
    @ShellMethod(key = "run", value = "Plans and executes a workflow.")
    public String run(
            @ShellOption(value = {"--category", "-c"}, help = "The workflow category.") String category,
            @ShellOption(value = {"--param", "-p"}, arity = Integer.MAX_VALUE, defaultValue = ShellOption.NULL,
                    help = "Parameters as key=value.") String[] params,
            @ShellOption(value = {"--yes", "-y"}, help = "Run without asking for confirmation.", defaultValue = "false", arity = 0) boolean yes,
            @ShellOption(value = {"--verbose", "-v"}, help = "Enable verbose debug logging.", defaultValue = "false", arity = 0) boolean verbose
    ) {
        ch.qos.logback.classic.Logger rootLogger = (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        ch.qos.logback.classic.Level originalLevel = rootLogger.getLevel();
        if (verbose) {
            rootLogger.setLevel(ch.qos.logback.classic.Level.DEBUG);
            System.out.println(ANSI_PURPLE + "-- Verbose mode enabled --" + ANSI_RESET);
        }

        try {
            Plan plan = planBuilder.build(toIntent(category, params));
            if (plan.isEmpty()) {
                return unknownCategory(category).toAnsiString();
            }
            System.out.println(describePlan(plan));

            if (!yes) {
                String confirmation = lineReader.readLine(ANSI_CYAN + "Execute this plan? [y/N]: " + ANSI_RESET);
                if (confirmation == null || !"y".equalsIgnoreCase(confirmation.trim())) {
                    return "Execution cancelled.";
                }
            }

            CancellationToken cancellation = new CancellationToken();
            ExecutionLog executionLog = spinner.spin("Running workflow...",
                    () -> executionEngine.run(plan, registry, cancellation), cancellation::cancel);
            return describeLog(executionLog);
        } catch (Exception e) {
            return CommandResponse.error("An error occurred: " + e.getMessage()).toAnsiString();
        } finally {
            if (verbose) {
                rootLogger.setLevel(originalLevel);
                System.out.println(ANSI_PURPLE + "-- Verbose mode disabled --" + ANSI_RESET);
            }
        }
    }

    /**
     * Turns {@code key=value} shell arguments into an intent. Keys prefixed with
     * {@code filter.} are collected into a single {@code filter} map.
     */
    static IntentSpecification toIntent(String category, String[] params) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        Map<String, String> filter = new LinkedHashMap<>();
        if (params != null) {
            for (String param : params) {
                int separator = param.indexOf('=');
                if (separator <= 0) {
                    throw new WorkflowException("Parameter '" + param + "' must be written as key=value.");
                }
                String key = param.substring(0, separator).trim();
                String value = param.substring(separator + 1).trim();
                if (key.startsWith(FILTER_PREFIX)) {
                    filter.put(key.substring(FILTER_PREFIX.length()), value);
                } else {
                    parameters.put(key, value);
                }
            }
        }
        if (!filter.isEmpty()) {
            parameters.put("filter", filter);
        }
        return new IntentSpecification(category, parameters);
    }

    private String describePlan(Plan plan) {
        StringBuilder sb = new StringBuilder("\nPlan for '").append(plan.category()).append("':\n");
        plan.steps().forEach(step -> {
            sb.append(ANSI_YELLOW).append("  ").append(step.number()).append(". ").append(step.action()).append(ANSI_RESET);
            if (!step.parameters().isEmpty()) {
                sb.append(' ').append(step.parameters());
            }
            if (registry.resolve(step.action()).isEmpty()) {
                sb.append(ANSI_RED).append("  (no handler registered, will be skipped)").append(ANSI_RESET);
            }
            sb.append('\n');
        });
        return sb.toString();
    }

    private String describeLog(ExecutionLog executionLog) {
        StringBuilder sb = new StringBuilder();
        for (StepResult result : executionLog.results()) {
            String line = switch (result.status()) {
                case SUCCESS -> ANSI_GREEN + "  [OK]      " + label(result) + ANSI_RESET + " " + preview(result.payload());
                case SKIPPED -> ANSI_YELLOW + "  [SKIPPED] " + label(result) + ": " + result.reason() + ANSI_RESET;
                case FAILURE -> ANSI_RED + "  [FAILED]  " + label(result) + ": " + result.error() + ANSI_RESET;
            };
            sb.append(line).append('\n');
        }
        String summary = switch (executionLog.status()) {
            case SUCCEEDED -> CommandResponse.ok("Workflow completed: " + executionLog.size() + " step(s) attempted.").toAnsiString();
            case FAILED -> CommandResponse.error("Workflow failed at step " + executionLog.lastResult().step().number() + ".").toAnsiString();
            // an operator stop is not an error
            case CANCELLED -> ANSI_YELLOW + "Workflow cancelled after " + executedSteps(executionLog) + " step(s)." + ANSI_RESET;
        };
        return sb.append(summary).toString();
    }

    private static long executedSteps(ExecutionLog executionLog) {
        return executionLog.results().stream().filter(r -> !r.isSkipped()).count();
    }

    private static String label(StepResult result) {
        return result.step().number() + ". " + result.step().action() + " (" + result.duration().toMillis() + " ms)";
    }

    private String preview(Object payload) {
        if (payload == null) {
            return "";
        }
        if (payload instanceof GeneratedReport report) {
            return "-> " + report.path();
        }
        if (payload instanceof Collection<?> collection) {
            return "-> " + collection.size() + " item(s)";
        }
        String json;
        try {
            json = jsonMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            json = String.valueOf(payload);
        }
        return "-> " + (json.length() > MAX_PAYLOAD_PREVIEW ? json.substring(0, MAX_PAYLOAD_PREVIEW) + "..." : json);
    }

    private CommandResponse unknownCategory(String category) {
        return CommandResponse.error("No workflow is known for category '" + category + "'. Use 'actions' to list categories.");
    }
}
