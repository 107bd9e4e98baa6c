package com.workflow.cli;

import com.workflow.model.PlanTemplate;
import com.workflow.model.StepTemplate;
import com.workflow.service.api.ActionHandlerRegistry;
import com.workflow.service.api.PlanBuilder;
import java.util.stream.Collectors;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;

/**
 * A Spring Shell component for inspecting what the agent can do: the registered action
 * handlers and the workflow categories the planner knows.
 */
@ShellComponent
public class ActionsCommand {

    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_CYAN = "\u001B[36m";
    public static final String ANSI_YELLOW = "\u001B[33m";
    public static final String ANSI_GREEN = "\u001B[32m";
    public static final String ANSI_RED = "\u001B[31m";

    private final ActionHandlerRegistry registry;
    private final PlanBuilder planBuilder;

    public ActionsCommand(ActionHandlerRegistry registry, PlanBuilder planBuilder) {
        this.registry = registry;
        this.planBuilder = planBuilder;
    }

    @ShellMethod(key = "actions", value = "Lists registered actions and known workflow categories.")
    public String actions() {
        StringBuilder sb = new StringBuilder();
        sb.append(ANSI_CYAN).append("Registered actions:").append(ANSI_RESET).append('\n');
        registry.identifiers().forEach(id -> sb.append("  - ").append(ANSI_GREEN).append(id).append(ANSI_RESET).append('\n'));

        sb.append(ANSI_CYAN).append("Workflow categories:").append(ANSI_RESET).append('\n');
        for (PlanTemplate template : planBuilder.categories()) {
            sb.append("-".repeat(50)).append('\n');
            sb.append(ANSI_YELLOW).append(template.category()).append(ANSI_RESET).append('\n');
            sb.append("  ").append(template.description()).append('\n');
            sb.append("  Required: ")
                    .append(template.requiredParameters().isEmpty() ? "(none)" : String.join(", ", template.requiredParameters()))
                    .append('\n');
            String steps = template.steps().stream()
                    .map(StepTemplate::action)
                    .map(action -> registry.resolve(action).isPresent() ? action : ANSI_RED + action + " (unregistered)" + ANSI_RESET)
                    .collect(Collectors.joining(" -> "));
            sb.append("  Steps: ").append(steps).append('\n');
        }
        return sb.toString();
    }
}
