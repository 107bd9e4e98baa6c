package com.workflow.cli;

import com.workflow.action.ActionHandler;
import com.workflow.cli.ui.Spinner;
import com.workflow.exception.PlanningException;
import com.workflow.exception.WorkflowException;
import com.workflow.model.CancellationToken;
import com.workflow.model.ExecutionLog;
import com.workflow.model.IntentSpecification;
import com.workflow.model.Plan;
import com.workflow.model.RunStatus;
import com.workflow.model.Step;
import com.workflow.model.StepResult;
import com.workflow.service.api.ActionHandlerRegistry;
import com.workflow.service.api.ExecutionEngine;
import com.workflow.service.api.PlanBuilder;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import org.jline.reader.LineReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WorkflowCommandTest {

    @Mock
    private PlanBuilder planBuilder;
    @Mock
    private ExecutionEngine executionEngine;
    @Mock
    private ActionHandlerRegistry registry;
    @Mock
    private LineReader lineReader;
    @Mock
    private Spinner spinner;

    private WorkflowCommand workflowCommand;

    private final Step fetch = new Step("fetch_crm", Map.of("limit", "5"), 0);
    private final Step email = new Step("send_email", Map.of("to", "ops@example.com"), 1);
    private final Plan plan = new Plan("generate-and-send-report", List.of(fetch, email));

    @BeforeEach
    void setUp() {
        workflowCommand = new WorkflowCommand(planBuilder, executionEngine, registry, lineReader, spinner);
        ActionHandler noop = p -> null;
        lenient().when(registry.resolve(anyString())).thenReturn(Optional.of(noop));
        lenient().when(spinner.spin(anyString(), any(), any())).thenAnswer(invocation -> {
            Supplier<?> task = invocation.getArgument(1, Supplier.class);
            return task.get();
        });
    }

    @Test
    void toIntent_shouldCollectFilterParameters() {
        IntentSpecification intent = WorkflowCommand.toIntent("generate-and-send-report",
                new String[]{"to=ops@example.com", "filter.region=EMEA", "filter.stage = won", "format=markdown"});

        assertThat(intent.category()).isEqualTo("generate-and-send-report");
        assertThat(intent.parameters())
                .containsEntry("to", "ops@example.com")
                .containsEntry("format", "markdown")
                .containsEntry("filter", Map.of("region", "EMEA", "stage", "won"));
    }

    @Test
    void toIntent_shouldRejectParameterWithoutValue() {
        assertThatThrownBy(() -> WorkflowCommand.toIntent("analyze-crm-data", new String[]{"verbose"}))
                .isInstanceOf(WorkflowException.class)
                .hasMessageContaining("key=value");
    }

    @Test
    void toIntent_shouldAcceptMissingParameters() {
        assertThat(WorkflowCommand.toIntent("analyze-crm-data", null).parameters()).isEmpty();
    }

    @Test
    void plan_shouldRenderStepsAndFlagUnregisteredActions() {
        when(planBuilder.build(any())).thenReturn(plan);
        when(registry.resolve("send_email")).thenReturn(Optional.empty());

        String output = workflowCommand.plan("generate-and-send-report", new String[]{"to=ops@example.com"});

        assertThat(output).contains("1. fetch_crm", "2. send_email", "will be skipped");
        verifyNoInteractions(executionEngine);
    }

    @Test
    void plan_shouldReportUnknownCategory() {
        when(planBuilder.build(any())).thenReturn(Plan.empty("launch-rocket"));

        String output = workflowCommand.plan("launch-rocket", null);

        assertThat(output).contains("No workflow is known for category 'launch-rocket'");
    }

    @Test
    void plan_shouldReportPlanningError() {
        when(planBuilder.build(any())).thenThrow(new PlanningException("generate-and-send-report", List.of("to")));

        String output = workflowCommand.plan("generate-and-send-report", null);

        assertThat(output).contains("Planning failed: Cannot plan 'generate-and-send-report'");
    }

    @Test
    void run_shouldExecuteWithoutPromptWhenConfirmed() {
        // --- Arrange ---
        when(planBuilder.build(any())).thenReturn(plan);
        ExecutionLog log = new ExecutionLog(List.of(
                StepResult.success(fetch, List.of(Map.of("id", "1")), Duration.ofMillis(3)),
                StepResult.success(email, Map.of("subject", "CRM Report"), Duration.ofMillis(7))), RunStatus.SUCCEEDED);
        when(executionEngine.run(eq(plan), eq(registry), any(CancellationToken.class))).thenReturn(log);

        // --- Act ---
        String output = workflowCommand.run("generate-and-send-report", new String[]{"to=ops@example.com"}, true, false);

        // --- Assert ---
        assertThat(output).contains("[OK]", "1. fetch_crm", "-> 1 item(s)", "Workflow completed: 2 step(s) attempted.");
        verify(lineReader, never()).readLine(anyString());
    }

    @Test
    void run_shouldStopWhenOperatorDeclines() {
        when(planBuilder.build(any())).thenReturn(plan);
        when(lineReader.readLine(anyString())).thenReturn("n");

        String output = workflowCommand.run("generate-and-send-report", new String[]{"to=ops@example.com"}, false, false);

        assertThat(output).isEqualTo("Execution cancelled.");
        verifyNoInteractions(executionEngine);
    }

    @Test
    void run_shouldReportFailedStepAndSkippedSteps() {
        when(planBuilder.build(any())).thenReturn(plan);
        when(lineReader.readLine(anyString())).thenReturn("Y");
        ExecutionLog log = new ExecutionLog(List.of(
                StepResult.skipped(fetch, "unsupported action"),
                StepResult.failure(email, "SMTP rejected", Duration.ofMillis(2))), RunStatus.FAILED);
        when(executionEngine.run(eq(plan), eq(registry), any(CancellationToken.class))).thenReturn(log);

        String output = workflowCommand.run("generate-and-send-report", null, false, false);

        assertThat(output).contains("[SKIPPED]", "unsupported action", "[FAILED]", "SMTP rejected", "Workflow failed at step 2.");
    }

    @Test
    void run_shouldWireCancellationIntoSpinner() {
        when(planBuilder.build(any())).thenReturn(plan);
        ArgumentCaptor<CancellationToken> tokenCaptor = ArgumentCaptor.forClass(CancellationToken.class);
        when(executionEngine.run(eq(plan), eq(registry), tokenCaptor.capture()))
                .thenReturn(new ExecutionLog(List.of(StepResult.success(fetch, null, Duration.ZERO)), RunStatus.CANCELLED));
        ArgumentCaptor<Runnable> interruptCaptor = ArgumentCaptor.forClass(Runnable.class);

        String output = workflowCommand.run("generate-and-send-report", null, true, false);

        verify(spinner).spin(eq("Running workflow..."), any(), interruptCaptor.capture());
        interruptCaptor.getValue().run();
        assertThat(tokenCaptor.getValue().isCancelled()).isTrue();
        assertThat(output).contains("Workflow cancelled after 1 step(s).");
    }

    @Test
    void run_shouldReportEngineErrors() {
        when(planBuilder.build(any())).thenReturn(plan);
        when(executionEngine.run(any(), any(), any())).thenThrow(new IllegalStateException("engine offline"));

        String output = workflowCommand.run("generate-and-send-report", null, true, false);

        assertThat(output).contains("An error occurred: engine offline");
    }

    @Test
    void run_shouldRestoreLogLevelAfterVerboseRun() {
        ch.qos.logback.classic.Logger rootLogger = (ch.qos.logback.classic.Logger)
                org.slf4j.LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        ch.qos.logback.classic.Level before = rootLogger.getLevel();
        when(planBuilder.build(any())).thenReturn(Plan.empty("nothing"));

        workflowCommand.run("nothing", null, true, true);

        assertThat(rootLogger.getLevel()).isEqualTo(before);
    }
}
