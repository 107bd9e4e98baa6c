package com.workflow.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jayway.jsonpath.JsonPath;
import com.workflow.action.ActionHandler;
import com.workflow.exception.WorkflowException;
import com.workflow.model.CancellationToken;
import com.workflow.model.ExecutionLog;
import com.workflow.model.Plan;
import com.workflow.model.RunStatus;
import com.workflow.model.Step;
import com.workflow.model.StepReference;
import com.workflow.model.StepResult;
import com.workflow.service.api.ActionHandlerRegistry;
import com.workflow.service.api.ExecutionEngine;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Runs a {@link Plan} step by step against an {@link ActionHandlerRegistry}.
 * <p>
 * Steps with no registered handler are recorded as skipped and the run continues. Any
 * handler failure is recorded and ends the run, because later steps depend on what earlier
 * ones produced. Nothing thrown by a handler escapes {@link #run}; the caller always gets
 * the log of what was attempted.
 * <p>
 * The engine holds no per-run state, so one instance can serve concurrent runs of
 * independent plans. It never retries; that belongs to handler decorators.
 */
@Service
@Slf4j
public class ExecutionEngineImpl implements ExecutionEngine {

    static final String UNSUPPORTED_ACTION = "unsupported action";
    static final String RUN_CANCELLED = "run cancelled";

    private final ExecutorService stepExecutor;
    private final long stepTimeoutMillis;
    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    /**
     * @param stepExecutor      Pool that runs handlers when a step timeout is configured.
     * @param stepTimeoutMillis Per-step timeout in milliseconds; {@code 0} or less runs handlers
     *                          on the calling thread with no bound.
     */
    public ExecutionEngineImpl(@Qualifier("workflowStepExecutor") ExecutorService stepExecutor,
                               @Value("${workflow.execution.step-timeout-ms:0}") long stepTimeoutMillis) {
        this.stepExecutor = stepExecutor;
        this.stepTimeoutMillis = stepTimeoutMillis;
    }

    @Override
    public ExecutionLog run(Plan plan, ActionHandlerRegistry registry, CancellationToken cancellation) {
        List<StepResult> results = new ArrayList<>(plan.size());
        log.info("Running plan '{}' with {} step(s).", plan.category(), plan.size());

        for (Step step : plan.steps()) {
            if (cancellation.isCancelled()) {
                log.info("Run of plan '{}' cancelled before step {}.", plan.category(), step.number());
                return finish(plan, results, RunStatus.CANCELLED);
            }

            Optional<ActionHandler> handler = registry.resolve(step.action());
            if (handler.isEmpty()) {
                log.warn("Skipping step {}: no handler registered for action '{}'.", step.number(), step.action());
                results.add(StepResult.skipped(step, UNSUPPORTED_ACTION));
                continue;
            }

            log.info("Executing step {}: {}", step.number(), step.action());
            long start = System.nanoTime();
            try {
                Map<String, Object> parameters = resolveParameters(step, results);
                Object payload = invoke(handler.get(), step, parameters);
                results.add(StepResult.success(step, payload, elapsedSince(start)));
                log.info("Step {} successful.", step.number());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("Run of plan '{}' interrupted during step {}.", plan.category(), step.number());
                results.add(StepResult.skipped(step, RUN_CANCELLED));
                return finish(plan, results, RunStatus.CANCELLED);
            } catch (RuntimeException | Error e) {
                log.error("Step {} ({}) failed; aborting the run.", step.number(), step.action(), e);
                results.add(StepResult.failure(step, describe(e), elapsedSince(start)));
                return finish(plan, results, RunStatus.FAILED);
            }
        }
        return finish(plan, results, RunStatus.SUCCEEDED);
    }

    private Object invoke(ActionHandler handler, Step step, Map<String, Object> parameters) throws InterruptedException {
        if (stepTimeoutMillis <= 0) {
            return handler.handle(parameters);
        }

        Callable<Object> call = () -> handler.handle(parameters);
        Future<Object> future = stepExecutor.submit(call);
        try {
            return future.get(stepTimeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new WorkflowException("Step " + step.number() + " (" + step.action() + ") timed out after " + stepTimeoutMillis + " ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new WorkflowException(describe(cause), cause);
        }
    }

    private Map<String, Object> resolveParameters(Step step, List<StepResult> results) {
        Map<String, Object> resolved = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : step.parameters().entrySet()) {
            Object value = entry.getValue();
            if (value instanceof StepReference reference) {
                value = resolveReference(step, entry.getKey(), reference, results);
                log.debug("  Resolved param '{}' from {}", entry.getKey(), reference);
            }
            resolved.put(entry.getKey(), value);
        }
        return Collections.unmodifiableMap(resolved);
    }

    private Object resolveReference(Step step, String paramName, StepReference reference, List<StepResult> results) {
        // Every earlier step has exactly one entry, so log position equals step index.
        if (reference.stepIndex() < 0 || reference.stepIndex() >= step.index()) {
            throw new WorkflowException("Invalid plan: step " + step.number() + " parameter '" + paramName
                    + "' refers to step " + (reference.stepIndex() + 1) + ", which does not run before it.");
        }
        StepResult source = results.get(reference.stepIndex());
        if (!source.isSuccess()) {
            throw new WorkflowException("Step " + step.number() + " depends on step " + source.step().number()
                    + " (" + source.step().action() + "), which did not succeed: " + source.status());
        }
        if (reference.jsonPath() == null) {
            return source.payload();
        }
        try {
            return JsonPath.read(objectMapper.writeValueAsString(source.payload()), reference.jsonPath());
        } catch (Exception e) {
            throw new WorkflowException("Failed to resolve parameter '" + paramName + "' using JsonPath '" + reference.jsonPath() + "'", e);
        }
    }

    private ExecutionLog finish(Plan plan, List<StepResult> results, RunStatus status) {
        log.info("Plan '{}' finished with status {} after {} of {} step(s).", plan.category(), status, results.size(), plan.size());
        return new ExecutionLog(results, status);
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
