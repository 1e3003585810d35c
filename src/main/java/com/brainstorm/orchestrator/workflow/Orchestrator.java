package com.brainstorm.orchestrator.workflow;

import com.brainstorm.orchestrator.configuration.AppProperties;
import com.brainstorm.orchestrator.exception.CapabilityException;
import com.brainstorm.orchestrator.model.project.ProjectState;
import com.brainstorm.orchestrator.workflow.agents.AgentCapability;
import com.brainstorm.orchestrator.workflow.agents.AgentCapabilityRegistry;
import com.brainstorm.orchestrator.workflow.state.StepError;
import com.brainstorm.orchestrator.workflow.state.StepInput;
import com.brainstorm.orchestrator.workflow.state.StepResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a workflow phase by phase.
 *
 * All non-skipped steps of a phase are dispatched on the agent pool before
 * any is awaited. Every failure, including a timeout or a missing capability,
 * becomes a failed {@link StepResult}; one step failing never stops the
 * others. Steps are invoked exactly once.
 */
@Slf4j
@Service
public class Orchestrator {

    private final AgentCapabilityRegistry capabilities;
    private final Executor agentExecutor;
    private final AppProperties props;

    public Orchestrator(AgentCapabilityRegistry capabilities,
                        @Qualifier("agentExecutor") Executor agentExecutor,
                        AppProperties props) {
        this.capabilities = capabilities;
        this.agentExecutor = agentExecutor;
        this.props = props;
    }

    public ExecutionReport execute(WorkflowDefinition workflow, StepInput input, ProjectState projectState) {
        log.info("▶️ Executing {} workflow for project {}", workflow.getIntent(), input.getProjectId());

        List<StepOutcome> outcomes = new ArrayList<>();
        List<StepResult> completed = new ArrayList<>();

        for (WorkflowPhase phase : workflow.phases()) {
            List<StepResult> prior = List.copyOf(completed);
            List<CompletableFuture<StepResult>> dispatched = new ArrayList<>();

            // fan-out
            for (StepSpec step : phase.getSteps()) {
                if (step.isConditional() && !step.getCondition().test(prior)) {
                    log.debug("⏭️ Skipping {} ({} not met)", step.key(), step.getCondition().describe());
                    dispatched.add(null);
                } else {
                    dispatched.add(dispatch(step, input, projectState, prior));
                }
            }

            // fan-in, declaration order
            for (int i = 0; i < phase.getSteps().size(); i++) {
                StepSpec step = phase.getSteps().get(i);
                CompletableFuture<StepResult> future = dispatched.get(i);
                if (future == null) {
                    outcomes.add(StepOutcome.skipped(step));
                    continue;
                }
                StepResult result = await(step, future);
                completed.add(result);
                outcomes.add(StepOutcome.executed(step, result));
            }
        }

        ExecutionReport report = new ExecutionReport(workflow, List.copyOf(outcomes));
        log.info("✅ {} workflow done: {} executed, {} skipped, {} failed",
                workflow.getIntent(), report.results().size(), report.skipped().size(), report.failedCount());
        return report;
    }

    private CompletableFuture<StepResult> dispatch(StepSpec step, StepInput input, ProjectState projectState,
                                                   List<StepResult> prior) {
        Duration timeout = props.getOrchestrator().timeoutFor(step.getAgentName());
        // timer is armed before submission so it holds wherever the task ends up running
        CompletableFuture<StepResult> future = new CompletableFuture<StepResult>()
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        try {
            agentExecutor.execute(() -> future.complete(invoke(step, input, projectState, prior, timeout)));
            return future;
        } catch (RuntimeException e) {
            // executor refused the task
            log.error("❌ Could not dispatch {}", step.key(), e);
            return CompletableFuture.completedFuture(
                    failure(step, StepError.of(StepError.Kind.UNEXPECTED, "Dispatch failed: " + e.getMessage())));
        }
    }

    private StepResult invoke(StepSpec step, StepInput input, ProjectState projectState,
                              List<StepResult> prior, Duration timeout) {
        AgentCapability capability = capabilities.find(step.getAgentName(), step.getAction()).orElse(null);
        if (capability == null) {
            log.error("❌ No capability registered for {}", step.key());
            return failure(step, StepError.of(StepError.Kind.MISSING_CAPABILITY, "No capability for " + step.key()));
        }
        try {
            log.debug("🤖 {} started", step.key());
            StepResult result = capability.invoke(step.getAction(), input, projectState, prior, timeout);
            if (result == null) {
                return failure(step, StepError.of(StepError.Kind.INVALID_RESPONSE, step.key() + " returned no result"));
            }
            log.debug("🤖 {} finished (shown={})", step.key(), result.isShowToUser());
            return result.toBuilder()
                    .agent(step.getAgentName())
                    .action(step.getAction())
                    .build();
        } catch (CapabilityException e) {
            log.warn("⚠️ {} failed: {} - {}", step.key(), e.getKind(), e.getMessage());
            return failure(step, StepError.from(e));
        } catch (RuntimeException e) {
            log.error("❌ {} threw unexpectedly", step.key(), e);
            return failure(step, StepError.of(StepError.Kind.UNEXPECTED, String.valueOf(e.getMessage())));
        }
    }

    private StepResult await(StepSpec step, CompletableFuture<StepResult> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failure(step, StepError.of(StepError.Kind.UNEXPECTED, "Interrupted while waiting"));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() instanceof CompletionException && e.getCause().getCause() != null
                    ? e.getCause().getCause()
                    : e.getCause();
            if (cause instanceof TimeoutException) {
                log.warn("⏱️ {} timed out", step.key());
                return failure(step, StepError.of(StepError.Kind.TIMEOUT,
                        step.key() + " exceeded " + props.getOrchestrator().timeoutFor(step.getAgentName()).toMillis() + "ms"));
            }
            log.error("❌ {} failed", step.key(), cause);
            return failure(step, StepError.of(StepError.Kind.UNEXPECTED, String.valueOf(cause)));
        }
    }

    private static StepResult failure(StepSpec step, StepError error) {
        return StepResult.failure(step.getAgentName(), step.getAction(), error);
    }
}
