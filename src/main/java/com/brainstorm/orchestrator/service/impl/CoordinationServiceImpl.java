package com.brainstorm.orchestrator.service.impl;

import com.brainstorm.orchestrator.configuration.AppProperties;
import com.brainstorm.orchestrator.configuration.OrchestratorProperties;
import com.brainstorm.orchestrator.exception.ConfigException;
import com.brainstorm.orchestrator.exception.PersistenceException;
import com.brainstorm.orchestrator.model.context.DocumentSummary;
import com.brainstorm.orchestrator.model.context.ReferenceSummary;
import com.brainstorm.orchestrator.model.conversation.ConversationMessage;
import com.brainstorm.orchestrator.model.dto.Reconciliation;
import com.brainstorm.orchestrator.model.dto.ReconciliationContext;
import com.brainstorm.orchestrator.model.dto.TurnResult;
import com.brainstorm.orchestrator.model.project.ProjectState;
import com.brainstorm.orchestrator.service.AsyncPersistenceWriter;
import com.brainstorm.orchestrator.service.CoordinationService;
import com.brainstorm.orchestrator.service.IntentClassifier;
import com.brainstorm.orchestrator.service.StateReconciler;
import com.brainstorm.orchestrator.storage.ConversationHistoryStore;
import com.brainstorm.orchestrator.storage.DocumentStore;
import com.brainstorm.orchestrator.storage.ProjectStateStore;
import com.brainstorm.orchestrator.storage.ReferenceStore;
import com.brainstorm.orchestrator.util.MetadataValues;
import com.brainstorm.orchestrator.workflow.ExecutionReport;
import com.brainstorm.orchestrator.workflow.IntentClassification;
import com.brainstorm.orchestrator.workflow.MetadataKeys;
import com.brainstorm.orchestrator.workflow.Orchestrator;
import com.brainstorm.orchestrator.workflow.WorkflowDefinition;
import com.brainstorm.orchestrator.workflow.WorkflowRegistry;
import com.brainstorm.orchestrator.workflow.state.StepInput;
import com.brainstorm.orchestrator.workflow.state.StepResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Turn pipeline: parallel context fetch, classify, look up, execute,
 * reconcile, respond. Item appends are synchronous; message and activity
 * writes are fire-and-forget.
 */
@Slf4j
@Service
public class CoordinationServiceImpl implements CoordinationService {

    private final ProjectStateStore projectStateStore;
    private final ReferenceStore referenceStore;
    private final DocumentStore documentStore;
    private final ConversationHistoryStore historyStore;
    private final IntentClassifier intentClassifier;
    private final WorkflowRegistry workflowRegistry;
    private final Orchestrator orchestrator;
    private final StateReconciler reconciler;
    private final AsyncPersistenceWriter persistenceWriter;
    private final AppProperties props;
    private final Executor contextExecutor;
    private final Clock clock;

    public CoordinationServiceImpl(ProjectStateStore projectStateStore,
                                   ReferenceStore referenceStore,
                                   DocumentStore documentStore,
                                   ConversationHistoryStore historyStore,
                                   IntentClassifier intentClassifier,
                                   WorkflowRegistry workflowRegistry,
                                   Orchestrator orchestrator,
                                   StateReconciler reconciler,
                                   AsyncPersistenceWriter persistenceWriter,
                                   AppProperties props,
                                   @Qualifier("contextExecutor") Executor contextExecutor,
                                   Clock clock) {
        this.projectStateStore = projectStateStore;
        this.referenceStore = referenceStore;
        this.documentStore = documentStore;
        this.historyStore = historyStore;
        this.intentClassifier = intentClassifier;
        this.workflowRegistry = workflowRegistry;
        this.orchestrator = orchestrator;
        this.reconciler = reconciler;
        this.persistenceWriter = persistenceWriter;
        this.props = props;
        this.contextExecutor = contextExecutor;
        this.clock = clock;
    }

    @Override
    public TurnResult process(String userMessage, String projectId, String userId) {
        log.info("💬 Turn started for project {} (user {})", projectId, userId);
        OrchestratorProperties config = props.getOrchestrator();

        TurnContext context = fetchContext(projectId, config);
        IntentClassification classification = intentClassifier.classify(userMessage, context.history());

        WorkflowDefinition workflow;
        try {
            workflow = workflowRegistry.lookup(classification.getIntent());
        } catch (ConfigException e) {
            log.error("❌ No workflow for intent {} in project {}, answering with fallback",
                    classification.getIntent(), projectId, e);
            persistMessages(projectId, userId, userMessage, List.of(), config.getFallbackMessage());
            return TurnResult.builder()
                    .intent(classification.getIntent())
                    .message(config.getFallbackMessage())
                    .updatedState(context.state())
                    .fallback(true)
                    .build();
        }

        StepInput input = StepInput.builder()
                .userMessage(userMessage)
                .projectId(projectId)
                .userId(userId)
                .intent(classification.getIntent())
                .history(context.history())
                .references(context.references())
                .documents(context.documents())
                .build();

        ExecutionReport report = orchestrator.execute(workflow, input, context.state());

        Reconciliation reconciliation = reconciler.apply(context.state(), report, ReconciliationContext.builder()
                .projectId(projectId)
                .userMessage(userMessage)
                .intent(classification.getIntent())
                .build());

        ProjectState updated = reconciliation.getState();
        if (reconciliation.hasChanges()) {
            try {
                ProjectState stored = projectStateStore.append(projectId, reconciliation.getAddedItems());
                if (stored != null) {
                    updated = stored;
                }
            } catch (RuntimeException e) {
                throw new PersistenceException(projectId,
                        "Could not store " + reconciliation.getAddedItems().size() + " new item(s)", e);
            }
        }

        List<StepResult> results = report.results();
        List<StepResult> shown = results.stream()
                .filter(result -> !result.isFailed() && result.isShowToUser())
                .filter(result -> result.getMessage() != null && !result.getMessage().isBlank())
                .toList();
        boolean fallback = shown.isEmpty();
        if (fallback) {
            log.warn("⚠️ No user-facing output from {} workflow in project {}, sending fallback",
                    classification.getIntent(), projectId);
        }

        persistMessages(projectId, userId, userMessage, shown, fallback ? config.getFallbackMessage() : null);
        try {
            persistenceWriter.writeActivity(reconciliation.getEvents());
        } catch (RuntimeException e) {
            log.error("❌ Could not schedule activity write for project {}", projectId, e);
        }

        TurnResult.TurnResultBuilder turn = TurnResult.builder()
                .intent(classification.getIntent())
                .advisories(advisories(results))
                .updatedState(updated)
                .fallback(fallback);
        if (fallback) {
            turn.message(config.getFallbackMessage());
        } else {
            shown.forEach(result -> turn.message(result.getMessage()));
        }

        log.info("🏁 Turn finished for project {}: intent={}, messages={}, new items={}",
                projectId, classification.getIntent(), fallback ? 1 : shown.size(), reconciliation.getAddedItems().size());
        return turn.build();
    }

    private TurnContext fetchContext(String projectId, OrchestratorProperties config) {
        CompletableFuture<ProjectState> state = fetch("project state", projectId,
                () -> projectStateStore.fetch(projectId), ProjectState.empty(projectId), config);
        CompletableFuture<List<ReferenceSummary>> references = fetch("references", projectId,
                () -> referenceStore.fetchForProject(projectId), List.of(), config);
        CompletableFuture<List<DocumentSummary>> documents = fetch("documents", projectId,
                () -> documentStore.fetchForProject(projectId), List.of(), config);
        CompletableFuture<List<ConversationMessage>> history = fetch("history", projectId,
                () -> historyStore.fetchRecent(projectId, config.getHistoryLimit()), List.of(), config);

        return new TurnContext(state.join(), references.join(), documents.join(), history.join());
    }

    private <T> CompletableFuture<T> fetch(String what, String projectId, Supplier<T> supplier, T fallback,
                                           OrchestratorProperties config) {
        try {
            return CompletableFuture.supplyAsync(supplier, contextExecutor)
                    .orTimeout(config.getContextFetchTimeout().toMillis(), TimeUnit.MILLISECONDS)
                    .handle((value, ex) -> {
                        if (ex != null) {
                            log.warn("⚠️ Fetching {} for {} failed, continuing without: {}", what, projectId, ex.toString());
                            return fallback;
                        }
                        return value != null ? value : fallback;
                    });
        } catch (RuntimeException e) {
            log.warn("⚠️ Could not schedule {} fetch for {}: {}", what, projectId, e.toString());
            return CompletableFuture.completedFuture(fallback);
        }
    }

    private List<String> advisories(List<StepResult> results) {
        List<String> advisories = new ArrayList<>();
        for (StepResult result : results) {
            if (result.isFailed() || result.getAgent() == null) {
                continue;
            }
            switch (result.getAgent()) {
                case MetadataKeys.Agents.CLAIM_VERIFIER -> {
                    if (result.getMetadata().containsKey(MetadataKeys.APPROVED) && !result.isTrue(MetadataKeys.APPROVED)) {
                        List<String> issues = MetadataValues.asStringList(result.getMetadata().get(MetadataKeys.ISSUES));
                        String detail = issues.isEmpty()
                                ? String.valueOf(result.getMetadata().getOrDefault(MetadataKeys.REASONING, ""))
                                : String.join("; ", issues);
                        advisories.add("Verification concern: " + detail);
                    }
                }
                case MetadataKeys.Agents.ASSUMPTION_SCANNER -> MetadataValues
                        .asStringList(result.getMetadata().get(MetadataKeys.ASSUMPTIONS))
                        .forEach(assumption -> advisories.add("Unstated assumption: " + assumption));
                case MetadataKeys.Agents.CONSISTENCY_CHECKER -> MetadataValues
                        .asStringList(result.getMetadata().get(MetadataKeys.CONFLICTS))
                        .forEach(conflict -> advisories.add("Possible conflict: " + conflict));
                default -> {
                }
            }
        }
        return advisories;
    }

    private void persistMessages(String projectId, String userId, String userMessage,
                                 List<StepResult> shown, String fallbackMessage) {
        Instant now = clock.instant();
        List<ConversationMessage> messages = new ArrayList<>();
        messages.add(ConversationMessage.builder()
                .projectId(projectId)
                .userId(userId)
                .role(ConversationMessage.ROLE_USER)
                .content(userMessage)
                .createdAt(now)
                .build());
        for (StepResult result : shown) {
            messages.add(ConversationMessage.builder()
                    .projectId(projectId)
                    .userId(userId)
                    .role(ConversationMessage.ROLE_ASSISTANT)
                    .content(result.getMessage())
                    .agentName(result.getAgent())
                    .metadataEntry("action", result.getAction())
                    .createdAt(now)
                    .build());
        }
        if (fallbackMessage != null) {
            messages.add(ConversationMessage.builder()
                    .projectId(projectId)
                    .userId(userId)
                    .role(ConversationMessage.ROLE_ASSISTANT)
                    .content(fallbackMessage)
                    .createdAt(now)
                    .build());
        }
        try {
            persistenceWriter.writeMessages(List.copyOf(messages));
        } catch (RuntimeException e) {
            log.error("❌ Could not schedule message write for project {}", projectId, e);
        }
    }

    private record TurnContext(ProjectState state,
                               List<ReferenceSummary> references,
                               List<DocumentSummary> documents,
                               List<ConversationMessage> history) {
    }
}
