package com.brainstorm.orchestrator.service;

import com.brainstorm.orchestrator.model.activity.ActivityEvent;
import com.brainstorm.orchestrator.model.activity.ActivityType;
import com.brainstorm.orchestrator.model.dto.Reconciliation;
import com.brainstorm.orchestrator.model.dto.ReconciliationContext;
import com.brainstorm.orchestrator.model.project.Citation;
import com.brainstorm.orchestrator.model.project.Item;
import com.brainstorm.orchestrator.model.project.ItemState;
import com.brainstorm.orchestrator.model.project.ProjectState;
import com.brainstorm.orchestrator.util.MetadataValues;
import com.brainstorm.orchestrator.util.TextNormalizer;
import com.brainstorm.orchestrator.workflow.ExecutionReport;
import com.brainstorm.orchestrator.workflow.MetadataKeys;
import com.brainstorm.orchestrator.workflow.StepOutcome;
import com.brainstorm.orchestrator.workflow.StepSpec;
import com.brainstorm.orchestrator.workflow.state.StepResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Merges step results into the project's append-only item list.
 *
 * A result asks for recording through {@code shouldRecord} or
 * {@code itemsToRecord}; nothing else, in particular no verifier verdict,
 * gates recording. Candidates whose normalized text matches an active item of
 * the same state (including items added earlier in the same call) are
 * suppressed. Existing items are never touched, and the revision only moves
 * when something was added, so applying the same results twice is a no-op
 * the second time.
 *
 * Emits exactly one {@link ActivityEvent} per executed or skipped step.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StateReconciler {

    public static final double DEFAULT_CONFIDENCE = 100;

    private final Clock clock;

    public Reconciliation apply(ProjectState state, List<StepResult> results, ReconciliationContext context) {
        List<StepOutcome> outcomes = results.stream()
                .map(result -> StepOutcome.executed(
                        StepSpec.step(result.getAgent(), result.getAction()), result))
                .toList();
        return reconcile(state, outcomes, context);
    }

    /**
     * Like {@link #apply(ProjectState, List, ReconciliationContext)}, plus a
     * {@code step-skipped} event for every step whose condition did not hold.
     */
    public Reconciliation apply(ProjectState state, ExecutionReport report, ReconciliationContext context) {
        return reconcile(state, report.getOutcomes(), context);
    }

    private Reconciliation reconcile(ProjectState state, List<StepOutcome> outcomes, ReconciliationContext context) {
        Instant now = clock.instant();
        Set<String> seen = new HashSet<>();
        for (Item item : state.activeItems()) {
            seen.add(dedupKey(item.getState(), item.getText()));
        }

        List<Item> added = new ArrayList<>();
        List<ActivityEvent> events = new ArrayList<>();

        for (StepOutcome outcome : outcomes) {
            StepSpec step = outcome.getStep();
            ActivityEvent.ActivityEventBuilder event = ActivityEvent.builder()
                    .projectId(context.getProjectId())
                    .agentName(step.getAgentName())
                    .detail("stepAction", step.getAction())
                    .detail("intent", context.getIntent() != null ? context.getIntent().name() : null)
                    .createdAt(now);

            if (outcome.isSkipped()) {
                events.add(event.action(ActivityType.STEP_SKIPPED.getValue())
                        .detail("message", "Condition not met: " + step.getCondition().describe())
                        .build());
                continue;
            }

            StepResult result = outcome.getResult();
            if (result.isFailed()) {
                events.add(event.action(ActivityType.STEP_FAILED.getValue())
                        .detail("error", result.getError().getMessage())
                        .detail("errorKind", result.getError().getKind().name())
                        .build());
                continue;
            }

            List<Candidate> candidates = candidates(result, context);
            if (candidates.isEmpty()) {
                events.add(event.action(ActivityType.NOT_RECORDED.getValue())
                        .detail("message", notRecordedReason(result))
                        .build());
                continue;
            }

            List<String> itemIds = new ArrayList<>();
            List<String> duplicates = new ArrayList<>();
            List<String> rejected = new ArrayList<>();

            for (Candidate candidate : candidates) {
                Optional<ItemState> itemState = ItemState.fromValue(candidate.state());
                if (candidate.text() == null || candidate.text().isBlank() || itemState.isEmpty()) {
                    rejected.add("text=" + candidate.text() + ", state=" + candidate.state());
                    continue;
                }
                String key = dedupKey(itemState.get(), candidate.text());
                if (!seen.add(key)) {
                    duplicates.add(candidate.text().trim());
                    continue;
                }
                Item item = Item.builder()
                        .id(UUID.randomUUID().toString())
                        .text(candidate.text().trim())
                        .state(itemState.get())
                        .citation(Citation.builder()
                                .userQuote(candidate.userQuote())
                                .timestamp(now)
                                .confidence(candidate.confidence())
                                .source(candidate.source())
                                .build())
                        .archived(false)
                        .createdAt(now)
                        .build();
                added.add(item);
                itemIds.add(item.getId());
            }

            ActivityType type = !itemIds.isEmpty() ? ActivityType.RECORDED
                    : !duplicates.isEmpty() ? ActivityType.DUPLICATE_SUPPRESSED
                    : ActivityType.RECORD_REJECTED;
            event.action(type.getValue());
            if (!itemIds.isEmpty()) {
                event.detail("itemIds", List.copyOf(itemIds));
            }
            if (!duplicates.isEmpty()) {
                event.detail("duplicates", List.copyOf(duplicates));
                log.debug("🔁 Suppressed {} duplicate(s) from {}", duplicates.size(), step.key());
            }
            if (!rejected.isEmpty()) {
                event.detail("rejected", List.copyOf(rejected));
                log.warn("⚠️ Rejected {} invalid candidate(s) from {}: {}", rejected.size(), step.key(), rejected);
            }
            events.add(event.build());
        }

        ProjectState updated = state.withAppended(added);
        if (!added.isEmpty()) {
            log.info("📝 Recorded {} item(s) in project {} (revision {} → {})",
                    added.size(), state.getId(), state.getRevision(), updated.getRevision());
        }
        return new Reconciliation(updated, List.copyOf(events), List.copyOf(added));
    }

    private static List<Candidate> candidates(StepResult result, ReconciliationContext context) {
        List<Candidate> candidates = new ArrayList<>();
        Map<String, Object> metadata = result.getMetadata();

        if (result.isTrue(MetadataKeys.SHOULD_RECORD)) {
            candidates.add(new Candidate(
                    MetadataValues.asString(metadata.get(MetadataKeys.ITEM)),
                    metadata.get(MetadataKeys.STATE),
                    MetadataValues.asDouble(metadata.get(MetadataKeys.CONFIDENCE), DEFAULT_CONFIDENCE),
                    context.getUserMessage(),
                    Citation.SOURCE_CONVERSATION));
        }

        for (Map<String, Object> entry : MetadataValues.asMapList(metadata.get(MetadataKeys.ITEMS_TO_RECORD))) {
            Object quote = entry.get(MetadataKeys.USER_QUOTE);
            candidates.add(new Candidate(
                    MetadataValues.asString(entry.get(MetadataKeys.ITEM)),
                    entry.get(MetadataKeys.STATE),
                    MetadataValues.asDouble(entry.get(MetadataKeys.CONFIDENCE), DEFAULT_CONFIDENCE),
                    quote != null ? quote.toString() : context.getUserMessage(),
                    Citation.SOURCE_REVIEW));
        }
        return candidates;
    }

    private static String notRecordedReason(StepResult result) {
        Object reasoning = result.getMetadata().get(MetadataKeys.REASONING);
        if (result.getMetadata().containsKey(MetadataKeys.SHOULD_RECORD) && reasoning != null) {
            return reasoning.toString();
        }
        return "No recordable output";
    }

    private static String dedupKey(ItemState state, String text) {
        return state.name() + "|" + TextNormalizer.normalize(text);
    }

    private record Candidate(String text, Object state, double confidence, String userQuote, String source) {
    }
}
