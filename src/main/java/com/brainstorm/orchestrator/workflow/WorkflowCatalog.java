package com.brainstorm.orchestrator.workflow;

import com.brainstorm.orchestrator.workflow.MetadataKeys.Actions;
import com.brainstorm.orchestrator.workflow.MetadataKeys.Agents;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

import static com.brainstorm.orchestrator.workflow.StepSpec.step;

/**
 * Default workflow table, registered at startup. An invalid entry fails the
 * application context.
 *
 * UPLOADING has no workflow: upload turns take the fallback path.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WorkflowCatalog {

    private final WorkflowRegistry registry;

    @PostConstruct
    public void registerDefaults() {
        defaults().forEach(registry::register);
        log.info("🗺️ Registered {} workflows: {}", registry.registeredIntents().size(), registry.registeredIntents());
    }

    static List<WorkflowDefinition> defaults() {
        StepSpec reflect = step(Agents.CONVERSATION, Actions.REFLECT);
        StepSpec record = step(Agents.DECISION_RECORDER, Actions.RECORD);
        StepSpec clarify = step(Agents.CLARIFIER, Actions.GENERATE_QUESTION);
        StepSpec verify = step(Agents.CLAIM_VERIFIER, Actions.VERIFY);
        StepSpec consistency = step(Agents.CONSISTENCY_CHECKER, Actions.CHECK_CONSISTENCY);
        StepSpec trackChange = step(Agents.VERSION_TRACKER, Actions.TRACK_CHANGE);

        return List.of(
                WorkflowDefinition.forIntent(Intent.BRAINSTORMING)
                        .parallel(reflect, step(Agents.GAP_DETECTOR, Actions.ANALYZE))
                        .then(record)
                        .then(clarify.when(StepCondition.isTrue(Agents.GAP_DETECTOR, MetadataKeys.HAS_GAPS)))
                        .build(),

                // Recording never waits on verification; the checks run after it and only advise
                WorkflowDefinition.forIntent(Intent.DECIDING)
                        .parallel(reflect, step(Agents.MODE_MANAGER, Actions.DETECT_MODE))
                        .then(record)
                        .parallel(verify, step(Agents.ASSUMPTION_SCANNER, Actions.SCAN), consistency)
                        .then(trackChange)
                        .build(),

                WorkflowDefinition.forIntent(Intent.MODIFYING)
                        .then(reflect)
                        .parallel(verify, consistency)
                        .then(record)
                        .then(trackChange)
                        .then(clarify.when(StepCondition.isTrue(Agents.CONSISTENCY_CHECKER, MetadataKeys.CONFLICT_DETECTED)))
                        .build(),

                WorkflowDefinition.forIntent(Intent.EXPLORING)
                        .parallel(reflect, clarify)
                        .then(record)
                        .build(),

                WorkflowDefinition.forIntent(Intent.PARKING)
                        .parallel(reflect, record)
                        .build(),

                WorkflowDefinition.forIntent(Intent.ASKING)
                        .then(reflect)
                        .build(),

                WorkflowDefinition.forIntent(Intent.REVIEWING)
                        .then(step(Agents.REVIEWER, Actions.REVIEW))
                        .then(step(Agents.DECISION_RECORDER, Actions.RECORD_FROM_REVIEW)
                                .when(StepCondition.isTrue(Agents.REVIEWER, MetadataKeys.HAS_FINDINGS)))
                        .build(),

                WorkflowDefinition.forIntent(Intent.GENERAL)
                        .then(reflect)
                        .then(record)
                        .build(),

                WorkflowDefinition.forIntent(Intent.UNRESOLVED)
                        .then(reflect)
                        .build()
        );
    }
}
