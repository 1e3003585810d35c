package com.brainstorm.orchestrator.workflow;

import com.brainstorm.orchestrator.exception.ConfigException;
import lombok.NonNull;
import lombok.Value;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Declarative pipeline bound to one intent.
 *
 * Phases are derived from the declared steps: an ungrouped step is a phase of
 * its own, and contiguous steps sharing a parallel group form one concurrent
 * phase.
 */
@Value
public class WorkflowDefinition {

    @NonNull
    Intent intent;

    @NonNull
    List<StepSpec> steps;

    public WorkflowDefinition(@NonNull Intent intent, @NonNull List<StepSpec> steps) {
        this.intent = intent;
        this.steps = List.copyOf(steps);
    }

    /**
     * @throws ConfigException when a group tag reappears after a different phase
     */
    public List<WorkflowPhase> phases() {
        List<WorkflowPhase> phases = new ArrayList<>();
        Set<String> closedGroups = new HashSet<>();
        List<StepSpec> current = new ArrayList<>();
        String currentGroup = null;

        for (StepSpec step : steps) {
            String group = step.getParallelGroup();
            boolean continuesGroup = group != null && group.equals(currentGroup);
            if (!continuesGroup && !current.isEmpty()) {
                phases.add(new WorkflowPhase(phases.size(), List.copyOf(current), currentGroup));
                if (currentGroup != null) {
                    closedGroups.add(currentGroup);
                }
                current.clear();
            }
            if (group != null && !continuesGroup && closedGroups.contains(group)) {
                throw new ConfigException("Parallel group '" + group + "' is not contiguous in workflow " + intent, intent);
            }
            current.add(step);
            currentGroup = group;
        }
        if (!current.isEmpty()) {
            phases.add(new WorkflowPhase(phases.size(), List.copyOf(current), currentGroup));
        }
        return phases;
    }

    public static Builder forIntent(Intent intent) {
        return new Builder(intent);
    }

    public static class Builder {

        private final Intent intent;
        private final List<StepSpec> steps = new ArrayList<>();
        private int groupCounter;

        private Builder(Intent intent) {
            this.intent = Objects.requireNonNull(intent, "intent");
        }

        public Builder then(StepSpec step) {
            steps.add(step);
            return this;
        }

        /**
         * Adds the given steps as one concurrent phase under a generated group tag.
         */
        public Builder parallel(StepSpec... group) {
            String tag = intent.name().toLowerCase() + "-parallel-" + (++groupCounter);
            for (StepSpec step : group) {
                steps.add(step.inGroup(tag));
            }
            return this;
        }

        public WorkflowDefinition build() {
            return new WorkflowDefinition(intent, steps);
        }
    }
}
