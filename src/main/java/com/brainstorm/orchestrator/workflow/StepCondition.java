package com.brainstorm.orchestrator.workflow;

import com.brainstorm.orchestrator.workflow.state.PriorResults;
import com.brainstorm.orchestrator.workflow.state.StepResult;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Gate on a workflow step, evaluated against the results of all earlier
 * phases.
 *
 * A condition must declare every metadata key it reads so the
 * {@link WorkflowRegistry} can reject conditions that no earlier step can
 * ever satisfy.
 */
public interface StepCondition {

    Set<MetadataRef> references();

    boolean test(List<StepResult> priorResults);

    String describe();

    static StepCondition isTrue(String agentName, String key) {
        return of(MetadataRef.of(agentName, key), Boolean.TRUE::equals, "== true");
    }

    static StepCondition isFalse(String agentName, String key) {
        return of(MetadataRef.of(agentName, key), Boolean.FALSE::equals, "== false");
    }

    static StepCondition isNotEmpty(String agentName, String key) {
        return of(MetadataRef.of(agentName, key), StepCondition::notEmpty, "is not empty");
    }

    static StepCondition anyOf(StepCondition... conditions) {
        return composite(Arrays.asList(conditions), true);
    }

    static StepCondition allOf(StepCondition... conditions) {
        return composite(Arrays.asList(conditions), false);
    }

    /**
     * Condition on the value of one metadata key taken from the latest prior
     * result that carries it. A missing value never matches.
     */
    static StepCondition of(MetadataRef ref, Predicate<Object> predicate, String description) {
        return new StepCondition() {
            @Override
            public Set<MetadataRef> references() {
                return Set.of(ref);
            }

            @Override
            public boolean test(List<StepResult> priorResults) {
                return PriorResults.latest(priorResults, ref.getAgentName(), ref.getKey()).filter(predicate).isPresent();
            }

            @Override
            public String describe() {
                return ref + " " + description;
            }

            @Override
            public String toString() {
                return describe();
            }
        };
    }

    private static boolean notEmpty(Object value) {
        if (value instanceof Collection<?> collection) {
            return !collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return !map.isEmpty();
        }
        if (value instanceof String text) {
            return !text.isBlank();
        }
        return true;
    }

    private static StepCondition composite(List<StepCondition> parts, boolean any) {
        Set<MetadataRef> refs = new LinkedHashSet<>();
        parts.forEach(part -> refs.addAll(part.references()));
        String joiner = any ? " || " : " && ";
        String description = String.join(joiner, parts.stream().map(StepCondition::describe).toList());
        return new StepCondition() {
            @Override
            public Set<MetadataRef> references() {
                return Set.copyOf(refs);
            }

            @Override
            public boolean test(List<StepResult> priorResults) {
                return any
                        ? parts.stream().anyMatch(part -> part.test(priorResults))
                        : parts.stream().allMatch(part -> part.test(priorResults));
            }

            @Override
            public String describe() {
                return "(" + description + ")";
            }

            @Override
            public String toString() {
                return describe();
            }
        };
    }
}
