package com.brainstorm.orchestrator.workflow;

/**
 * Agent names, actions and the metadata keys each action documents.
 *
 * Workflow conditions and the reconciler read only these keys.
 */
public final class MetadataKeys {

    private MetadataKeys() {
    }

    public static final class Agents {
        public static final String CONVERSATION = "conversation";
        public static final String GAP_DETECTOR = "gap_detector";
        public static final String CLARIFIER = "clarifier";
        public static final String DECISION_RECORDER = "decision_recorder";
        public static final String CLAIM_VERIFIER = "claim_verifier";
        public static final String ASSUMPTION_SCANNER = "assumption_scanner";
        public static final String CONSISTENCY_CHECKER = "consistency_checker";
        public static final String VERSION_TRACKER = "version_tracker";
        public static final String MODE_MANAGER = "mode_manager";
        public static final String REVIEWER = "reviewer";

        private Agents() {
        }
    }

    public static final class Actions {
        public static final String REFLECT = "reflect";
        public static final String ANALYZE = "analyze";
        public static final String GENERATE_QUESTION = "generateQuestion";
        public static final String RECORD = "record";
        public static final String RECORD_FROM_REVIEW = "recordFromReview";
        public static final String VERIFY = "verify";
        public static final String SCAN = "scan";
        public static final String CHECK_CONSISTENCY = "checkConsistency";
        public static final String TRACK_CHANGE = "trackChange";
        public static final String DETECT_MODE = "detectMode";
        public static final String REVIEW = "review";

        private Actions() {
        }
    }

    // conversation.reflect
    public static final String DETAIL_LEVEL = "detailLevel";
    public static final String SUGGESTION_COUNT = "suggestionCount";
    public static final String IS_CORRECTION = "isCorrection";
    public static final String WAS_RETRIED = "wasRetried";

    // gap_detector.analyze
    public static final String HAS_GAPS = "hasGaps";
    public static final String CRITICAL_COUNT = "criticalCount";
    public static final String GAPS = "gaps";

    // clarifier.generateQuestion
    public static final String AGENT_QUESTIONS = "agentQuestions";
    public static final String MODE = "mode";

    // decision_recorder.record
    public static final String SHOULD_RECORD = "shouldRecord";
    public static final String ITEM = "item";
    public static final String STATE = "state";
    public static final String CONFIDENCE = "confidence";
    public static final String REASONING = "reasoning";
    public static final String NEEDS_CONFIRMATION = "needsConfirmation";

    // decision_recorder.recordFromReview
    public static final String ITEMS_TO_RECORD = "itemsToRecord";
    public static final String ITEM_COUNT = "itemCount";
    public static final String USER_QUOTE = "userQuote";

    // claim_verifier.verify (also CONFIDENCE, REASONING)
    public static final String APPROVED = "approved";
    public static final String ISSUES = "issues";

    // assumption_scanner.scan (also APPROVED)
    public static final String ASSUMPTIONS_DETECTED = "assumptionsDetected";
    public static final String ASSUMPTIONS = "assumptions";

    // consistency_checker.checkConsistency
    public static final String CONFLICT_DETECTED = "conflictDetected";
    public static final String CONFLICTS = "conflicts";
    public static final String RECOMMENDATION = "recommendation";

    // version_tracker.trackChange (also REASONING)
    public static final String VERSION_NUMBER = "versionNumber";
    public static final String CHANGE_TYPE = "changeType";
    public static final String TRIGGERED_BY = "triggeredBy";

    // reviewer.review
    public static final String HAS_FINDINGS = "hasFindings";
    public static final String FINDINGS = "findings";
    public static final String SUMMARY = "summary";
}
