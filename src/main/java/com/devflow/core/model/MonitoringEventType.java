package com.devflow.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Closed catalog of monitoring event kinds, each bound to the payload record it carries.
 */
public enum MonitoringEventType {

    // File system
    FILE_CHANGE(FileChangePayload.class),

    // Git
    GIT_STATE_CHANGE(GitStatePayload.class),
    COMMIT_CREATED(NotePayload.class),
    BRANCH_CREATED(NotePayload.class),
    BRANCH_SWITCHED(NotePayload.class),

    // Development progress
    FEATURE_START(ConversationPayload.class),
    FEATURE_COMPLETE(ConversationPayload.class),
    BUG_FOUND(ConversationPayload.class),
    BUG_FIXED(ConversationPayload.class),
    TESTS_ADDED(ConversationPayload.class),
    TESTS_PASSING(ConversationPayload.class),
    TESTS_FAILING(ConversationPayload.class),
    REFACTOR_COMPLETE(ConversationPayload.class),
    DOCS_UPDATED(ConversationPayload.class),

    // Milestones
    READY_FOR_RELEASE(ConversationPayload.class),
    DEPLOYMENT_READY(ConversationPayload.class),
    MILESTONE_REACHED(ConversationPayload.class),
    BLOCKED(ConversationPayload.class),

    // Conversation
    FILES_MENTIONED(FilesMentionedPayload.class),
    COMMAND_EXECUTED(NotePayload.class),
    ERROR_DISCUSSED(NotePayload.class),

    // LLM automation
    LLM_DECISION_REQUESTED(DecisionPayload.class),
    LLM_DECISION_MADE(DecisionPayload.class),
    LLM_ACTION_EXECUTED(DecisionPayload.class),
    LLM_ACTION_FAILED(DecisionPayload.class),
    LLM_APPROVAL_REQUIRED(DecisionPayload.class),
    LLM_FEEDBACK_RECEIVED(DecisionPayload.class);

    private static final Set<MonitoringEventType> LLM_TYPES = EnumSet.of(
            LLM_DECISION_REQUESTED, LLM_DECISION_MADE, LLM_ACTION_EXECUTED,
            LLM_ACTION_FAILED, LLM_APPROVAL_REQUIRED, LLM_FEEDBACK_RECEIVED);

    private final Class<? extends EventPayload> payloadType;

    MonitoringEventType(Class<? extends EventPayload> payloadType) {
        this.payloadType = payloadType;
    }

    public Class<? extends EventPayload> payloadType() {
        return payloadType;
    }

    /** True for events produced by the decision loop itself. */
    public boolean isLlmEvent() {
        return LLM_TYPES.contains(this);
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
