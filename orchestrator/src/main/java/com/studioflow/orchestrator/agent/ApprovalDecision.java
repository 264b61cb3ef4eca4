package com.studioflow.orchestrator.agent;

/** The user's answer to a {@link PendingAction}; reason is optional and only used on rejection. */
public record ApprovalDecision(boolean approved, String reason) {}
