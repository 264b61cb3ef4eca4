package com.studioflow.orchestrator.service;

public record RateLimitDecision(boolean allowed, String message) {

    private static final RateLimitDecision ALLOWED = new RateLimitDecision(true, null);

    public static RateLimitDecision allow() {
        return ALLOWED;
    }

    public static RateLimitDecision deny(String message) {
        return new RateLimitDecision(false, message);
    }
}
