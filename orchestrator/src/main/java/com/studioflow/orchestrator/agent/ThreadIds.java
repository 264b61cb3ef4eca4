package com.studioflow.orchestrator.agent;

/**
 * Thread ids are {@code projectId + "_" + conversationId}.
 *
 * Project ids never contain '_', so the first separator splits the two
 * halves even when a conversation id does.
 */
public final class ThreadIds {

    private static final char SEPARATOR = '_';

    private ThreadIds() {}

    public static String of(String projectId, String conversationId) {
        if (projectId == null || projectId.isBlank() || projectId.indexOf(SEPARATOR) >= 0) {
            throw new IllegalArgumentException("Invalid project id: " + projectId);
        }
        if (conversationId == null || conversationId.isBlank()) {
            throw new IllegalArgumentException("Conversation id is required");
        }
        return projectId + SEPARATOR + conversationId;
    }

    public static String projectId(String threadId) {
        return split(threadId)[0];
    }

    public static String conversationId(String threadId) {
        return split(threadId)[1];
    }

    private static String[] split(String threadId) {
        int at = threadId == null ? -1 : threadId.indexOf(SEPARATOR);
        if (at <= 0 || at == threadId.length() - 1) {
            throw new IllegalArgumentException("Malformed thread id: " + threadId);
        }
        return new String[]{threadId.substring(0, at), threadId.substring(at + 1)};
    }
}
