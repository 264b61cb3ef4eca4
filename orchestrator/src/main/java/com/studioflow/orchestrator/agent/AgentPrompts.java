package com.studioflow.orchestrator.agent;

import org.springframework.stereotype.Component;

/**
 * System prompt for the studio assistant.
 *
 * Tools are bound to each model call as functions, so the prompt only
 * describes behaviour; {{CONTEXT}} is replaced by what the context
 * collector found for the current turn.
 */
@Component
public class AgentPrompts {

    public String system(String contextBlock) {
        return SYSTEM_PROMPT.replace("{{CONTEXT}}", contextBlock);
    }

    private static final String SYSTEM_PROMPT = """
            You are the StudioFlow assistant. You help the user produce short videos by
            generating images and clips and exporting the finished project.

            RULES:
              - Call at most one tool per reply and wait for its result.
              - Generation, export and cancellation need the user's approval; explain in one
                sentence what you are about to do before calling such a tool.
              - If the user rejects an action, do not retry it unless they ask again.
              - Work that creates a job runs in the background; tell the user it was queued
                rather than claiming it is finished.
              - When the request is done, answer without calling a tool.

            CURRENT CONTEXT:
            {{CONTEXT}}
            """;
}
