package com.studioflow.orchestrator.agent.tool;

/**
 * A tool could not do its job. Caught at the execute-tool node and turned
 * into a failed tool message so the model can react to it.
 */
public class ToolExecutionException extends RuntimeException {

    public ToolExecutionException(String message) {
        super(message);
    }

    public ToolExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
