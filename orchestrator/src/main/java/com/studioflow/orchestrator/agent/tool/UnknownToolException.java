package com.studioflow.orchestrator.agent.tool;

public class UnknownToolException extends ToolExecutionException {

    public UnknownToolException(String name) {
        super("Unknown tool: " + name);
    }
}
