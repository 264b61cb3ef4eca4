package com.studioflow.orchestrator.agent;

import com.studioflow.orchestrator.agent.tool.ToolDefinition;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/** ChatModel that plays back queued replies (or failures) and records every history it saw. */
class ScriptedChatModel implements ChatModel {

    private final Deque<Object> script = new ArrayDeque<>();
    final List<List<AgentMessage>> histories = new ArrayList<>();

    ScriptedChatModel reply(String content) {
        script.add(new ModelReply(content, null));
        return this;
    }

    ScriptedChatModel call(String content, ToolCall toolCall) {
        script.add(new ModelReply(content, toolCall));
        return this;
    }

    ScriptedChatModel fail(RuntimeException e) {
        script.add(e);
        return this;
    }

    @Override
    public ModelReply complete(List<AgentMessage> history, List<ToolDefinition> tools) {
        histories.add(List.copyOf(history));
        Object next = script.poll();
        if (next == null) {
            throw new AssertionError("Model called more often than scripted");
        }
        if (next instanceof RuntimeException) {
            throw (RuntimeException) next;
        }
        return (ModelReply) next;
    }

    int calls() {
        return histories.size();
    }
}
