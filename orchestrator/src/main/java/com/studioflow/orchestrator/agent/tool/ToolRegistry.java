package com.studioflow.orchestrator.agent.tool;

import com.fasterxml.jackson.databind.JsonNode;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process tool registry.
 *
 * All {@link AgentTool} beans are collected at startup via constructor
 * injection.
 *
 * <p>Key responsibilities:
 * <ol>
 *   <li>Lookup by name ({@link #find}).</li>
 *   <li>The catalogue bound to every model call ({@link #definitions}).</li>
 *   <li>Metrics-instrumented execution ({@link #execute}); every call is
 *       timed and counted, with no per-tool boilerplate.</li>
 * </ol>
 */
@Component
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<String, AgentTool> tools = new ConcurrentHashMap<>();
    private final MeterRegistry meterRegistry;

    public ToolRegistry(List<AgentTool> allTools, MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        for (AgentTool tool : allTools) {
            ToolDefinition def = tool.definition();
            tools.put(def.name(), tool);
            log.info("Registered tool '{}' [{}{}]", def.name(), def.category().wireName(),
                    def.requiresConfirmation() ? ", confirmation" : "");
        }
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public Optional<ToolDefinition> find(String name) {
        return Optional.ofNullable(tools.get(name)).map(AgentTool::definition);
    }

    /** Every registered tool, sorted by name so the model sees a stable catalogue. */
    public List<ToolDefinition> definitions() {
        return tools.values().stream()
                .map(AgentTool::definition)
                .sorted(Comparator.comparing(ToolDefinition::name))
                .toList();
    }

    // ------------------------------------------------------------------
    // Metrics-instrumented execution
    // ------------------------------------------------------------------

    /**
     * Execute a named tool.
     *
     * <pre>
     *   studioflow.tool.calls{tool, status="success|failure|error"}
     *   studioflow.tool.duration{tool}
     * </pre>
     *
     * @throws UnknownToolException   if no tool has this name
     * @throws ToolExecutionException if the tool threw
     */
    public ToolResult execute(String name, JsonNode arguments, ToolInvocation invocation) {
        AgentTool tool = tools.get(name);
        if (tool == null) {
            throw new UnknownToolException(name);
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            ToolResult result = tool.execute(arguments, invocation);
            if (!result.success()) {
                status = "failure";
            }
            return result;
        } catch (ToolExecutionException e) {
            status = "error";
            throw e;
        } catch (Exception e) {
            status = "error";
            throw new ToolExecutionException(
                    "Unexpected error in tool '" + name + "': " + e.getMessage(), e);
        } finally {
            sample.stop(meterRegistry.timer("studioflow.tool.duration", "tool", name));
            meterRegistry.counter("studioflow.tool.calls", "tool", name, "status", status).increment();
        }
    }
}
