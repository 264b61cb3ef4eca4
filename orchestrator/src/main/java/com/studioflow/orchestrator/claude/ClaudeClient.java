package com.studioflow.orchestrator.claude;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.studioflow.orchestrator.agent.AgentMessage;
import com.studioflow.orchestrator.agent.ChatModel;
import com.studioflow.orchestrator.agent.ModelReply;
import com.studioflow.orchestrator.agent.ProviderException;
import com.studioflow.orchestrator.agent.ToolCall;
import com.studioflow.orchestrator.agent.tool.ToolDefinition;
import com.studioflow.orchestrator.model.MessageRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Thin wrapper around the Anthropic Messages API with tool use.
 *
 * Raw HttpClient instead of an SDK: the API is a plain REST endpoint and
 * the exact wire format stays visible when debugging the agent loop.
 *
 * History mapping:
 *   SYSTEM    → top-level "system" string
 *   USER      → {role:user, content:text}
 *   ASSISTANT → {role:assistant, content:[text?, tool_use?]}
 *   TOOL      → {role:user, content:[tool_result]}
 */
@Component
public class ClaudeClient implements ChatModel {

    private static final Logger log = LoggerFactory.getLogger(ClaudeClient.class);

    // -------------------------------------------------------------------------
    // Data records
    // -------------------------------------------------------------------------

    /** The subset of the API response we care about. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MessagesResponse(List<ContentBlock> content, String stopReason) {

        @JsonIgnoreProperties(ignoreUnknown = true)
        public record ContentBlock(String type, String text, String id, String name, JsonNode input) {}

        /** All text blocks joined, or null when the reply is a bare tool call. */
        public String text() {
            String joined = content == null ? "" : content.stream()
                    .filter(b -> "text".equals(b.type()) && b.text() != null)
                    .map(ContentBlock::text)
                    .collect(Collectors.joining("\n"));
            return joined.isBlank() ? null : joined;
        }

        /** The first tool_use block; one tool per reply is all the agent executes. */
        public ToolCall firstToolCall() {
            if (content == null) {
                return null;
            }
            return content.stream()
                    .filter(b -> "tool_use".equals(b.type()))
                    .findFirst()
                    .map(b -> new ToolCall(b.id(), b.name(), b.input()))
                    .orElse(null);
        }
    }

    // -------------------------------------------------------------------------
    // Fields
    // -------------------------------------------------------------------------

    private static final String API_VER = "2023-06-01";

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       apiKey;
    private final URI          endpoint;
    private final String       model;
    private final int          maxTokens;

    public ClaudeClient(@Value("${anthropic.api-key:}") String apiKey,
                        @Value("${anthropic.base-url:https://api.anthropic.com}") String baseUrl,
                        @Value("${studioflow.agent.model:claude-sonnet-4-5}") String model,
                        @Value("${studioflow.agent.max-tokens:4096}") int maxTokens,
                        ObjectMapper objectMapper) {
        this.apiKey    = apiKey;
        this.endpoint  = URI.create(baseUrl.replaceAll("/+$", "") + "/v1/messages");
        this.model     = model;
        this.maxTokens = maxTokens;
        this.json      = objectMapper;
        this.http      = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // -------------------------------------------------------------------------
    // Public API
    // -------------------------------------------------------------------------

    @Override
    public ModelReply complete(List<AgentMessage> history, List<ToolDefinition> tools) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ProviderException("anthropic.api-key is not configured", null);
        }
        try {
            String requestBody = json.writeValueAsString(buildRequest(history, tools));

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(endpoint)
                    .timeout(Duration.ofSeconds(120))
                    .header("content-type",      "application/json")
                    .header("x-api-key",         apiKey)
                    .header("anthropic-version", API_VER)
                    .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                    .build();

            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new ProviderException(response.statusCode(), response.body());
            }

            MessagesResponse parsed = parse(response.body());
            return new ModelReply(parsed.text(), parsed.firstToolCall());

        } catch (ProviderException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException("Claude API call interrupted", e);
        } catch (Exception e) {
            throw new ProviderException("Claude API call failed: " + e.getMessage(), e);
        }
    }

    // -------------------------------------------------------------------------
    // Wire mapping
    // -------------------------------------------------------------------------

    ObjectNode buildRequest(List<AgentMessage> history, List<ToolDefinition> tools) {
        ObjectNode body = json.createObjectNode();
        body.put("model", model);
        body.put("max_tokens", maxTokens);

        String system = history.stream()
                .filter(m -> m.role() == MessageRole.SYSTEM)
                .map(AgentMessage::content)
                .collect(Collectors.joining("\n\n"));
        if (!system.isBlank()) {
            body.put("system", system);
        }

        ArrayNode messages = body.putArray("messages");
        for (AgentMessage m : history) {
            switch (m.role()) {
                case SYSTEM -> { }
                case USER -> messages.addObject()
                        .put("role", "user")
                        .put("content", m.content() == null ? "" : m.content());
                case ASSISTANT -> {
                    ObjectNode msg = messages.addObject().put("role", "assistant");
                    ArrayNode blocks = msg.putArray("content");
                    if (m.content() != null && !m.content().isBlank()) {
                        blocks.addObject().put("type", "text").put("text", m.content());
                    }
                    if (m.toolCall() != null) {
                        ObjectNode use = blocks.addObject()
                                .put("type", "tool_use")
                                .put("id", m.toolCall().id())
                                .put("name", m.toolCall().name());
                        use.set("input", m.toolCall().arguments() != null
                                ? m.toolCall().arguments() : json.createObjectNode());
                    }
                    if (blocks.isEmpty()) {
                        blocks.addObject().put("type", "text").put("text", "(no reply)");
                    }
                }
                case TOOL -> {
                    ObjectNode msg = messages.addObject().put("role", "user");
                    msg.putArray("content").addObject()
                            .put("type", "tool_result")
                            .put("tool_use_id", m.toolCallId())
                            .put("content", m.content() == null ? "" : m.content());
                }
            }
        }

        if (!tools.isEmpty()) {
            ArrayNode toolArray = body.putArray("tools");
            for (ToolDefinition def : tools) {
                ObjectNode t = toolArray.addObject()
                        .put("name", def.name())
                        .put("description", def.description());
                t.set("input_schema", def.inputSchema());
            }
        }
        return body;
    }

    MessagesResponse parse(String body) throws IOException {
        JsonNode root = json.readTree(body);
        JsonNode content = root.path("content");
        List<MessagesResponse.ContentBlock> blocks = !content.isArray() ? List.of() : json.convertValue(content,
                json.getTypeFactory().constructCollectionType(List.class, MessagesResponse.ContentBlock.class));
        String stopReason = root.path("stop_reason").asText(null);
        if ("max_tokens".equals(stopReason)) {
            log.warn("Claude reply truncated at max_tokens={}", maxTokens);
        }
        return new MessagesResponse(blocks, stopReason);
    }
}
