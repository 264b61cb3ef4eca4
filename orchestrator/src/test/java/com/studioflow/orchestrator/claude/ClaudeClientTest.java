package com.studioflow.orchestrator.claude;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.studioflow.orchestrator.agent.AgentMessage;
import com.studioflow.orchestrator.agent.ModelReply;
import com.studioflow.orchestrator.agent.ProviderException;
import com.studioflow.orchestrator.agent.ToolCall;
import com.studioflow.orchestrator.agent.tool.ToolCategory;
import com.studioflow.orchestrator.agent.tool.ToolDefinition;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Wire mapping of the Messages API client. The HTTP tests run against a
 * JDK HttpServer on a random local port.
 */
class ClaudeClientTest {

    final ObjectMapper objectMapper = new ObjectMapper();
    HttpServer server;

    @AfterEach
    void stopServer() {
        if (server != null) {
            server.stop(0);
        }
    }

    private ClaudeClient client(String baseUrl, String apiKey) {
        return new ClaudeClient(apiKey, baseUrl, "claude-test", 1024, objectMapper);
    }

    private String startServer(int status, String body, AtomicReference<String> received) throws Exception {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/v1/messages", exchange -> {
            received.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8)
                    + "|" + exchange.getRequestHeaders().getFirst("x-api-key"));
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("content-type", "application/json");
            exchange.sendResponseHeaders(status, bytes.length);
            exchange.getResponseBody().write(bytes);
            exchange.close();
        });
        server.start();
        return "http://127.0.0.1:" + server.getAddress().getPort();
    }

    // ------------------------------------------------------------------
    // buildRequest()
    // ------------------------------------------------------------------

    @Test
    void buildRequest_mapsHistoryToMessagesApiShape() throws Exception {
        ToolCall call = new ToolCall("toolu_1", "query_jobs", objectMapper.readTree("{\"status\":\"active\"}"));
        List<AgentMessage> history = List.of(
                AgentMessage.system("be brief"),
                AgentMessage.user("what is running?"),
                AgentMessage.assistant("Checking.", call),
                AgentMessage.tool("toolu_1", "{\"success\":true}"));
        ToolDefinition def = new ToolDefinition("query_jobs", "Query jobs", "List jobs", ToolCategory.READ,
                false, objectMapper.readTree("{\"type\":\"object\"}"));

        JsonNode body = client("http://unused", "k").buildRequest(history, List.of(def));

        assertThat(body.path("model").asText()).isEqualTo("claude-test");
        assertThat(body.path("max_tokens").asInt()).isEqualTo(1024);
        assertThat(body.path("system").asText()).isEqualTo("be brief");

        JsonNode messages = body.path("messages");
        assertThat(messages.size()).isEqualTo(3);
        assertThat(messages.get(0).path("role").asText()).isEqualTo("user");
        assertThat(messages.get(1).path("content").get(0).path("text").asText()).isEqualTo("Checking.");
        JsonNode toolUse = messages.get(1).path("content").get(1);
        assertThat(toolUse.path("type").asText()).isEqualTo("tool_use");
        assertThat(toolUse.path("id").asText()).isEqualTo("toolu_1");
        assertThat(toolUse.path("input").path("status").asText()).isEqualTo("active");
        JsonNode toolResult = messages.get(2).path("content").get(0);
        assertThat(messages.get(2).path("role").asText()).isEqualTo("user");
        assertThat(toolResult.path("type").asText()).isEqualTo("tool_result");
        assertThat(toolResult.path("tool_use_id").asText()).isEqualTo("toolu_1");

        assertThat(body.path("tools").get(0).path("name").asText()).isEqualTo("query_jobs");
        assertThat(body.path("tools").get(0).path("input_schema").path("type").asText()).isEqualTo("object");
    }

    @Test
    void buildRequest_noTools_omitsToolsArray() {
        JsonNode body = client("http://unused", "k").buildRequest(List.of(AgentMessage.user("hi")), List.of());

        assertThat(body.has("tools")).isFalse();
        assertThat(body.has("system")).isFalse();
    }

    // ------------------------------------------------------------------
    // parse()
    // ------------------------------------------------------------------

    @Test
    void parse_textAndToolUse() throws Exception {
        ClaudeClient.MessagesResponse parsed = client("http://unused", "k").parse("""
                {"id":"msg_1","stop_reason":"tool_use","content":[
                  {"type":"text","text":"Let me check."},
                  {"type":"tool_use","id":"toolu_9","name":"query_jobs","input":{"limit":5}}
                ]}
                """);

        assertThat(parsed.text()).isEqualTo("Let me check.");
        assertThat(parsed.stopReason()).isEqualTo("tool_use");
        ToolCall call = parsed.firstToolCall();
        assertThat(call.id()).isEqualTo("toolu_9");
        assertThat(call.name()).isEqualTo("query_jobs");
        assertThat(call.arguments().path("limit").asInt()).isEqualTo(5);
    }

    @Test
    void parse_bareToolCall_hasNullText() throws Exception {
        ClaudeClient.MessagesResponse parsed = client("http://unused", "k").parse("""
                {"content":[{"type":"tool_use","id":"t","name":"cancel_job","input":{}}]}
                """);

        assertThat(parsed.text()).isNull();
        assertThat(parsed.firstToolCall()).isNotNull();
    }

    // ------------------------------------------------------------------
    // complete()
    // ------------------------------------------------------------------

    @Test
    void complete_success_returnsReplyAndSendsKey() throws Exception {
        AtomicReference<String> received = new AtomicReference<>();
        String base = startServer(200, """
                {"content":[{"type":"text","text":"Hello!"}],"stop_reason":"end_turn"}
                """, received);

        ModelReply reply = client(base, "sk-test").complete(List.of(AgentMessage.user("hi")), List.of());

        assertThat(reply.content()).isEqualTo("Hello!");
        assertThat(reply.toolCall()).isNull();
        assertThat(received.get()).contains("\"model\":\"claude-test\"").endsWith("|sk-test");
    }

    @Test
    void complete_non200_throwsProviderExceptionWithStatus() throws Exception {
        String base = startServer(529, "{\"type\":\"error\",\"error\":{\"type\":\"overloaded_error\"}}",
                new AtomicReference<>());

        assertThatThrownBy(() -> client(base, "sk-test").complete(List.of(AgentMessage.user("hi")), List.of()))
                .isInstanceOf(ProviderException.class)
                .satisfies(e -> assertThat(((ProviderException) e).statusCode()).isEqualTo(529));
    }

    @Test
    void complete_missingKey_failsWithoutCalling() {
        assertThatThrownBy(() -> client("http://127.0.0.1:1", "").complete(List.of(AgentMessage.user("hi")), List.of()))
                .isInstanceOf(ProviderException.class)
                .hasMessageContaining("api-key");
    }
}
