package com.taskchat.controllers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskchat.Main;
import com.taskchat.auth.JwtIdentityProvider;
import com.taskchat.chat.ChatOrchestrator;
import com.taskchat.chat.ScriptedReasoningEngine;
import com.taskchat.chat.TurnSettings;
import com.taskchat.storage.SqliteConversationStore;
import com.taskchat.storage.SqliteDatabase;
import com.taskchat.storage.SqliteTaskStore;
import com.taskchat.tools.TaskTools;
import com.taskchat.tools.ToolExecutor;
import io.javalin.Javalin;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class HttpApiTest {

    private static final String SECRET = "http-api-test-secret-0123456789abcdef";

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient client = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();
    private ExecutorService executor;
    private ScriptedReasoningEngine engine;
    private Javalin app;
    private String aliceToken;
    private String bobToken;

    @BeforeEach
    void setUp() {
        SqliteDatabase database = new SqliteDatabase(tempDir.resolve("api.db"));
        database.initializeSchema();
        SqliteConversationStore conversations = new SqliteConversationStore(database, mapper);
        SqliteTaskStore tasks = new SqliteTaskStore(database);
        ToolExecutor toolExecutor = new ToolExecutor(TaskTools.createRegistry(tasks, mapper), mapper);
        executor = Executors.newCachedThreadPool();
        engine = new ScriptedReasoningEngine();
        ChatOrchestrator orchestrator = new ChatOrchestrator(conversations, toolExecutor, engine,
            TurnSettings.defaults(), executor, mapper);
        JwtIdentityProvider identity = new JwtIdentityProvider(SECRET);
        aliceToken = identity.issueToken("alice", Duration.ofMinutes(10));
        bobToken = identity.issueToken("bob", Duration.ofMinutes(10));

        app = Main.createApp(mapper, List.of(
            new HealthController(database, Main.VERSION),
            new ChatController(identity, orchestrator, conversations, mapper),
            new TaskController(identity, toolExecutor, tasks, mapper)));
        app.start(0);
    }

    @AfterEach
    void tearDown() {
        app.stop();
        executor.shutdownNow();
    }

    private HttpResponse<String> send(String method, String path, String token, String body) throws Exception {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + app.port() + path))
            .timeout(Duration.ofSeconds(10))
            .header("Content-Type", "application/json")
            .method(method, body == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(body));
        if (token != null) {
            builder.header("Authorization", "Bearer " + token);
        }
        return client.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    }

    private JsonNode json(HttpResponse<String> response) throws Exception {
        return mapper.readTree(response.body());
    }

    @Test
    void healthNeedsNoToken() throws Exception {
        HttpResponse<String> response = send("GET", "/api/health", null, null);
        assertEquals(200, response.statusCode());
        assertEquals("ok", json(response).get("status").asText());
        assertEquals(Main.VERSION, json(response).get("version").asText());
    }

    @Test
    void requestsWithoutValidTokenAreUnauthorized() throws Exception {
        HttpResponse<String> missing = send("GET", "/api/tasks", null, null);
        assertEquals(401, missing.statusCode());
        assertEquals("Unauthorized", json(missing).get("errorKind").asText());

        assertEquals(401, send("POST", "/api/chat", "garbage", "{\"message\":\"hi\"}").statusCode());
        assertTrue(engine.getRequests().isEmpty());
    }

    @Test
    void taskLifecycleOverRest() throws Exception {
        HttpResponse<String> created = send("POST", "/api/tasks", aliceToken,
            "{\"title\":\"Write report\",\"priority\":\"high\"}");
        assertEquals(201, created.statusCode());
        String id = json(created).get("id").asText();

        HttpResponse<String> fetched = send("GET", "/api/tasks/" + id, aliceToken, null);
        assertEquals(200, fetched.statusCode());
        assertEquals("Write report", json(fetched).get("title").asText());

        HttpResponse<String> updated = send("PUT", "/api/tasks/" + id, aliceToken, "{\"title\":\"Send report\"}");
        assertEquals(200, updated.statusCode());
        assertEquals("Send report", json(updated).get("title").asText());

        HttpResponse<String> completed = send("PATCH", "/api/tasks/" + id + "/status", aliceToken,
            "{\"status\":\"completed\"}");
        assertEquals("completed", json(completed).get("status").asText());

        HttpResponse<String> listed = send("GET", "/api/tasks?status=completed", aliceToken, null);
        assertEquals(1, json(listed).get("count").asInt());

        assertEquals(200, send("DELETE", "/api/tasks/" + id, aliceToken, null).statusCode());
        assertEquals(404, send("GET", "/api/tasks/" + id, aliceToken, null).statusCode());
    }

    @Test
    void invalidTaskInputIsBadRequest() throws Exception {
        HttpResponse<String> blank = send("POST", "/api/tasks", aliceToken, "{\"title\":\"\"}");
        assertEquals(400, blank.statusCode());
        assertEquals("ValidationError", json(blank).get("errorKind").asText());

        assertEquals(400, send("POST", "/api/tasks", aliceToken, "not json").statusCode());
        assertEquals(400, send("GET", "/api/tasks?limit=abc", aliceToken, null).statusCode());
        assertEquals(400, send("GET", "/api/tasks?status=archived", aliceToken, null).statusCode());
    }

    @Test
    void otherOwnersTasksLookMissing() throws Exception {
        String id = json(send("POST", "/api/tasks", aliceToken, "{\"title\":\"Secret\"}")).get("id").asText();

        HttpResponse<String> peek = send("GET", "/api/tasks/" + id, bobToken, null);
        assertEquals(404, peek.statusCode());
        assertEquals("NotFoundError", json(peek).get("errorKind").asText());
        assertEquals(404, send("DELETE", "/api/tasks/" + id, bobToken, null).statusCode());
        assertEquals(404, send("PATCH", "/api/tasks/" + id + "/status", bobToken,
            "{\"status\":\"completed\"}").statusCode());
        assertEquals(0, json(send("GET", "/api/tasks", bobToken, null)).get("count").asInt());
        assertEquals("pending", json(send("GET", "/api/tasks/" + id, aliceToken, null)).get("status").asText());
    }

    @Test
    void chatTurnCreatesTaskAndHistory() throws Exception {
        engine.thenCall("createTask", "{\"title\":\"Buy milk\"}").thenReply("Added Buy milk.");

        HttpResponse<String> turn = send("POST", "/api/chat", aliceToken,
            "{\"message\":\"create a task called Buy milk\"}");
        assertEquals(200, turn.statusCode());
        JsonNode body = json(turn);
        assertEquals("Added Buy milk.", body.get("response").asText());
        assertFalse(body.get("fallback").asBoolean());
        assertEquals("createTask", body.get("toolInvocations").get(0).get("tool").asText());
        String conversationId = body.get("conversationId").asText();

        JsonNode tasks = json(send("GET", "/api/tasks?status=pending", aliceToken, null));
        assertEquals(1, tasks.get("count").asInt());
        assertEquals("Buy milk", tasks.get("tasks").get(0).get("title").asText());

        JsonNode history = json(send("GET", "/api/conversations/" + conversationId + "/messages", aliceToken, null));
        assertEquals(2, history.get("count").asInt());
        assertEquals(404, send("GET", "/api/conversations/" + conversationId + "/messages", bobToken, null)
            .statusCode());

        JsonNode conversations = json(send("GET", "/api/conversations", aliceToken, null));
        assertEquals(1, conversations.get("count").asInt());
    }

    @Test
    void chatFallbackIsStillOk() throws Exception {
        engine.thenFail();
        HttpResponse<String> turn = send("POST", "/api/chat", aliceToken, "{\"message\":\"hello\"}");
        assertEquals(200, turn.statusCode());
        assertTrue(json(turn).get("fallback").asBoolean());
        assertEquals("ReasoningUnavailableError", json(turn).get("fallbackKind").asText());
    }

    @Test
    void chatErrorsUseErrorBody() throws Exception {
        HttpResponse<String> empty = send("POST", "/api/chat", aliceToken, "{\"message\":\"  \"}");
        assertEquals(400, empty.statusCode());
        assertEquals("ValidationError", json(empty).get("errorKind").asText());
        assertEquals("Message cannot be empty", json(empty).get("detail").asText());

        String foreign = json(send("POST", "/api/conversations", bobToken, "{\"title\":\"Bob's\"}"))
            .get("id").asText();
        HttpResponse<String> hijack = send("POST", "/api/chat", aliceToken,
            "{\"conversationId\":\"" + foreign + "\",\"message\":\"hi\"}");
        assertEquals(404, hijack.statusCode());
        assertEquals("NotFoundError", json(hijack).get("errorKind").asText());
    }
}
