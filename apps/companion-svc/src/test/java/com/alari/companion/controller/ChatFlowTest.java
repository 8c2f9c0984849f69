package com.alari.companion.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class ChatFlowTest {

    private static HttpServer inference;
    private static volatile boolean failing;
    private static final List<String> receivedBodies = new CopyOnWriteArrayList<>();
    private static final List<String> receivedKeys = new CopyOnWriteArrayList<>();

    @Autowired
    MockMvc mockMvc;

    @Autowired
    ObjectMapper objectMapper;

    @DynamicPropertySource
    static void inferenceProperties(DynamicPropertyRegistry registry) throws IOException {
        inference = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        inference.createContext("/inference/chat", ChatFlowTest::handleChat);
        inference.createContext("/inference/chat/stream", ChatFlowTest::handleStream);
        inference.setExecutor(Executors.newCachedThreadPool());
        inference.start();
        registry.add("alari.inference.base-url", () -> "http://127.0.0.1:" + inference.getAddress().getPort());
    }

    @AfterAll
    static void stopInference() {
        if (inference != null) {
            inference.stop(0);
        }
    }

    @BeforeEach
    void reset() {
        failing = false;
        receivedBodies.clear();
        receivedKeys.clear();
    }

    private static void record(HttpExchange exchange) throws IOException {
        receivedKeys.add(exchange.getRequestHeaders().getFirst("X-API-Key"));
        receivedBodies.add(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
    }

    private static void handleChat(HttpExchange exchange) throws IOException {
        record(exchange);
        if (failing) {
            exchange.sendResponseHeaders(500, -1);
            exchange.close();
            return;
        }
        byte[] body = "{\"response\":\"Hello!\",\"usage\":{\"prompt_tokens\":12,\"completion_tokens\":2}}"
                .getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(200, body.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
        }
    }

    private static void handleStream(HttpExchange exchange) throws IOException {
        record(exchange);
        if (failing) {
            exchange.sendResponseHeaders(503, -1);
            exchange.close();
            return;
        }
        exchange.getResponseHeaders().add("Content-Type", "text/plain; charset=utf-8");
        exchange.sendResponseHeaders(200, 0);
        try (OutputStream out = exchange.getResponseBody()) {
            for (String chunk : List.of("Hel", "lo", " there")) {
                out.write(chunk.getBytes(StandardCharsets.UTF_8));
                out.flush();
            }
        }
    }

    private String tokenForNewUser() throws Exception {
        String email = "chat-" + UUID.randomUUID() + "@example.com";
        mockMvc.perform(post("/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"" + email + "\",\"password\":\"longenough\"}"))
                .andExpect(status().isCreated());
        MvcResult login = mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .param("username", email)
                        .param("password", "longenough"))
                .andExpect(status().isOk())
                .andReturn();
        return "Bearer " + json(login).get("access_token").asText();
    }

    private String newConversation(String bearer) throws Exception {
        MvcResult created = mockMvc.perform(post("/conversations")
                        .header(HttpHeaders.AUTHORIZATION, bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"Check-in\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.message_count").value(1))
                .andReturn();
        return json(created).get("session_id").asText();
    }

    private JsonNode history(String bearer, String sessionId) throws Exception {
        MvcResult result = mockMvc.perform(get("/conversations/{id}/messages", sessionId)
                        .header(HttpHeaders.AUTHORIZATION, bearer))
                .andExpect(status().isOk())
                .andReturn();
        return json(result);
    }

    private JsonNode json(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString(StandardCharsets.UTF_8));
    }

    @Test
    void bufferedTurnStoresUtteranceAndReply() throws Exception {
        String bearer = tokenForNewUser();
        String sessionId = newConversation(bearer);

        mockMvc.perform(post("/chat/{id}", sessionId)
                        .header(HttpHeaders.AUTHORIZATION, bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"Hi\",\"max_tokens\":64}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.session_id").value(sessionId))
                .andExpect(jsonPath("$.user_message.content").value("Hi"))
                .andExpect(jsonPath("$.assistant_message.role").value("assistant"))
                .andExpect(jsonPath("$.assistant_message.content").value("Hello!"))
                .andExpect(jsonPath("$.usage.completion_tokens").value(2));

        JsonNode messages = history(bearer, sessionId);
        assertThat(messages).hasSize(3);
        assertThat(messages.get(0).get("role").asText()).isEqualTo("system");
        assertThat(messages.get(1).get("content").asText()).isEqualTo("Hi");
        assertThat(messages.get(2).get("content").asText()).isEqualTo("Hello!");

        JsonNode sent = objectMapper.readTree(receivedBodies.get(0));
        assertThat(sent.get("max_tokens").asInt()).isEqualTo(64);
        assertThat(sent.get("temperature").asDouble()).isEqualTo(0.7);
        assertThat(sent.get("messages")).hasSize(2);
        assertThat(sent.get("messages").get(1).get("content").asText()).isEqualTo("Hi");
        assertThat(receivedKeys).containsExactly("test-inference-key");
    }

    @Test
    void upstreamFailureLeavesHistoryUntouched() throws Exception {
        String bearer = tokenForNewUser();
        String sessionId = newConversation(bearer);
        failing = true;

        mockMvc.perform(post("/chat/{id}", sessionId)
                        .header(HttpHeaders.AUTHORIZATION, bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"Hi\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("UPSTREAM_PROTOCOL_ERROR"));

        assertThat(history(bearer, sessionId)).hasSize(1);
    }

    @Test
    void streamedTurnRelaysAndStoresReply() throws Exception {
        String bearer = tokenForNewUser();
        String sessionId = newConversation(bearer);

        MvcResult result = mockMvc.perform(post("/chat/{id}/stream", sessionId)
                        .header(HttpHeaders.AUTHORIZATION, bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"Hi\"}"))
                .andExpect(request().asyncStarted())
                .andReturn();
        result.getAsyncResult(TimeUnit.SECONDS.toMillis(10));

        assertThat(result.getResponse().getContentAsString(StandardCharsets.UTF_8)).isEqualTo("Hello there");
        JsonNode messages = history(bearer, sessionId);
        assertThat(messages).hasSize(3);
        assertThat(messages.get(1).get("role").asText()).isEqualTo("user");
        assertThat(messages.get(2).get("content").asText()).isEqualTo("Hello there");
    }

    @Test
    void failedStreamEndsWithMarkerAndKeepsUtterance() throws Exception {
        String bearer = tokenForNewUser();
        String sessionId = newConversation(bearer);
        failing = true;

        MvcResult result = mockMvc.perform(post("/chat/{id}/stream", sessionId)
                        .header(HttpHeaders.AUTHORIZATION, bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"Hi\"}"))
                .andExpect(request().asyncStarted())
                .andReturn();
        result.getAsyncResult(TimeUnit.SECONDS.toMillis(10));

        assertThat(result.getResponse().getContentAsString(StandardCharsets.UTF_8)).startsWith("\n[ERROR: ");
        JsonNode messages = history(bearer, sessionId);
        assertThat(messages).hasSize(2);
        assertThat(messages.get(1).get("content").asText()).isEqualTo("Hi");
    }

    @Test
    void otherUsersCannotSeeOrUseConversation() throws Exception {
        String owner = tokenForNewUser();
        String stranger = tokenForNewUser();
        String sessionId = newConversation(owner);

        mockMvc.perform(get("/conversations/{id}", sessionId).header(HttpHeaders.AUTHORIZATION, stranger))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Conversation not found"));
        mockMvc.perform(post("/chat/{id}/stream", sessionId)
                        .header(HttpHeaders.AUTHORIZATION, stranger)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"Hi\"}"))
                .andExpect(status().isNotFound());
        mockMvc.perform(delete("/conversations/{id}", sessionId).header(HttpHeaders.AUTHORIZATION, stranger))
                .andExpect(status().isNotFound());

        assertThat(history(owner, sessionId)).hasSize(1);
        assertThat(receivedBodies).isEmpty();
    }

    @Test
    void blankMessageAndBadOptionsAreRejected() throws Exception {
        String bearer = tokenForNewUser();
        String sessionId = newConversation(bearer);

        mockMvc.perform(post("/chat/{id}", sessionId)
                        .header(HttpHeaders.AUTHORIZATION, bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"  \"}"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(post("/chat/{id}", sessionId)
                        .header(HttpHeaders.AUTHORIZATION, bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"Hi\",\"temperature\":3.5}"))
                .andExpect(status().isBadRequest());

        assertThat(receivedBodies).isEmpty();
    }

    @Test
    void conversationListAndDelete() throws Exception {
        String bearer = tokenForNewUser();
        String first = newConversation(bearer);
        String second = newConversation(bearer);

        mockMvc.perform(get("/conversations").header(HttpHeaders.AUTHORIZATION, bearer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(2))
                .andExpect(jsonPath("$.conversations[0].session_id").value(second));

        mockMvc.perform(delete("/conversations/{id}", first).header(HttpHeaders.AUTHORIZATION, bearer))
                .andExpect(status().isNoContent());
        mockMvc.perform(get("/conversations/{id}", first).header(HttpHeaders.AUTHORIZATION, bearer))
                .andExpect(status().isNotFound());
    }

    @Test
    void chatRequiresToken() throws Exception {
        mockMvc.perform(post("/chat/{id}", "conv-00000000000000000000000000000000")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"Hi\"}"))
                .andExpect(status().isUnauthorized());
    }
}
