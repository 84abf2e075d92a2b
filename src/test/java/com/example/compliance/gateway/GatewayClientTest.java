package com.example.compliance.gateway;

import com.example.compliance.model.ChatMessage;
import com.example.compliance.model.ChatRequest;
import com.example.compliance.model.FinishReason;
import com.example.compliance.model.FunctionCallMode;
import com.example.compliance.model.FunctionDefinition;
import com.example.compliance.model.RawResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class GatewayClientTest {

    private static final String BASE_URL = "https://gateway.test/api/v1/";
    private static final String COMPLETIONS = "https://gateway.test/api/v1/chat/completions";

    private final ObjectMapper objectMapper = new ObjectMapper();

    private MockRestServiceServer server;
    private AtomicInteger exchanges;
    private RestClient.Builder builder;

    @BeforeEach
    void setUp() {
        builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        exchanges = new AtomicInteger();
    }

    private GatewayClient client(int maxAttempts) {
        Clock clock = Clock.fixed(Instant.parse("2025-03-01T10:00:00Z"), ZoneOffset.UTC);
        var credentials = new CredentialManager("secret",
                secret -> new IssuedToken("tok-" + exchanges.incrementAndGet(),
                        clock.instant().plus(Duration.ofMinutes(30)).toEpochMilli()),
                Duration.ofMinutes(5), clock);
        var transport = new ResilientTransport(
                new RetryPolicy(maxAttempts, Duration.ofMillis(10), Duration.ZERO, Duration.ofSeconds(5)),
                credentials, duration -> { }, () -> 0.0);
        return new GatewayClient(builder.build(), transport, BASE_URL);
    }

    private static ChatRequest request() {
        return ChatRequest.of("GigaChat-Max",
                List.of(ChatMessage.system("You review code."), ChatMessage.user("int f() { return 1; }")),
                0.7, 1024);
    }

    private FunctionDefinition codeAnalysis() throws IOException {
        return new FunctionDefinition("code_analysis", "Structured analysis of source code",
                objectMapper.readTree("{\"type\":\"object\",\"properties\":{\"summary\":{\"type\":\"string\"}}}"));
    }

    @Test
    @DisplayName("structured completion sends functions, auto mode and the bearer token")
    void structuredRequestShape() throws IOException {
        server.expect(requestTo(COMPLETIONS))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer tok-1"))
                .andExpect(jsonPath("$.model").value("GigaChat-Max"))
                .andExpect(jsonPath("$.max_tokens").value(1024))
                .andExpect(jsonPath("$.messages[0].role").value("system"))
                .andExpect(jsonPath("$.functions[0].name").value("code_analysis"))
                .andExpect(jsonPath("$.functions[0].parameters.type").value("object"))
                .andExpect(jsonPath("$.function_call").value("auto"))
                .andRespond(withSuccess("""
                        {"choices":[{"index":0,"finish_reason":"function_call",
                          "message":{"role":"assistant","content":"",
                            "function_call":{"name":"code_analysis","arguments":{"summary":"fine"}}}}],
                         "model":"GigaChat-Max",
                         "usage":{"prompt_tokens":120,"completion_tokens":30,"total_tokens":150}}
                        """, MediaType.APPLICATION_JSON));

        RawResponse response = client(3).completeStructured(request(), List.of(codeAnalysis()), FunctionCallMode.auto());

        server.verify();
        assertEquals(1, response.attempts());
        assertEquals(150, response.usage().totalTokens());
        assertEquals(FinishReason.FUNCTION_CALL, response.choices().get(0).finishReason());
        assertEquals("code_analysis", response.choices().get(0).message().functionCall().name());
        assertEquals("{\"summary\":\"fine\"}", response.choices().get(0).message().functionCall().argumentsText());
    }

    @Test
    @DisplayName("a named mode is sent as an object")
    void namedMode() throws IOException {
        server.expect(requestTo(COMPLETIONS))
                .andExpect(jsonPath("$.function_call.name").value("code_analysis"))
                .andRespond(withSuccess("{\"choices\":[]}", MediaType.APPLICATION_JSON));

        client(1).completeStructured(request(), List.of(codeAnalysis()), FunctionCallMode.named("code_analysis"));

        server.verify();
    }

    @Test
    @DisplayName("plain completion sends no functions and parses free text")
    void plainCompletion() {
        server.expect(requestTo(COMPLETIONS))
                .andExpect(jsonPath("$.functions").doesNotExist())
                .andExpect(jsonPath("$.function_call").doesNotExist())
                .andRespond(withSuccess("""
                        {"choices":[{"index":0,"finish_reason":"stop",
                          "message":{"role":"assistant","content":"The code looks correct."}}]}
                        """, MediaType.APPLICATION_JSON));

        RawResponse response = client(3).complete(request());

        assertEquals("The code looks correct.", response.choices().get(0).message().content());
        assertEquals(FinishReason.STOP, response.choices().get(0).finishReason());
    }

    @Test
    @DisplayName("unknown finish reasons are read as UNKNOWN")
    void unknownFinishReason() {
        server.expect(requestTo(COMPLETIONS))
                .andRespond(withSuccess("""
                        {"choices":[{"index":0,"finish_reason":"blacklist","message":{"role":"assistant","content":"-"}}]}
                        """, MediaType.APPLICATION_JSON));

        RawResponse response = client(1).complete(request());

        assertEquals(FinishReason.UNKNOWN, response.choices().get(0).finishReason());
    }

    @Test
    @DisplayName("500 fails immediately with GatewayException carrying status and body")
    void serverErrorIsFatal() {
        server.expect(ExpectedCount.once(), requestTo(COMPLETIONS))
                .andRespond(withServerError().body("{\"message\":\"model overloaded\"}")
                        .contentType(MediaType.APPLICATION_JSON));

        GatewayException error = assertThrows(GatewayException.class, () -> client(5).complete(request()));

        server.verify();
        assertEquals(500, error.statusCode());
        assertEquals(1, error.attempts());
        assertTrue(error.bodyExcerpt().contains("model overloaded"));
    }

    @Test
    @DisplayName("the body excerpt is capped at 500 characters")
    void longBodyIsTruncated() {
        server.expect(requestTo(COMPLETIONS))
                .andRespond(withBadRequest().body("x".repeat(2000)));

        GatewayException error = assertThrows(GatewayException.class, () -> client(1).complete(request()));

        assertEquals(400, error.statusCode());
        assertEquals(503, error.bodyExcerpt().length());
    }

    @Test
    @DisplayName("401 on every attempt refreshes the token each time and ends in GatewayException")
    void persistentUnauthorized() {
        server.expect(ExpectedCount.times(2), requestTo(COMPLETIONS))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        GatewayException error = assertThrows(GatewayException.class, () -> client(2).complete(request()));

        server.verify();
        assertEquals(401, error.statusCode());
        assertEquals(2, error.attempts());
        assertEquals(2, exchanges.get());
    }

    @Test
    @DisplayName("connection failures are retried and end in TransportException")
    void connectionResetExhausts() {
        server.expect(ExpectedCount.times(3), requestTo(COMPLETIONS))
                .andRespond(withException(new IOException("Connection reset")));

        TransportException error = assertThrows(TransportException.class, () -> client(3).complete(request()));

        server.verify();
        assertEquals(3, error.attempts());
        assertFalse(error.isCancelled());
    }

    @Test
    @DisplayName("an undecodable body is a GatewayException with status 0")
    void undecodableBody() {
        server.expect(requestTo(COMPLETIONS))
                .andRespond(withSuccess("<html>gateway error</html>", MediaType.APPLICATION_JSON));

        GatewayException error = assertThrows(GatewayException.class, () -> client(3).complete(request()));

        assertEquals(0, error.statusCode());
    }

    @Test
    @DisplayName("an empty body is a GatewayException with status 0")
    void emptyBody() {
        server.expect(requestTo(COMPLETIONS)).andRespond(withSuccess());

        GatewayException error = assertThrows(GatewayException.class, () -> client(3).complete(request()));

        assertEquals(0, error.statusCode());
    }

    @Test
    @DisplayName("structured completion without functions is rejected")
    void structuredNeedsFunctions() {
        assertThrows(IllegalArgumentException.class,
                () -> client(1).completeStructured(request(), List.of(), FunctionCallMode.auto()));
    }
}
