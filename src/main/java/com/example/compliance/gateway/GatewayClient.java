package com.example.compliance.gateway;

import com.example.compliance.model.ChatCompletion;
import com.example.compliance.model.ChatRequest;
import com.example.compliance.model.FunctionCallMode;
import com.example.compliance.model.FunctionDefinition;
import com.example.compliance.model.RawResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.List;

/**
 * Client of the gateway's chat completion endpoint.
 * <p>
 * Both request modes go through {@link ResilientTransport}, which supplies a fresh bearer token
 * per attempt. Structured mode only offers functions to the model: the response may still be
 * plain text and callers must handle both shapes.
 */
public class GatewayClient {

    private static final Logger log = LoggerFactory.getLogger(GatewayClient.class);

    private static final String COMPLETIONS_PATH = "/chat/completions";

    private final RestClient restClient;
    private final ResilientTransport transport;
    private final String completionsUrl;

    public GatewayClient(RestClient restClient, ResilientTransport transport, String baseUrl) {
        this.restClient = restClient;
        this.transport = transport;
        this.completionsUrl = stripTrailingSlash(baseUrl) + COMPLETIONS_PATH;
    }

    /**
     * Free-form chat completion.
     *
     * @throws TransportException on exhausted retries or cancellation
     * @throws GatewayException   on a persistent non-success status or an unusable body
     * @throws AuthException      if the auth endpoint rejected the token exchange
     */
    public RawResponse complete(ChatRequest request) {
        return send(request.withFunctions(null, null));
    }

    /**
     * Chat completion offering {@code functions} to the model under the given call mode.
     */
    public RawResponse completeStructured(ChatRequest request, List<FunctionDefinition> functions,
                                          FunctionCallMode mode) {
        if (functions == null || functions.isEmpty()) {
            throw new IllegalArgumentException("Structured completion needs at least one function");
        }
        return send(request.withFunctions(functions, mode != null ? mode : FunctionCallMode.auto()));
    }

    private RawResponse send(ChatRequest request) {
        String operation = request.structured()
                ? "completion[" + request.functions().get(0).name() + "]"
                : "completion";
        log.debug("{}: sending {} messages to model {}", operation, request.messages().size(), request.model());

        ResilientTransport.Delivery<ChatCompletion> delivery;
        try {
            delivery = transport.execute(operation, token -> post(request, token));
        } catch (TransportException e) {
            if (e.getCause() instanceof RestClientResponseException rejected) {
                throw new GatewayException(rejected.getStatusCode().value(),
                        rejected.getResponseBodyAsString(), e, e.attempts());
            }
            throw e;
        } catch (RestClientResponseException e) {
            throw new GatewayException(e.getStatusCode().value(), e.getResponseBodyAsString(), e, 1);
        } catch (RestClientException e) {
            throw new GatewayException(0, e.getMessage(), e, 1);
        }

        ChatCompletion completion = delivery.value();
        if (completion == null) {
            throw new GatewayException(0, "empty response body", null, delivery.attempts());
        }
        log.debug("{}: received {} choices after {} attempt(s)",
                operation, completion.choices() != null ? completion.choices().size() : 0, delivery.attempts());
        return RawResponse.of(completion, delivery.attempts());
    }

    private ChatCompletion post(ChatRequest request, String token) {
        return restClient.post()
                .uri(completionsUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                .body(request)
                .retrieve()
                .body(ChatCompletion.class);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
