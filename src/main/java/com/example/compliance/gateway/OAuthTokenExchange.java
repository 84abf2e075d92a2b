package com.example.compliance.gateway;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.UUID;

/**
 * OAuth-style exchange against the gateway's auth endpoint: form body {@code scope=<scope>},
 * {@code Authorization: Basic <secret>} and a fresh {@code RqUID} per request.
 * <p>
 * I/O failures surface as {@link ResourceAccessException} so the transport retries them; a response
 * the endpoint actually sent, other than a token, is an {@link AuthException}.
 */
public class OAuthTokenExchange implements TokenExchange {

    private static final Logger log = LoggerFactory.getLogger(OAuthTokenExchange.class);

    private final RestClient restClient;
    private final String authUrl;
    private final String scope;

    public OAuthTokenExchange(RestClient restClient, String authUrl, String scope) {
        this.restClient = restClient;
        this.authUrl = authUrl;
        this.scope = scope;
    }

    @Override
    public IssuedToken exchange(String secret) {
        String requestId = UUID.randomUUID().toString();
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("scope", scope);

        log.debug("Requesting access token (RqUID={}, scope={})", requestId, scope);
        try {
            IssuedToken token = restClient.post()
                    .uri(authUrl)
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .accept(MediaType.APPLICATION_JSON)
                    .header(HttpHeaders.AUTHORIZATION, "Basic " + secret)
                    .header("RqUID", requestId)
                    .body(form)
                    .retrieve()
                    .body(IssuedToken.class);
            if (token == null) {
                throw new AuthException("Empty token exchange response");
            }
            return token;
        } catch (ResourceAccessException e) {
            throw e;
        } catch (RestClientResponseException e) {
            throw new AuthException("Token exchange rejected with HTTP " + e.getStatusCode().value()
                    + ": " + GatewayException.excerpt(e.getResponseBodyAsString()), e);
        } catch (RestClientException e) {
            throw new AuthException("Token exchange failed: " + e.getMessage(), e);
        }
    }
}
