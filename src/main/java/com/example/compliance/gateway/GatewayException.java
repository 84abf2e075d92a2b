package com.example.compliance.gateway;

/**
 * The gateway answered with a non-success status, or with a body that could not be decoded
 * (status code 0).
 */
public class GatewayException extends GatewayClientException {

    static final int MAX_EXCERPT = 500;

    private final int statusCode;
    private final String bodyExcerpt;

    public GatewayException(int statusCode, String body, Throwable cause, int attempts) {
        super(buildMessage(statusCode, excerpt(body)), cause, attempts);
        this.statusCode = statusCode;
        this.bodyExcerpt = excerpt(body);
    }

    public int statusCode() {
        return statusCode;
    }

    public String bodyExcerpt() {
        return bodyExcerpt;
    }

    private static String buildMessage(int statusCode, String excerpt) {
        String prefix = statusCode > 0 ? "Gateway returned HTTP " + statusCode : "Gateway response unusable";
        return excerpt.isEmpty() ? prefix : prefix + ": " + excerpt;
    }

    static String excerpt(String body) {
        if (body == null) return "";
        return body.length() > MAX_EXCERPT ? body.substring(0, MAX_EXCERPT) + "..." : body;
    }
}
