package com.example.compliance.model;

/**
 * A single role-tagged message of a chat completion request.
 *
 * @param role    "system", "user" or "assistant"
 * @param content message text
 */
public record ChatMessage(String role, String content) {

    public static ChatMessage system(String content) {
        return new ChatMessage("system", content);
    }

    public static ChatMessage user(String content) {
        return new ChatMessage("user", content);
    }
}
