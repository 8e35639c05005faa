package io.github.drompincen.javaclawsessions.protocol.api;

import java.time.Instant;

public record Message(
        String role,
        String content,
        long created
) {
    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";

    public static Message user(String content) {
        return new Message(ROLE_USER, content, Instant.now().getEpochSecond());
    }

    public static Message assistant(String content) {
        return new Message(ROLE_ASSISTANT, content, Instant.now().getEpochSecond());
    }
}
