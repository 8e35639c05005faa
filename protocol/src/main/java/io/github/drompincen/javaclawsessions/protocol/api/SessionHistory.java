package io.github.drompincen.javaclawsessions.protocol.api;

import java.util.List;

public record SessionHistory(
        String sessionId,
        SessionMetadata metadata,
        List<Message> messages
) {}
