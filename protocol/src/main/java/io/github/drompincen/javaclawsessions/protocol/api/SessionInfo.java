package io.github.drompincen.javaclawsessions.protocol.api;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

public record SessionInfo(
        String id,
        String modified,
        SessionMetadata metadata
) {
    /** Format of {@link #modified()}, always rendered in UTC. */
    public static final DateTimeFormatter MODIFIED_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);
}
