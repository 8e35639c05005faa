package io.github.drompincen.javaclawsessions.runtime.insights;

import io.github.drompincen.javaclawsessions.protocol.api.SessionInfo;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.Optional;

final class SessionTimestamps {

    private SessionTimestamps() {}

    /** Calendar date of a {@link SessionInfo#modified()} value, empty if it does not parse. */
    static Optional<LocalDate> modifiedDate(SessionInfo session) {
        String modified = session.modified();
        if (modified == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDateTime.parse(modified, SessionInfo.MODIFIED_FORMAT).toLocalDate());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
