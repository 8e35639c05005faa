package io.github.drompincen.javaclawsessions.persistence.store;

import java.nio.file.Path;

public class CorruptSessionDataException extends SessionStoreException {

    private final String sessionId;
    private final Path file;

    public CorruptSessionDataException(String sessionId, Path file, String detail, Throwable cause) {
        super("Corrupt data in session %s (%s): %s".formatted(sessionId, file.getFileName(), detail), cause);
        this.sessionId = sessionId;
        this.file = file;
    }

    public String getSessionId() { return sessionId; }
    public Path getFile() { return file; }
}
