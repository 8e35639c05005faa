package io.github.drompincen.javaclawsessions.persistence.store;

public class SessionNotFoundException extends SessionStoreException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("Session not found: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() { return sessionId; }
}
