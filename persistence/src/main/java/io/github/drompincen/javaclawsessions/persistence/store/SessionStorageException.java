package io.github.drompincen.javaclawsessions.persistence.store;

public class SessionStorageException extends SessionStoreException {

    public SessionStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
