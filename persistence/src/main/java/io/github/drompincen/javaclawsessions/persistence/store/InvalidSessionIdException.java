package io.github.drompincen.javaclawsessions.persistence.store;

public class InvalidSessionIdException extends SessionStoreException {

    public InvalidSessionIdException(String message) {
        super(message);
    }
}
