package io.github.drompincen.javaclawsessions.persistence.store;

/**
 * Base type of every failure raised by the session store. Callers that only care whether an
 * operation worked can catch this; callers that map failures to a status vocabulary switch on
 * the concrete subtype.
 */
public abstract class SessionStoreException extends RuntimeException {

    protected SessionStoreException(String message) {
        super(message);
    }

    protected SessionStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
