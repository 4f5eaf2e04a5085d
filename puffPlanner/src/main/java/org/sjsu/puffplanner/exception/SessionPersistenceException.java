package org.sjsu.puffplanner.exception;

/**
 * The session store could not read or write a user's session. The last committed state is left as is.
 */
public class SessionPersistenceException extends RuntimeException {

    public SessionPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
