package com.trellissystems;

/**
 * Base class for all errors raised by Trellis.
 * Carries the id of the actor the error belongs to, when one is known.
 */
public class TrellisException extends RuntimeException {

    /** The ID of the actor where the exception occurred. */
    private final String actorId;

    /**
     * Creates a new TrellisException with the specified detail message.
     *
     * @param message the detail message
     */
    public TrellisException(String message) {
        super(message);
        this.actorId = null;
    }

    /**
     * Creates a new TrellisException with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause the cause of the exception
     */
    public TrellisException(String message, Throwable cause) {
        super(message, cause);
        this.actorId = null;
    }

    /**
     * Creates a new TrellisException with the specified detail message, cause, and actor ID.
     *
     * @param message the detail message
     * @param cause the cause of the exception
     * @param actorId the ID of the actor where the exception occurred
     */
    public TrellisException(String message, Throwable cause, String actorId) {
        super(message, cause);
        this.actorId = actorId;
    }

    /**
     * Returns the ID of the actor where the exception occurred.
     *
     * @return the actor ID, or null if not specified
     */
    public String getActorId() {
        return actorId;
    }
}
