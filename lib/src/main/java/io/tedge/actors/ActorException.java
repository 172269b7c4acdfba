package io.tedge.actors;

/**
 * Failure of a single actor.
 *
 * <p>Actors throw it from {@code run()} to report a domain error. The runtime also uses it to wrap
 * unexpected exceptions escaping an actor, so every failure surfaced by
 * {@link Runtime#runToCompletion()} carries the name of the actor that caused it.
 */
public class ActorException extends RuntimeException {

    /** Name of the actor where the exception occurred. */
    private final String actorName;

    /**
     * Creates a new ActorException with the specified detail message.
     *
     * @param message the detail message
     */
    public ActorException(String message) {
        super(message);
        this.actorName = null;
    }

    /**
     * Creates a new ActorException with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause the cause of the exception
     */
    public ActorException(String message, Throwable cause) {
        super(message, cause);
        this.actorName = null;
    }

    /**
     * Creates a new ActorException attributed to an actor.
     *
     * @param actorName the actor that failed
     * @param message the detail message
     * @param cause the cause of the exception, may be null
     */
    public ActorException(String actorName, String message, Throwable cause) {
        super(message, cause);
        this.actorName = actorName;
    }

    /**
     * Attributes a failure to an actor, reusing the exception when it already carries that name.
     *
     * @param actorName the actor that failed
     * @param failure what went wrong
     * @return an exception naming the actor
     */
    public static ActorException wrap(String actorName, Throwable failure) {
        if (failure instanceof ActorException actorException
                && actorName.equals(actorException.getActorName())) {
            return actorException;
        }
        String reason = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
        return new ActorException(actorName, actorName + " failed: " + reason, failure);
    }

    /**
     * Returns the name of the actor where the exception occurred.
     *
     * @return the actor name, or null if not specified
     */
    public String getActorName() {
        return actorName;
    }
}
