package io.tedge.actors.builder;

/**
 * Raised when two actors cannot be linked.
 *
 * <p>All reasons are programming errors detected while wiring actors, before any of them runs.
 */
public class LinkException extends RuntimeException {

    /**
     * Why a link was refused.
     */
    public enum Reason {
        /** The builder has already produced its actor. */
        ALREADY_SPAWNED,
        /** The message types on both ends of the link do not match. */
        TYPE_MISMATCH,
        /** The builder accepts a single connection and already has one. */
        ALREADY_LINKED
    }

    private final Reason reason;

    public LinkException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public static LinkException alreadySpawned(String builderName) {
        return new LinkException(Reason.ALREADY_SPAWNED, "Cannot link " + builderName + ": actor already spawned");
    }

    public static LinkException typeMismatch(String builderName, Class<?> expected, Class<?> actual) {
        return new LinkException(Reason.TYPE_MISMATCH,
                "Cannot link " + builderName + ": expected a recipient for " + expected.getName()
                        + " but got one for " + actual.getName());
    }

    public static LinkException alreadyLinked(String builderName) {
        return new LinkException(Reason.ALREADY_LINKED, "Cannot link " + builderName + ": already connected");
    }

    public Reason getReason() {
        return reason;
    }
}
