package io.tedge.actors.mailbox;

/**
 * Raised when a message cannot be delivered to a mailbox.
 * <p>
 * This is an expected condition: a peer has gone away ({@link Reason#CLOSED})
 * or has no room left right now ({@link Reason#FULL}).
 * Producers react by winding down or retrying later, never by crashing.
 */
public class ChannelException extends Exception {

    /**
     * Why a message could not be delivered.
     */
    public enum Reason {
        /** The mailbox is closed and will never accept another message. */
        CLOSED,
        /** The mailbox is full; only returned by non-blocking sends. */
        FULL
    }

    private final Reason reason;

    public ChannelException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public static ChannelException closed(String mailboxName) {
        return new ChannelException(Reason.CLOSED, "Mailbox " + mailboxName + " is closed");
    }

    public static ChannelException full(String mailboxName) {
        return new ChannelException(Reason.FULL, "Mailbox " + mailboxName + " is full");
    }

    public Reason getReason() {
        return reason;
    }

    public boolean isClosed() {
        return reason == Reason.CLOSED;
    }
}
