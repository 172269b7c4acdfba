package io.tedge.actors.channel;

/**
 * Recipient discarding every message. Used as the output of a box nothing was connected to.
 *
 * @param <M> the type of messages accepted
 */
public final class NullRecipient<M> implements Recipient<M> {

    @Override
    public void send(M message) {
    }

    @Override
    public void trySend(M message) {
    }

    @Override
    public Recipient<M> clone() {
        return this;
    }

    @Override
    public void close() {
    }

    @Override
    public boolean isClosed() {
        return false;
    }

    @Override
    public Class<?> messageType() {
        return Object.class;
    }

    @Override
    public String toString() {
        return "NullRecipient";
    }
}
