package io.tedge.actors.channel;

import io.tedge.actors.mailbox.ChannelException;

import java.util.function.Function;

/**
 * Recipient applying a conversion before forwarding to another recipient.
 *
 * @param <A> the message type of the underlying recipient
 * @param <B> the accepted message type
 */
final class MappingRecipient<A, B> implements Recipient<B> {

    private final Recipient<A> inner;
    private final Class<B> type;
    private final Function<? super B, ? extends Iterable<? extends A>> mapping;

    MappingRecipient(Recipient<A> inner, Class<B> type, Function<? super B, ? extends Iterable<? extends A>> mapping) {
        this.inner = inner;
        this.type = type;
        this.mapping = mapping;
    }

    @Override
    public void send(B message) throws ChannelException, InterruptedException {
        for (A converted : mapping.apply(message)) {
            inner.send(converted);
        }
    }

    @Override
    public void trySend(B message) throws ChannelException {
        for (A converted : mapping.apply(message)) {
            inner.trySend(converted);
        }
    }

    @Override
    public Recipient<B> clone() {
        return new MappingRecipient<>(inner.clone(), type, mapping);
    }

    @Override
    public void close() {
        inner.close();
    }

    @Override
    public boolean isClosed() {
        return inner.isClosed();
    }

    @Override
    public Class<?> messageType() {
        return type;
    }

    @Override
    public String toString() {
        return "MappingRecipient{" + type.getSimpleName() + " -> " + inner + "}";
    }
}
