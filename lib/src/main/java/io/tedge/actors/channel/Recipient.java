package io.tedge.actors.channel;

import io.tedge.actors.mailbox.ChannelException;

import java.util.List;
import java.util.function.Function;

/**
 * Type-erased sending capability for messages of type {@code M}.
 *
 * <p>A recipient is how an actor reaches a peer without knowing the peer's concrete type. Every
 * handle can be cloned; a mailbox behind a recipient reaches end-of-stream once every handle to it
 * has been closed. Closing is the only way to give up a handle, so a recipient that is no longer
 * needed must be closed, otherwise its peer will never observe end-of-stream.
 *
 * <p>Implementations are safe to use from several threads.
 *
 * @param <M> the type of messages accepted
 */
public interface Recipient<M> extends AutoCloseable {

    /**
     * Delivers a message, waiting for capacity when the target mailbox is full.
     *
     * @param message the message to deliver
     * @throws ChannelException if the target is closed
     * @throws InterruptedException if interrupted while waiting for capacity
     */
    void send(M message) throws ChannelException, InterruptedException;

    /**
     * Delivers a message without waiting.
     *
     * @param message the message to deliver
     * @throws ChannelException if the target is closed or full
     */
    void trySend(M message) throws ChannelException;

    /**
     * Returns a new independent handle to the same target.
     *
     * <p>The clone keeps the target open until it is closed itself. Cloning a closed handle returns
     * a closed handle.
     *
     * @return a new handle
     */
    Recipient<M> clone();

    /**
     * Gives up this handle. Further sends through it fail with {@link ChannelException.Reason#CLOSED}.
     * Idempotent.
     */
    @Override
    void close();

    /**
     * @return true once this handle, or the target behind it, is closed
     */
    boolean isClosed();

    /**
     * Runtime token for {@code M}, used by builders to reject links between incompatible types.
     *
     * @return the class of accepted messages
     */
    Class<?> messageType();

    /**
     * Adapts this recipient to another message type.
     *
     * <p>The returned recipient owns a clone of this one; closing it leaves this handle untouched.
     *
     * @param type the accepted message type
     * @param mapping conversion applied to every message before delivery
     * @param <B> the accepted message type
     * @return a recipient for {@code B}
     */
    default <B> Recipient<B> adapt(Class<B> type, Function<? super B, ? extends M> mapping) {
        return new MappingRecipient<>(clone(), type, message -> List.of(mapping.apply(message)));
    }

    /**
     * Adapts this recipient with a mapping producing zero or more messages, delivered in order.
     *
     * @param type the accepted message type
     * @param mapping conversion applied to every message before delivery
     * @param <B> the accepted message type
     * @return a recipient for {@code B}
     */
    default <B> Recipient<B> flatAdapt(Class<B> type, Function<? super B, ? extends Iterable<? extends M>> mapping) {
        return new MappingRecipient<>(clone(), type, mapping);
    }
}
