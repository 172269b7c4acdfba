package io.tedge.actors.builder;

import io.tedge.actors.channel.Recipient;

/**
 * A builder of something that produces messages of type {@code O}.
 *
 * @param <O> the produced message type
 */
public interface MessageSource<O> {

    /**
     * Adds a peer receiving every produced message.
     *
     * @param peer where produced messages are sent
     * @throws LinkException if the builder has already been spawned or the peer accepts another type
     */
    void registerPeer(Recipient<? super O> peer);

    /**
     * Connects this source to a sink.
     *
     * @param sink the consumer
     */
    default void connectSink(MessageSink<? super O> sink) {
        registerPeer(sink.sender());
    }
}
