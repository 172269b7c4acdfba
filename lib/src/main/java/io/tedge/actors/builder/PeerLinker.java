package io.tedge.actors.builder;

import io.tedge.actors.channel.Recipient;

/**
 * A builder accepting bidirectional connections: the peer receives messages of type {@code O} and
 * sends messages of type {@code I}.
 *
 * @param <I> the message type the built actor consumes
 * @param <O> the message type the built actor produces
 */
public interface PeerLinker<I, O> {

    /**
     * Connects a peer.
     *
     * @param output where the built actor sends its messages for this peer
     * @return where the peer sends its messages to the built actor
     * @throws LinkException if the builder has already been spawned, is already linked, or the
     *                       types do not match
     */
    Recipient<I> connect(Recipient<O> output);
}
