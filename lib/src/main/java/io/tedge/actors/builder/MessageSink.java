package io.tedge.actors.builder;

import io.tedge.actors.channel.Recipient;

/**
 * A builder of something that consumes messages of type {@code I}.
 *
 * @param <I> the consumed message type
 */
public interface MessageSink<I> {

    /**
     * Hands out a new sender to the input of the built box.
     *
     * @return a recipient that keeps the input open until closed
     * @throws LinkException if the builder has already been spawned
     */
    Recipient<I> sender();
}
