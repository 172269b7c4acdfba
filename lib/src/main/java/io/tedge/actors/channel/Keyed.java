package io.tedge.actors.channel;

import io.tedge.actors.Message;

/**
 * A message tagged with the index of the client it comes from or is addressed to.
 *
 * @param clientId index of the client, in connection order
 * @param message the payload
 * @param <M> the payload type
 */
public record Keyed<M>(int clientId, M message) implements Message {

    /**
     * Adapts a recipient of keyed messages so that everything sent through it is tagged with a
     * fixed client id.
     *
     * @param recipient where keyed messages are delivered
     * @param clientId the tag
     * @param type the payload type
     * @param <M> the payload type
     * @return a recipient of untagged payloads
     */
    public static <M> Recipient<M> tagging(Recipient<Keyed<M>> recipient, int clientId, Class<M> type) {
        return recipient.adapt(type, message -> new Keyed<>(clientId, message));
    }
}
