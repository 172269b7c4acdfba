package io.tedge.actors.channel;

import io.tedge.actors.mailbox.ChannelException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Recipient dispatching keyed messages to the client whose index matches the key.
 *
 * <p>A server keeps answering when one of its clients has gone away: responses for unknown or
 * closed clients are logged and dropped.
 *
 * @param <M> the payload type
 */
public final class RoutingRecipient<M> implements Recipient<Keyed<M>> {
    private static final Logger logger = LoggerFactory.getLogger(RoutingRecipient.class);

    private final List<Recipient<M>> clients;

    public RoutingRecipient(List<Recipient<M>> clients) {
        this.clients = List.copyOf(clients);
    }

    @Override
    public void send(Keyed<M> message) throws InterruptedException {
        Recipient<M> client = clientFor(message);
        if (client == null) {
            return;
        }
        try {
            client.send(message.message());
        } catch (ChannelException e) {
            logger.debug("Dropping response to client {}: {}", message.clientId(), e.getMessage());
        }
    }

    @Override
    public void trySend(Keyed<M> message) throws ChannelException {
        Recipient<M> client = clientFor(message);
        if (client == null) {
            return;
        }
        try {
            client.trySend(message.message());
        } catch (ChannelException e) {
            if (!e.isClosed()) {
                throw e;
            }
            logger.debug("Dropping response to client {}: {}", message.clientId(), e.getMessage());
        }
    }

    private Recipient<M> clientFor(Keyed<M> message) {
        int clientId = message.clientId();
        if (clientId < 0 || clientId >= clients.size()) {
            logger.warn("No client with id {}, dropping {}", clientId, message.message());
            return null;
        }
        return clients.get(clientId);
    }

    @Override
    public RoutingRecipient<M> clone() {
        List<Recipient<M>> copies = new ArrayList<>(clients.size());
        for (Recipient<M> client : clients) {
            copies.add(client.clone());
        }
        return new RoutingRecipient<>(copies);
    }

    @Override
    public void close() {
        clients.forEach(Recipient::close);
    }

    @Override
    public boolean isClosed() {
        return clients.stream().allMatch(Recipient::isClosed);
    }

    @Override
    public Class<?> messageType() {
        return Keyed.class;
    }

    /**
     * @return number of clients
     */
    public int size() {
        return clients.size();
    }
}
