package io.tedge.actors.server;

import io.tedge.actors.RuntimeRequest;
import io.tedge.actors.box.SimpleMessageBox;
import io.tedge.actors.builder.Builder;
import io.tedge.actors.builder.BuilderState;
import io.tedge.actors.builder.LinkException;
import io.tedge.actors.builder.PeerLinker;
import io.tedge.actors.builder.RuntimeRequestSink;
import io.tedge.actors.channel.InputClosingRecipient;
import io.tedge.actors.channel.Keyed;
import io.tedge.actors.channel.MailboxRecipient;
import io.tedge.actors.channel.Recipient;
import io.tedge.actors.channel.RoutingRecipient;
import io.tedge.actors.mailbox.BoundedMailbox;
import io.tedge.actors.mailbox.Mailbox;
import io.tedge.actors.mailbox.config.MailboxConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds the message box of a server: requests from all clients share one mailbox, tagged with
 * the client index, and responses are routed back by that index.
 *
 * @param <Req> the request type
 * @param <Res> the response type
 */
public class ServerMessageBoxBuilder<Req, Res>
        implements PeerLinker<Req, Res>, RuntimeRequestSink, Builder<SimpleMessageBox<Keyed<Req>, Keyed<Res>>> {
    private static final Logger logger = LoggerFactory.getLogger(ServerMessageBoxBuilder.class);

    private final String name;
    private final Class<Req> requestType;
    private final Class<Res> responseType;
    private final Mailbox<Keyed<Req>> requests;
    private final MailboxRecipient<Keyed<Req>> requestSender;
    private final List<Recipient<Res>> clients = new ArrayList<>();
    private int maxConcurrency = 1;
    private BuilderState state = BuilderState.BUILDING;

    public ServerMessageBoxBuilder(String name, Class<Req> requestType, Class<Res> responseType) {
        this(name, requestType, responseType, MailboxConfig.DEFAULT_CAPACITY);
    }

    public ServerMessageBoxBuilder(String name, Class<Req> requestType, Class<Res> responseType, int capacity) {
        this.name = name;
        this.requestType = requestType;
        this.responseType = responseType;
        this.requests = new BoundedMailbox<>(name, capacity);
        this.requestSender = MailboxRecipient.of(requests, Keyed.class);
    }

    /**
     * @param maxConcurrency number of requests handled at once, at least 1
     * @return this builder
     */
    public ServerMessageBoxBuilder<Req, Res> withMaxConcurrency(int maxConcurrency) {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("Max concurrency must be at least 1, got " + maxConcurrency);
        }
        this.maxConcurrency = maxConcurrency;
        return this;
    }

    @Override
    public Recipient<Req> connect(Recipient<Res> responses) {
        ensureNotSpawned();
        if (!responses.messageType().isAssignableFrom(responseType)) {
            throw LinkException.typeMismatch(name, responseType, responses.messageType());
        }
        int clientId = clients.size();
        clients.add(responses);
        state = BuilderState.LINKED;
        logger.debug("Client {} connected to server {}", clientId, name);
        return Keyed.tagging(requestSender, clientId, requestType);
    }

    @Override
    public Recipient<RuntimeRequest> signalSender() {
        ensureNotSpawned();
        return new InputClosingRecipient(requests);
    }

    @Override
    public SimpleMessageBox<Keyed<Req>, Keyed<Res>> build() {
        ensureNotSpawned();
        state = BuilderState.SPAWNED;
        requestSender.close();
        return new SimpleMessageBox<>(name, requests, new RoutingRecipient<>(clients), request -> Optional.empty());
    }

    private void ensureNotSpawned() {
        if (state == BuilderState.SPAWNED) {
            throw LinkException.alreadySpawned(name);
        }
    }

    public String name() {
        return name;
    }

    public int maxConcurrency() {
        return maxConcurrency;
    }

    public BuilderState state() {
        return state;
    }
}
