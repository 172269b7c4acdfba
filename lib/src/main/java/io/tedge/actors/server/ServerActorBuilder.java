package io.tedge.actors.server;

import io.tedge.actors.Actor;
import io.tedge.actors.RuntimeHandle;
import io.tedge.actors.RuntimeRequest;
import io.tedge.actors.box.SimpleMessageBox;
import io.tedge.actors.builder.ActorBuilder;
import io.tedge.actors.builder.Builder;
import io.tedge.actors.builder.PeerLinker;
import io.tedge.actors.builder.RuntimeRequestSink;
import io.tedge.actors.channel.Keyed;
import io.tedge.actors.channel.Recipient;
import io.tedge.actors.config.ThreadPoolFactory;
import io.tedge.actors.mailbox.config.MailboxConfig;

/**
 * Builds the actor running a {@link Server}: a {@link ServerActor}, or a
 * {@link ConcurrentServerActor} when the max concurrency is above one.
 *
 * @param <Req> the request type
 * @param <Res> the response type
 */
public class ServerActorBuilder<Req, Res> implements ActorBuilder, PeerLinker<Req, Res>, RuntimeRequestSink, Builder<Actor> {

    private final Server<Req, Res> server;
    private final ServerMessageBoxBuilder<Req, Res> boxBuilder;
    private ThreadPoolFactory threadPoolFactory = new ThreadPoolFactory();
    private SimpleMessageBox<Keyed<Req>, Keyed<Res>> box;

    public ServerActorBuilder(Server<Req, Res> server, Class<Req> requestType, Class<Res> responseType) {
        this(server, requestType, responseType, MailboxConfig.DEFAULT_CAPACITY);
    }

    public ServerActorBuilder(Server<Req, Res> server, Class<Req> requestType, Class<Res> responseType, int capacity) {
        this.server = server;
        this.boxBuilder = new ServerMessageBoxBuilder<>(server.name(), requestType, responseType, capacity);
    }

    public ServerActorBuilder<Req, Res> withMaxConcurrency(int maxConcurrency) {
        boxBuilder.withMaxConcurrency(maxConcurrency);
        return this;
    }

    /**
     * @param threadPoolFactory creates the worker threads of a concurrent server
     * @return this builder
     */
    public ServerActorBuilder<Req, Res> withThreadPoolFactory(ThreadPoolFactory threadPoolFactory) {
        this.threadPoolFactory = threadPoolFactory;
        return this;
    }

    @Override
    public String name() {
        return server.name();
    }

    @Override
    public Recipient<Req> connect(Recipient<Res> responses) {
        return boxBuilder.connect(responses);
    }

    @Override
    public Recipient<RuntimeRequest> signalSender() {
        return boxBuilder.signalSender();
    }

    @Override
    public Actor build() {
        box = boxBuilder.build();
        if (boxBuilder.maxConcurrency() > 1) {
            return new ConcurrentServerActor<>(server, box, boxBuilder.maxConcurrency(), threadPoolFactory);
        }
        return new ServerActor<>(server, box);
    }

    @Override
    public void spawn(RuntimeHandle handle) {
        Recipient<RuntimeRequest> signal = boxBuilder.signalSender();
        Actor actor = build();
        handle.spawn(actor, signal, box);
    }
}
