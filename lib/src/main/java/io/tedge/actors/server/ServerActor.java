package io.tedge.actors.server;

import io.tedge.actors.Actor;
import io.tedge.actors.ActorException;
import io.tedge.actors.box.SimpleMessageBox;
import io.tedge.actors.channel.Keyed;
import io.tedge.actors.mailbox.ChannelException;

import java.util.Optional;

/**
 * Actor handling the requests of a {@link Server} one at a time.
 *
 * @param <Req> the request type
 * @param <Res> the response type
 */
public class ServerActor<Req, Res> implements Actor {

    private final Server<Req, Res> server;
    private final SimpleMessageBox<Keyed<Req>, Keyed<Res>> box;

    public ServerActor(Server<Req, Res> server, SimpleMessageBox<Keyed<Req>, Keyed<Res>> box) {
        this.server = server;
        this.box = box;
    }

    @Override
    public String name() {
        return server.name();
    }

    @Override
    public void run() throws ChannelException, InterruptedException {
        Optional<Keyed<Req>> next;
        while ((next = box.receiveMessage()).isPresent()) {
            Keyed<Req> request = next.get();
            Res response = handle(server, request.message());
            box.send(new Keyed<>(request.clientId(), response));
        }
    }

    static <Req, Res> Res handle(Server<Req, Res> server, Req request) {
        try {
            return server.handle(request);
        } catch (Exception e) {
            throw ActorException.wrap(server.name(), e);
        }
    }

    SimpleMessageBox<Keyed<Req>, Keyed<Res>> box() {
        return box;
    }
}
