package io.tedge.actors.box;

import io.tedge.actors.builder.PeerLinker;
import io.tedge.actors.builder.SimpleMessageBoxBuilder;
import io.tedge.actors.mailbox.ChannelException;

/**
 * Message box of a client sending one request at a time to a server and waiting for its response.
 *
 * <p>Not meant to be shared between threads: responses are matched to requests by order.
 *
 * @param <Req> the request type
 * @param <Res> the response type
 */
public class ClientMessageBox<Req, Res> implements MessageBox {

    private final SimpleMessageBox<Res, Req> box;

    /**
     * Connects a new client to a server. Must be called before the server is spawned.
     */
    public ClientMessageBox(String name, PeerLinker<Req, Res> server, Class<Req> requestType, Class<Res> responseType) {
        this.box = new SimpleMessageBoxBuilder<>(name, responseType, requestType, 1)
                .withConnection(server)
                .build();
    }

    /**
     * Sends a request and waits for its response.
     *
     * @param request the request
     * @return the server response
     * @throws ChannelException if the server is gone
     * @throws InterruptedException if interrupted while waiting
     */
    public Res awaitResponse(Req request) throws ChannelException, InterruptedException {
        box.send(request);
        return box.receive().orElseThrow(() -> ChannelException.closed(box.name()));
    }

    @Override
    public String name() {
        return box.name();
    }

    @Override
    public void close() {
        box.close();
    }
}
