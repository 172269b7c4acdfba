package io.tedge.actors.server;

/**
 * Request handler run by a server actor.
 *
 * <p>A server configured with a max concurrency above one calls {@link #handle(Object)} from
 * several threads at once.
 *
 * @param <Req> the request type
 * @param <Res> the response type
 */
public interface Server<Req, Res> {

    /**
     * @return the server name, used for logs
     */
    String name();

    /**
     * Computes the response to a request.
     *
     * @param request the request
     * @return the response sent back to the requesting client
     * @throws Exception to fail the server actor
     */
    Res handle(Req request) throws Exception;
}
