package io.tedge.actors.box;

/**
 * The channels owned by a running actor.
 *
 * <p>The runtime closes the box once the actor has returned, so that peers still sending to it
 * observe {@link io.tedge.actors.mailbox.ChannelException.Reason#CLOSED} and peers reading from
 * it observe end-of-stream.
 */
public interface MessageBox extends AutoCloseable {

    /**
     * @return the name of the owning actor
     */
    String name();

    /**
     * Closes the input mailbox and gives up every output handle. Idempotent.
     */
    @Override
    void close();
}
