package io.tedge.actors.channel;

import io.tedge.actors.RuntimeRequest;
import io.tedge.actors.mailbox.ChannelException;
import io.tedge.actors.mailbox.Mailbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Signal recipient for actors whose input cannot carry runtime requests.
 *
 * <p>A shutdown request closes the input mailbox: the actor drains what is already queued, then
 * observes end-of-stream.
 */
public final class InputClosingRecipient implements Recipient<RuntimeRequest> {
    private static final Logger logger = LoggerFactory.getLogger(InputClosingRecipient.class);

    private final Mailbox<?> input;

    public InputClosingRecipient(Mailbox<?> input) {
        this.input = input;
    }

    @Override
    public void send(RuntimeRequest request) throws ChannelException {
        trySend(request);
    }

    @Override
    public void trySend(RuntimeRequest request) throws ChannelException {
        if (input.isClosed()) {
            throw ChannelException.closed(input.name());
        }
        if (request == RuntimeRequest.SHUTDOWN) {
            logger.debug("Closing input {} on shutdown request", input.name());
            input.close();
        }
    }

    @Override
    public Recipient<RuntimeRequest> clone() {
        return new InputClosingRecipient(input);
    }

    @Override
    public void close() {
    }

    @Override
    public boolean isClosed() {
        return input.isClosed();
    }

    @Override
    public Class<?> messageType() {
        return RuntimeRequest.class;
    }
}
