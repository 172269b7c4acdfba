package io.tedge.actors.box;

import io.tedge.actors.RuntimeRequest;
import io.tedge.actors.channel.Recipient;
import io.tedge.actors.mailbox.ChannelException;
import io.tedge.actors.mailbox.Mailbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * A message box with one input mailbox and one output recipient.
 *
 * <p>Built by {@link io.tedge.actors.builder.SimpleMessageBoxBuilder}. The input may carry
 * runtime control requests, either directly when {@code I} is {@link RuntimeRequest} or through a
 * {@link io.tedge.actors.FanIn} control variant; {@link #receiveMessage()} filters them out.
 *
 * @param <I> the input message type
 * @param <O> the output message type
 */
public class SimpleMessageBox<I, O> implements MessageBox {

    private final String name;
    private final Mailbox<I> input;
    private final Recipient<O> output;
    private final Function<? super I, Optional<RuntimeRequest>> controlView;
    private final Logger logger;
    private volatile boolean loggingOn = true;

    public SimpleMessageBox(String name, Mailbox<I> input, Recipient<O> output,
                            Function<? super I, Optional<RuntimeRequest>> controlView) {
        this.name = name;
        this.input = input;
        this.output = output;
        this.controlView = controlView;
        this.logger = LoggerFactory.getLogger(SimpleMessageBox.class.getName() + "." + name);
    }

    /**
     * Waits for the next input, control requests included.
     *
     * @return the next input, or empty once the input is closed and drained
     * @throws InterruptedException if interrupted while waiting
     */
    public Optional<I> receive() throws InterruptedException {
        Optional<I> message = input.receive();
        message.ifPresent(this::logInput);
        return message;
    }

    /**
     * Waits at most {@code timeout} for the next input, control requests included.
     *
     * @param timeout how long to wait
     * @return the next input, or empty on timeout or end-of-stream
     * @throws InterruptedException if interrupted while waiting
     */
    public Optional<I> receive(Duration timeout) throws InterruptedException {
        I message = input.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
        if (message == null) {
            return Optional.empty();
        }
        logInput(message);
        return Optional.of(message);
    }

    /**
     * Waits for the next regular input.
     *
     * @return the next input, or empty on end-of-stream or once a shutdown request is received
     * @throws InterruptedException if interrupted while waiting
     */
    public Optional<I> receiveMessage() throws InterruptedException {
        while (true) {
            Optional<I> message = receive();
            if (message.isEmpty()) {
                return message;
            }
            Optional<RuntimeRequest> request = controlView.apply(message.get());
            if (request.isEmpty()) {
                return message;
            }
            if (request.get() == RuntimeRequest.SHUTDOWN) {
                logger.debug("{} received shutdown request", name);
                return Optional.empty();
            }
        }
    }

    /**
     * @param message an input
     * @return the runtime request it carries, if any
     */
    public Optional<RuntimeRequest> controlRequest(I message) {
        return controlView.apply(message);
    }

    /**
     * Sends to the output, waiting for capacity.
     *
     * @param message the message to send
     * @throws ChannelException if the output is closed
     * @throws InterruptedException if interrupted while waiting for capacity
     */
    public void send(O message) throws ChannelException, InterruptedException {
        logOutput(message);
        output.send(message);
    }

    /**
     * Sends to the output without waiting.
     *
     * @param message the message to send
     * @throws ChannelException if the output is closed or full
     */
    public void trySend(O message) throws ChannelException {
        logOutput(message);
        output.trySend(message);
    }

    /**
     * Gives up the output, so that peers reading from it can observe end-of-stream.
     */
    public void closeOutput() {
        output.close();
    }

    /**
     * Stops accepting input. Messages already queued can still be received.
     */
    public void closeInput() {
        input.close();
    }

    @Override
    public void close() {
        input.close();
        output.close();
    }

    @Override
    public String name() {
        return name;
    }

    public boolean isInputClosed() {
        return input.isClosed();
    }

    public boolean isLoggingOn() {
        return loggingOn;
    }

    public void setLoggingOn(boolean loggingOn) {
        this.loggingOn = loggingOn;
    }

    private void logInput(I message) {
        if (loggingOn) {
            logger.debug("recv {}", message);
        }
    }

    private void logOutput(O message) {
        if (loggingOn) {
            logger.debug("send {}", message);
        }
    }

    @Override
    public String toString() {
        return "SimpleMessageBox{" + name + "}";
    }
}
