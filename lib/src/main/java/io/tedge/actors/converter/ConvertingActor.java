package io.tedge.actors.converter;

import io.tedge.actors.Actor;
import io.tedge.actors.ActorException;
import io.tedge.actors.box.SimpleMessageBox;
import io.tedge.actors.mailbox.ChannelException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Actor feeding every input to a {@link Converter} and sending the outputs.
 *
 * @param <I> the input type
 * @param <O> the output type
 */
public class ConvertingActor<I, O> implements Actor {
    private static final Logger logger = LoggerFactory.getLogger(ConvertingActor.class);

    private final String name;
    private final Converter<I, O> converter;
    private final SimpleMessageBox<I, O> box;

    public ConvertingActor(String name, Converter<I, O> converter, SimpleMessageBox<I, O> box) {
        this.name = name;
        this.converter = converter;
        this.box = box;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void run() throws ChannelException, InterruptedException {
        sendAll(initMessages());
        Optional<I> input;
        while ((input = box.receiveMessage()).isPresent()) {
            sendAll(convert(input.get()));
        }
        logger.debug("{} has no more input", name);
        sendAll(shutdownMessages());
    }

    private List<O> initMessages() {
        try {
            return converter.initMessages();
        } catch (Exception e) {
            throw ActorException.wrap(name, e);
        }
    }

    private List<O> convert(I input) {
        try {
            return converter.convert(input);
        } catch (Exception e) {
            logger.debug("{} cannot convert {}: {}", name, input, e.getMessage());
            try {
                return converter.convertError(e);
            } catch (Exception unrecoverable) {
                throw ActorException.wrap(name, unrecoverable);
            }
        }
    }

    private List<O> shutdownMessages() {
        try {
            return converter.shutdownMessages();
        } catch (Exception e) {
            throw ActorException.wrap(name, e);
        }
    }

    private void sendAll(List<O> messages) throws ChannelException, InterruptedException {
        for (O message : messages) {
            box.send(message);
        }
    }

    SimpleMessageBox<I, O> box() {
        return box;
    }
}
