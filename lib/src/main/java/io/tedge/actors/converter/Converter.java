package io.tedge.actors.converter;

import java.util.List;

/**
 * Stateful translation of input messages into output messages.
 *
 * <p>Run by a {@link ConvertingActor}, one input at a time, so implementations need not be
 * thread-safe.
 *
 * @param <I> the input type
 * @param <O> the output type
 */
public interface Converter<I, O> {

    /**
     * Translates one input.
     *
     * @param input the input message
     * @return the outputs, sent in order; possibly empty
     * @throws Exception if the input cannot be translated
     */
    List<O> convert(I input) throws Exception;

    /**
     * Turns a conversion failure into outputs, e.g. an error message for a dedicated topic. The
     * default rethrows, failing the actor.
     *
     * @param error what {@link #convert(Object)} threw
     * @return the outputs to send instead
     * @throws Exception to fail the actor
     */
    default List<O> convertError(Exception error) throws Exception {
        throw error;
    }

    /**
     * @return messages sent once, before the first input is processed
     * @throws Exception to fail the actor
     */
    default List<O> initMessages() throws Exception {
        return List.of();
    }

    /**
     * @return messages sent once, after the last input has been processed
     * @throws Exception to fail the actor
     */
    default List<O> shutdownMessages() throws Exception {
        return List.of();
    }
}
