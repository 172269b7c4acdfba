package io.tedge.actors.builder;

/**
 * Produces a value once all links are established.
 *
 * @param <T> the built value
 */
public interface Builder<T> {

    /**
     * Consumes the builder.
     *
     * @return the built value
     * @throws LinkException if the builder was already consumed
     */
    T build();
}
