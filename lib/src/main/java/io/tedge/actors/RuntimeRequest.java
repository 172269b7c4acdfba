package io.tedge.actors;

/**
 * Control requests the runtime sends to every actor it started.
 */
public enum RuntimeRequest implements Message {
    /**
     * Stop accepting new work, flush what is pending and return from {@code run()}.
     */
    SHUTDOWN
}
