package io.tedge.actors;

/**
 * Lifecycle notifications published by the runtime for each running actor.
 *
 * <p>{@code task} is the runtime-assigned name: the actor name followed by a spawn counter,
 * e.g. {@code "Converter-3"}.
 */
public sealed interface RuntimeEvent extends Message permits RuntimeEvent.Started, RuntimeEvent.Stopped, RuntimeEvent.Aborted {

    /**
     * @return the name of the task this event is about
     */
    String task();

    /** The actor was handed to the executor. */
    record Started(String task) implements RuntimeEvent {
    }

    /** The actor returned from {@code run()} without error. */
    record Stopped(String task) implements RuntimeEvent {
    }

    /** The actor failed. */
    record Aborted(String task, String error) implements RuntimeEvent {
    }
}
