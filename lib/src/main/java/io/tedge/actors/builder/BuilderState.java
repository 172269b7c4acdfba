package io.tedge.actors.builder;

/**
 * Lifecycle of a builder: links can be added until the actor is spawned.
 */
public enum BuilderState {
    /** Created, nothing linked yet. */
    BUILDING,
    /** At least one sender was handed out or one peer registered. */
    LINKED,
    /** The box or actor was produced; any further link is refused. */
    SPAWNED
}
