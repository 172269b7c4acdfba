package io.tedge.actors.builder;

import io.tedge.actors.RuntimeHandle;

/**
 * A builder the runtime can turn into a running actor.
 */
public interface ActorBuilder {

    /**
     * @return the name of the actor to build, used for logs
     */
    String name();

    /**
     * Builds the actor and registers it with the runtime, together with its signal sender.
     *
     * @param handle the registration capability, valid for the duration of the call
     * @throws LinkException if the builder was already spawned
     */
    void spawn(RuntimeHandle handle);
}
