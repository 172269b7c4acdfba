package io.tedge.actors;

import io.tedge.actors.box.MessageBox;
import io.tedge.actors.channel.Recipient;

/**
 * Capability to register an actor with a {@link Runtime}.
 *
 * <p>A handle is given to {@link io.tedge.actors.builder.ActorBuilder#spawn(RuntimeHandle)} and
 * is only valid for the duration of that call.
 */
public final class RuntimeHandle {

    private final Runtime runtime;
    private volatile boolean valid = true;

    RuntimeHandle(Runtime runtime) {
        this.runtime = runtime;
    }

    /**
     * Starts an actor.
     *
     * @param actor the actor to run
     * @param signalSender where the runtime delivers {@link RuntimeRequest}s to this actor
     * @param box the channels owned by the actor, closed once it returns; may be null
     * @throws IllegalStateException if the handle is no longer valid or the runtime has completed
     */
    public void spawn(Actor actor, Recipient<RuntimeRequest> signalSender, MessageBox box) {
        if (!valid) {
            throw new IllegalStateException("Runtime handle used outside of the spawn call, cannot start " + actor.name());
        }
        runtime.register(actor, signalSender, box);
    }

    /**
     * Starts an actor that owns no message box.
     */
    public void spawn(Actor actor, Recipient<RuntimeRequest> signalSender) {
        spawn(actor, signalSender, null);
    }

    void invalidate() {
        valid = false;
    }
}
