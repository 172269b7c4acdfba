package io.tedge.actors.builder;

import io.tedge.actors.Actor;
import io.tedge.actors.RuntimeHandle;
import io.tedge.actors.RuntimeRequest;
import io.tedge.actors.box.SimpleMessageBox;
import io.tedge.actors.channel.Recipient;

import java.util.function.Function;

/**
 * Actor builder pairing a {@link SimpleMessageBoxBuilder} with a factory for the actor consuming
 * the built box.
 *
 * <pre>{@code
 * SimpleActorBuilder<String, String> upper = new SimpleActorBuilder<>(
 *         new SimpleMessageBoxBuilder<>("Upper", String.class, String.class),
 *         box -> new UpperCaseActor(box));
 * }</pre>
 *
 * @param <I> the input message type
 * @param <O> the output message type
 */
public class SimpleActorBuilder<I, O>
        implements ActorBuilder, PeerLinker<I, O>, MessageSink<I>, MessageSource<O>, RuntimeRequestSink, Builder<Actor> {

    private final SimpleMessageBoxBuilder<I, O> boxBuilder;
    private final Function<? super SimpleMessageBox<I, O>, ? extends Actor> factory;
    private SimpleMessageBox<I, O> box;

    public SimpleActorBuilder(SimpleMessageBoxBuilder<I, O> boxBuilder,
                              Function<? super SimpleMessageBox<I, O>, ? extends Actor> factory) {
        this.boxBuilder = boxBuilder;
        this.factory = factory;
    }

    @Override
    public String name() {
        return boxBuilder.name();
    }

    @Override
    public Recipient<I> connect(Recipient<O> output) {
        return boxBuilder.connect(output);
    }

    @Override
    public Recipient<I> sender() {
        return boxBuilder.sender();
    }

    @Override
    public void registerPeer(Recipient<? super O> peer) {
        boxBuilder.registerPeer(peer);
    }

    @Override
    public Recipient<RuntimeRequest> signalSender() {
        return boxBuilder.signalSender();
    }

    @Override
    public Actor build() {
        box = boxBuilder.build();
        return factory.apply(box);
    }

    @Override
    public void spawn(RuntimeHandle handle) {
        Recipient<RuntimeRequest> signal = boxBuilder.signalSender();
        Actor actor = build();
        handle.spawn(actor, signal, box);
    }

    public BuilderState state() {
        return boxBuilder.state();
    }
}
