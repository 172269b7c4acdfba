package io.tedge.actors.converter;

import io.tedge.actors.FanIn;
import io.tedge.actors.Message;
import io.tedge.actors.RuntimeHandle;
import io.tedge.actors.RuntimeRequest;
import io.tedge.actors.builder.ActorBuilder;
import io.tedge.actors.builder.Builder;
import io.tedge.actors.builder.MessageSink;
import io.tedge.actors.builder.MessageSource;
import io.tedge.actors.builder.PeerLinker;
import io.tedge.actors.builder.RuntimeRequestSink;
import io.tedge.actors.builder.SimpleMessageBoxBuilder;
import io.tedge.actors.channel.Recipient;
import io.tedge.actors.mailbox.config.MailboxConfig;

/**
 * Builds a {@link ConvertingActor}.
 *
 * @param <I> the input type
 * @param <O> the output type
 */
public class ConvertingActorBuilder<I, O>
        implements ActorBuilder, PeerLinker<I, O>, MessageSink<I>, MessageSource<O>, RuntimeRequestSink,
        Builder<ConvertingActor<I, O>> {

    private final String name;
    private final Converter<I, O> converter;
    private final SimpleMessageBoxBuilder<I, O> boxBuilder;

    private ConvertingActorBuilder(String name, Converter<I, O> converter, SimpleMessageBoxBuilder<I, O> boxBuilder) {
        this.name = name;
        this.converter = converter;
        this.boxBuilder = boxBuilder;
    }

    /**
     * A converter whose input closes on shutdown: queued inputs are converted before it stops.
     */
    public static <I, O> ConvertingActorBuilder<I, O> of(String name, Converter<I, O> converter,
                                                         Class<I> inputType, Class<O> outputType) {
        return new ConvertingActorBuilder<>(name, converter,
                new SimpleMessageBoxBuilder<>(name, inputType, outputType, MailboxConfig.DEFAULT_CAPACITY));
    }

    /**
     * A converter reading a fan-in envelope: the shutdown request is processed in order with the
     * other inputs.
     */
    public static <I extends Message, O> ConvertingActorBuilder<I, O> of(String name, Converter<I, O> converter,
                                                                         FanIn<I> fanIn, Class<O> outputType) {
        return new ConvertingActorBuilder<>(name, converter,
                SimpleMessageBoxBuilder.forFanIn(name, fanIn, outputType, MailboxConfig.bounded(MailboxConfig.DEFAULT_CAPACITY)));
    }

    @Override
    public String name() {
        return name;
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
    public ConvertingActor<I, O> build() {
        return new ConvertingActor<>(name, converter, boxBuilder.build());
    }

    @Override
    public void spawn(RuntimeHandle handle) {
        Recipient<RuntimeRequest> signal = boxBuilder.signalSender();
        ConvertingActor<I, O> actor = build();
        handle.spawn(actor, signal, actor.box());
    }
}
