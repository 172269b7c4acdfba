package io.tedge.actors.builder;

import io.tedge.actors.FanIn;
import io.tedge.actors.Message;
import io.tedge.actors.RuntimeRequest;
import io.tedge.actors.box.SimpleMessageBox;
import io.tedge.actors.channel.FanOutRecipient;
import io.tedge.actors.channel.InputClosingRecipient;
import io.tedge.actors.channel.MailboxRecipient;
import io.tedge.actors.channel.NullRecipient;
import io.tedge.actors.channel.Recipient;
import io.tedge.actors.mailbox.Mailbox;
import io.tedge.actors.mailbox.config.DefaultMailboxProvider;
import io.tedge.actors.mailbox.config.MailboxConfig;
import io.tedge.actors.mailbox.config.MailboxProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Builds a {@link SimpleMessageBox}: one input mailbox fed by any number of senders and one
 * output, either a single connected peer or several registered ones.
 *
 * <p>Links must all be established before {@link #build()}; afterwards every linking operation
 * fails with {@link LinkException.Reason#ALREADY_SPAWNED}.
 *
 * <p>Runtime requests reach the box through {@link #signalSender()}. When the input is a
 * {@link FanIn} envelope they are delivered in order with the other inputs; otherwise, unless the
 * input type is {@link RuntimeRequest} itself, a shutdown request closes the input.
 *
 * <p>The input reaches end-of-stream once every sender handed out by the builder is closed. A box
 * with a control path that was never given a producer keeps its input open for runtime requests
 * until the box itself is closed.
 *
 * @param <I> the input message type
 * @param <O> the output message type
 */
public class SimpleMessageBoxBuilder<I, O>
        implements PeerLinker<I, O>, MessageSink<I>, MessageSource<O>, RuntimeRequestSink, Builder<SimpleMessageBox<I, O>> {
    private static final Logger logger = LoggerFactory.getLogger(SimpleMessageBoxBuilder.class);

    private final String name;
    private final Class<I> inputType;
    private final Class<O> outputType;
    private final Mailbox<I> input;
    private final MailboxRecipient<I> inputSender;
    private final Function<? super RuntimeRequest, ? extends I> controlLift;
    private final Function<? super I, Optional<RuntimeRequest>> controlView;
    private final List<Recipient<? super O>> outputs = new ArrayList<>();
    private boolean connected;
    private boolean sendersHandedOut;
    private BuilderState state = BuilderState.BUILDING;

    /**
     * Creates a builder with a bounded input of default capacity.
     */
    public SimpleMessageBoxBuilder(String name, Class<I> inputType, Class<O> outputType) {
        this(name, inputType, outputType, MailboxConfig.DEFAULT_CAPACITY);
    }

    /**
     * Creates a builder with a bounded input.
     *
     * @param name the name of the box, used for logs
     * @param inputType token for the input type
     * @param outputType token for the output type
     * @param capacity input capacity, at least 1
     */
    public SimpleMessageBoxBuilder(String name, Class<I> inputType, Class<O> outputType, int capacity) {
        this(name, inputType, outputType, MailboxConfig.bounded(capacity), new DefaultMailboxProvider<>(),
                defaultControlLift(inputType), defaultControlView(inputType));
    }

    private SimpleMessageBoxBuilder(String name, Class<I> inputType, Class<O> outputType, MailboxConfig config,
                                    MailboxProvider<I> provider,
                                    Function<? super RuntimeRequest, ? extends I> controlLift,
                                    Function<? super I, Optional<RuntimeRequest>> controlView) {
        this.name = name;
        this.inputType = inputType;
        this.outputType = outputType;
        this.input = provider.createMailbox(name, config);
        this.inputSender = MailboxRecipient.of(input, inputType);
        this.controlLift = controlLift;
        this.controlView = controlView;
    }

    /**
     * Creates a builder whose input is a fan-in envelope, runtime requests included.
     *
     * @param name the name of the box
     * @param fanIn the envelope description
     * @param outputType token for the output type
     * @param config the input mailbox configuration
     * @param <I> the envelope type
     * @param <O> the output message type
     * @return a new builder
     */
    public static <I extends Message, O> SimpleMessageBoxBuilder<I, O> forFanIn(String name, FanIn<I> fanIn,
                                                                               Class<O> outputType,
                                                                               MailboxConfig config) {
        return new SimpleMessageBoxBuilder<>(name, fanIn.type(), outputType, config, new DefaultMailboxProvider<>(),
                fanIn::fromRequest, fanIn::controlRequest);
    }

    /**
     * Creates a builder with a custom input mailbox.
     */
    public static <I, O> SimpleMessageBoxBuilder<I, O> withMailbox(String name, Class<I> inputType, Class<O> outputType,
                                                                  MailboxConfig config, MailboxProvider<I> provider) {
        return new SimpleMessageBoxBuilder<>(name, inputType, outputType, config, provider,
                defaultControlLift(inputType), defaultControlView(inputType));
    }

    private static <I> Function<RuntimeRequest, I> defaultControlLift(Class<I> inputType) {
        if (inputType == RuntimeRequest.class) {
            return inputType::cast;
        }
        return null;
    }

    private static <I> Function<I, Optional<RuntimeRequest>> defaultControlView(Class<I> inputType) {
        return message -> message instanceof RuntimeRequest request ? Optional.of(request) : Optional.empty();
    }

    @Override
    public Recipient<I> connect(Recipient<O> output) {
        ensureNotSpawned();
        if (connected) {
            throw LinkException.alreadyLinked(name);
        }
        addOutput(output);
        connected = true;
        return sender();
    }

    /**
     * Connects this box as a client of a peer: the peer's input becomes this box's output and this
     * box's input receives the peer's responses.
     *
     * @param peer the peer to connect to
     * @return this builder
     */
    public SimpleMessageBoxBuilder<I, O> withConnection(PeerLinker<O, I> peer) {
        ensureNotSpawned();
        if (connected) {
            throw LinkException.alreadyLinked(name);
        }
        Recipient<I> responses = sender();
        Recipient<O> requests;
        try {
            requests = peer.connect(responses);
            addOutput(requests);
        } catch (LinkException e) {
            responses.close();
            throw e;
        }
        connected = true;
        return this;
    }

    @Override
    public void registerPeer(Recipient<? super O> peer) {
        ensureNotSpawned();
        addOutput(peer);
    }

    private void addOutput(Recipient<? super O> peer) {
        if (!peer.messageType().isAssignableFrom(outputType)) {
            throw LinkException.typeMismatch(name, outputType, peer.messageType());
        }
        outputs.add(peer);
        state = BuilderState.LINKED;
    }

    @Override
    public Recipient<I> sender() {
        ensureNotSpawned();
        state = BuilderState.LINKED;
        sendersHandedOut = true;
        return inputSender.clone();
    }

    @Override
    public Recipient<RuntimeRequest> signalSender() {
        ensureNotSpawned();
        if (controlLift == null) {
            return new InputClosingRecipient(input);
        }
        return MailboxRecipient.control(input, inputType).adapt(RuntimeRequest.class, controlLift);
    }

    @Override
    public SimpleMessageBox<I, O> build() {
        ensureNotSpawned();
        state = BuilderState.SPAWNED;
        if (sendersHandedOut || controlLift == null) {
            inputSender.close();
        } else {
            logger.debug("Box {} has no producer, its input stays open for runtime requests", name);
        }
        Recipient<O> output = buildOutput();
        logger.debug("Built box {} with {} output peer(s)", name, outputs.size());
        return new SimpleMessageBox<>(name, input, output, controlView);
    }

    @SuppressWarnings("unchecked")
    private Recipient<O> buildOutput() {
        if (outputs.isEmpty()) {
            return new NullRecipient<>();
        }
        if (outputs.size() == 1) {
            // addOutput checked that the peer accepts O
            return (Recipient<O>) outputs.get(0);
        }
        return new FanOutRecipient<>(outputType, outputs);
    }

    private void ensureNotSpawned() {
        if (state == BuilderState.SPAWNED) {
            throw LinkException.alreadySpawned(name);
        }
    }

    public String name() {
        return name;
    }

    public BuilderState state() {
        return state;
    }

    public Class<I> inputType() {
        return inputType;
    }

    public Class<O> outputType() {
        return outputType;
    }
}
