package io.tedge.actors;

import io.tedge.actors.builder.LinkException;
import io.tedge.actors.channel.Recipient;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Describes an envelope type collecting several independent message kinds into one mailbox.
 *
 * <p>The envelope is a sealed interface with one record per kind, each record implementing
 * {@link Variant}. The runtime control variant is always present so that every actor reading the
 * envelope can observe {@link RuntimeRequest#SHUTDOWN}:
 *
 * <pre>{@code
 * sealed interface Input extends Message permits Measurement, Command, Control {}
 * record Measurement(Double value) implements Input, FanIn.Variant<Double> {}
 * record Command(String value) implements Input, FanIn.Variant<String> {}
 * record Control(RuntimeRequest value) implements Input, FanIn.Variant<RuntimeRequest> {}
 *
 * FanIn<Input> input = FanIn.of(Input.class, Control::new)
 *         .accept(Double.class, Measurement::new)
 *         .accept(String.class, Command::new)
 *         .build();
 * }</pre>
 *
 * <p>{@link Builder#build()} checks that every permitted subclass of the envelope is declared, so
 * a kind added to the envelope but not to the fan-in fails fast.
 *
 * @param <M> the envelope type
 */
public final class FanIn<M extends Message> {

    /**
     * Envelope variant carrying a single value.
     *
     * @param <V> the carried kind
     */
    public interface Variant<V> {
        V value();
    }

    private final Class<M> type;
    private final Function<RuntimeRequest, ? extends M> control;
    private final Map<Class<?>, Function<Object, ? extends M>> wrappers;

    private FanIn(Class<M> type, Function<RuntimeRequest, ? extends M> control,
                  Map<Class<?>, Function<Object, ? extends M>> wrappers) {
        this.type = type;
        this.control = control;
        this.wrappers = Collections.unmodifiableMap(wrappers);
    }

    /**
     * Starts the description of an envelope.
     *
     * @param type the sealed envelope interface
     * @param control lifts runtime requests into the envelope
     * @param <M> the envelope type
     * @return a builder
     */
    public static <M extends Message> Builder<M> of(Class<M> type, Function<RuntimeRequest, ? extends M> control) {
        return new Builder<>(type, control);
    }

    /**
     * Wraps a value of one of the declared kinds.
     *
     * @param value the value to wrap
     * @return the envelope carrying it
     * @throws IllegalArgumentException if the value is not of a declared kind
     */
    public M wrap(Object value) {
        if (value instanceof RuntimeRequest request) {
            return fromRequest(request);
        }
        Function<Object, ? extends M> wrapper = wrapperFor(value.getClass());
        if (wrapper == null) {
            throw new IllegalArgumentException(value.getClass().getName() + " is not a kind of " + type.getSimpleName());
        }
        return wrapper.apply(value);
    }

    private Function<Object, ? extends M> wrapperFor(Class<?> kind) {
        Function<Object, ? extends M> wrapper = wrappers.get(kind);
        if (wrapper != null) {
            return wrapper;
        }
        for (Map.Entry<Class<?>, Function<Object, ? extends M>> entry : wrappers.entrySet()) {
            if (entry.getKey().isAssignableFrom(kind)) {
                return entry.getValue();
            }
        }
        return null;
    }

    /**
     * @param request the runtime request
     * @return the control variant carrying it
     */
    public M fromRequest(RuntimeRequest request) {
        return control.apply(request);
    }

    /**
     * Extracts the value carried by an envelope when it is of the given kind.
     *
     * @param message the envelope
     * @param kind the expected kind
     * @param <V> the expected kind
     * @return the carried value, or empty for another kind
     */
    public <V> Optional<V> narrow(M message, Class<V> kind) {
        if (message instanceof Variant<?> variant && kind.isInstance(variant.value())) {
            return Optional.of(kind.cast(variant.value()));
        }
        return Optional.empty();
    }

    /**
     * @param message the envelope
     * @return the runtime request carried by a control variant, empty otherwise
     */
    public Optional<RuntimeRequest> controlRequest(M message) {
        return narrow(message, RuntimeRequest.class);
    }

    /**
     * @param message the envelope
     * @return true if the envelope carries a shutdown request
     */
    public boolean isShutdown(M message) {
        return controlRequest(message).filter(request -> request == RuntimeRequest.SHUTDOWN).isPresent();
    }

    /**
     * Adapts a recipient of envelopes into a recipient of one declared kind.
     *
     * @param recipient where envelopes are delivered
     * @param kind the kind accepted by the returned recipient
     * @param <V> the kind
     * @return a recipient wrapping every value before delivery
     * @throws LinkException if the kind is not declared
     */
    public <V> Recipient<V> recipientFor(Recipient<M> recipient, Class<V> kind) {
        if (kind != RuntimeRequest.class && wrapperFor(kind) == null) {
            throw LinkException.typeMismatch(type.getSimpleName(), type, kind);
        }
        return recipient.adapt(kind, this::wrap);
    }

    /**
     * Adapts a recipient of envelopes into the recipient the runtime uses for control requests.
     *
     * @param recipient where envelopes are delivered
     * @return a recipient of runtime requests
     */
    public Recipient<RuntimeRequest> signalRecipient(Recipient<M> recipient) {
        return recipient.adapt(RuntimeRequest.class, control);
    }

    /**
     * @param kind a message kind
     * @return true if values of that kind can be wrapped
     */
    public boolean accepts(Class<?> kind) {
        return kind == RuntimeRequest.class || wrapperFor(kind) != null;
    }

    /**
     * @return the declared kinds, in declaration order, without the control kind
     */
    public Set<Class<?>> kinds() {
        return wrappers.keySet();
    }

    /**
     * @return the envelope type
     */
    public Class<M> type() {
        return type;
    }

    /**
     * Collects the kinds of an envelope.
     *
     * @param <M> the envelope type
     */
    public static final class Builder<M extends Message> {
        private final Class<M> type;
        private final Function<RuntimeRequest, ? extends M> control;
        private final Map<Class<?>, Function<Object, ? extends M>> wrappers = new LinkedHashMap<>();

        private Builder(Class<M> type, Function<RuntimeRequest, ? extends M> control) {
            this.type = type;
            this.control = control;
        }

        /**
         * Declares a kind.
         *
         * @param kind the value type
         * @param wrapper builds the variant carrying a value
         * @param <V> the value type
         * @return this builder
         * @throws IllegalArgumentException if the kind is already declared or is the control kind
         */
        public <V> Builder<M> accept(Class<V> kind, Function<? super V, ? extends M> wrapper) {
            if (kind == RuntimeRequest.class) {
                throw new IllegalArgumentException("The control kind is declared by FanIn.of");
            }
            if (wrappers.containsKey(kind)) {
                throw new IllegalArgumentException(kind.getName() + " is declared twice for " + type.getSimpleName());
            }
            wrappers.put(kind, value -> wrapper.apply(kind.cast(value)));
            return this;
        }

        /**
         * @return the fan-in description
         * @throws IllegalStateException if the envelope is not a sealed interface whose permitted
         *                               subclasses match the declared kinds plus the control kind
         */
        public FanIn<M> build() {
            if (!type.isInterface() || !type.isSealed()) {
                throw new IllegalStateException(type.getName() + " must be a sealed interface");
            }
            int variants = type.getPermittedSubclasses().length;
            if (variants != wrappers.size() + 1) {
                throw new IllegalStateException(type.getName() + " permits " + variants
                        + " variants but " + (wrappers.size() + 1) + " kinds are declared, control included");
            }
            return new FanIn<>(type, control, new LinkedHashMap<>(wrappers));
        }
    }
}
