package io.tedge.actors;

/**
 * Marker for values exchanged between actors.
 *
 * <p>Messages cross thread boundaries, so implementations should be immutable. Records are the
 * natural fit. Builders and recipients accept any type; the marker only constrains fan-in
 * envelopes built with {@link FanIn}.
 */
public interface Message {
}
