package io.tedge.actors.builder;

import io.tedge.actors.RuntimeRequest;
import io.tedge.actors.channel.Recipient;

/**
 * A builder of something that reacts to runtime requests.
 */
public interface RuntimeRequestSink {

    /**
     * @return the recipient used by the runtime to deliver {@link RuntimeRequest}s
     */
    Recipient<RuntimeRequest> signalSender();
}
