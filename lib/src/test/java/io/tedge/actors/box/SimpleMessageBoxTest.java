package io.tedge.actors.box;

import io.tedge.actors.RuntimeRequest;
import io.tedge.actors.channel.MailboxRecipient;
import io.tedge.actors.mailbox.BoundedMailbox;
import io.tedge.actors.mailbox.UnboundedMailbox;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SimpleMessageBoxTest {

    private static SimpleMessageBox<RuntimeRequest, String> controlledBox(BoundedMailbox<RuntimeRequest> input,
                                                                          UnboundedMailbox<String> output) {
        return new SimpleMessageBox<>("box", input, MailboxRecipient.of(output, String.class),
                message -> Optional.of(message));
    }

    @Test
    void testReceiveWithTimeoutReturnsEmptyWhenNothingArrives() throws Exception {
        SimpleMessageBox<RuntimeRequest, String> box =
                controlledBox(new BoundedMailbox<>("input", 2), new UnboundedMailbox<>("output"));

        assertEquals(Optional.empty(), box.receive(Duration.ofMillis(20)));
        assertFalse(box.isInputClosed());
    }

    @Test
    void testReceiveMessageStopsAtShutdownRequest() throws Exception {
        BoundedMailbox<RuntimeRequest> input = new BoundedMailbox<>("input", 2);
        SimpleMessageBox<RuntimeRequest, String> box = controlledBox(input, new UnboundedMailbox<>("output"));

        input.send(RuntimeRequest.SHUTDOWN);

        assertEquals(Optional.empty(), box.receiveMessage());
        assertTrue(box.controlRequest(RuntimeRequest.SHUTDOWN).isPresent());
    }

    @Test
    void testCloseOutputEndsTheDownstreamStream() throws Exception {
        UnboundedMailbox<String> output = new UnboundedMailbox<>("output");
        SimpleMessageBox<RuntimeRequest, String> box = controlledBox(new BoundedMailbox<>("input", 2), output);

        box.setLoggingOn(false);
        box.send("quiet");
        box.closeOutput();

        assertFalse(box.isLoggingOn());
        assertEquals(Optional.of("quiet"), output.receive());
        assertEquals(Optional.empty(), output.receive());
        assertFalse(box.isInputClosed());
    }

    @Test
    void testCloseClosesInputAndOutput() throws Exception {
        BoundedMailbox<RuntimeRequest> input = new BoundedMailbox<>("input", 2);
        UnboundedMailbox<String> output = new UnboundedMailbox<>("output");
        SimpleMessageBox<RuntimeRequest, String> box = controlledBox(input, output);

        box.close();
        box.close();

        assertTrue(box.isInputClosed());
        assertTrue(output.isClosed());
        assertEquals(Optional.empty(), box.receive());
    }
}
