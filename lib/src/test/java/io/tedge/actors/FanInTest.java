package io.tedge.actors;

import io.tedge.actors.builder.LinkException;
import io.tedge.actors.channel.MailboxRecipient;
import io.tedge.actors.channel.Recipient;
import io.tedge.actors.mailbox.BoundedMailbox;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FanInTest {

    sealed interface Input extends Message permits Measurement, Command, Control {
    }

    record Measurement(Double value) implements Input, FanIn.Variant<Double> {
    }

    record Command(String value) implements Input, FanIn.Variant<String> {
    }

    record Control(RuntimeRequest value) implements Input, FanIn.Variant<RuntimeRequest> {
    }

    interface Unsealed extends Message {
    }

    private static FanIn<Input> inputFanIn() {
        return FanIn.of(Input.class, Control::new)
                .accept(Double.class, Measurement::new)
                .accept(String.class, Command::new)
                .build();
    }

    @Test
    void testKindsAreKeptInDeclarationOrder() {
        assertEquals(List.of(Double.class, String.class), List.copyOf(inputFanIn().kinds()));
        assertEquals(Input.class, inputFanIn().type());
    }

    @Test
    void testWrapAndNarrowAreInverse() {
        FanIn<Input> fanIn = inputFanIn();

        Input measurement = fanIn.wrap(21.5);
        Input command = fanIn.wrap("restart");

        assertEquals(new Measurement(21.5), measurement);
        assertEquals(new Command("restart"), command);
        assertEquals(Optional.of(21.5), fanIn.narrow(measurement, Double.class));
        assertEquals(Optional.empty(), fanIn.narrow(measurement, String.class));
        assertEquals(Optional.of("restart"), fanIn.narrow(command, String.class));
    }

    @Test
    void testControlVariantCarriesRuntimeRequests() {
        FanIn<Input> fanIn = inputFanIn();

        Input shutdown = fanIn.fromRequest(RuntimeRequest.SHUTDOWN);

        assertEquals(new Control(RuntimeRequest.SHUTDOWN), shutdown);
        assertEquals(Optional.of(RuntimeRequest.SHUTDOWN), fanIn.controlRequest(shutdown));
        assertTrue(fanIn.isShutdown(shutdown));
        assertFalse(fanIn.isShutdown(fanIn.wrap("shutdown")));
        assertEquals(shutdown, fanIn.wrap(RuntimeRequest.SHUTDOWN));
    }

    @Test
    void testWrapRejectsUndeclaredKinds() {
        assertThrows(IllegalArgumentException.class, () -> inputFanIn().wrap(42));
    }

    @Test
    void testBuildRejectsMissingVariants() {
        FanIn.Builder<Input> incomplete = FanIn.of(Input.class, Control::new)
                .accept(Double.class, Measurement::new);

        IllegalStateException e = assertThrows(IllegalStateException.class, incomplete::build);
        assertTrue(e.getMessage().contains("permits 3 variants"));
    }

    @Test
    void testBuildRejectsUnsealedEnvelopes() {
        FanIn.Builder<Unsealed> builder = FanIn.of(Unsealed.class, request -> new Unsealed() {
        });

        assertThrows(IllegalStateException.class, builder::build);
    }

    @Test
    void testAcceptRejectsDuplicatesAndTheControlKind() {
        FanIn.Builder<Input> builder = FanIn.of(Input.class, Control::new)
                .accept(Double.class, Measurement::new);

        assertThrows(IllegalArgumentException.class, () -> builder.accept(Double.class, Measurement::new));
        assertThrows(IllegalArgumentException.class, () -> builder.accept(RuntimeRequest.class, Control::new));
    }

    @Test
    void testRecipientForUndeclaredKindIsATypeMismatch() {
        FanIn<Input> fanIn = inputFanIn();
        Recipient<Input> inputs = MailboxRecipient.of(new BoundedMailbox<>("inputs", 4), Input.class);

        LinkException e = assertThrows(LinkException.class, () -> fanIn.recipientFor(inputs, Integer.class));
        assertEquals(LinkException.Reason.TYPE_MISMATCH, e.getReason());
        assertTrue(fanIn.accepts(Double.class));
        assertFalse(fanIn.accepts(Integer.class));
    }

    @Test
    void testIndependentProducersShareOneMailbox() throws Exception {
        FanIn<Input> fanIn = inputFanIn();
        BoundedMailbox<Input> mailbox = new BoundedMailbox<>("inputs", 8);
        Recipient<Input> inputs = MailboxRecipient.of(mailbox, Input.class);
        Recipient<Double> measurements = fanIn.recipientFor(inputs, Double.class);
        Recipient<String> commands = fanIn.recipientFor(inputs, String.class);
        Recipient<RuntimeRequest> signals = fanIn.signalRecipient(inputs);
        inputs.close();

        measurements.send(1.0);
        commands.send("reset");
        measurements.send(2.0);
        signals.send(RuntimeRequest.SHUTDOWN);
        measurements.close();
        commands.close();
        signals.close();

        assertEquals(Optional.of(new Measurement(1.0)), mailbox.receive());
        assertEquals(Optional.of(new Command("reset")), mailbox.receive());
        assertEquals(Optional.of(new Measurement(2.0)), mailbox.receive());
        assertEquals(Optional.of(new Control(RuntimeRequest.SHUTDOWN)), mailbox.receive());
        assertEquals(Optional.empty(), mailbox.receive());
    }
}
