package io.tedge.actors.test;

import io.tedge.actors.channel.Recipient;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(10)
class TestProbeTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    @Test
    void testExpectMessage() throws Exception {
        TestProbe<String> probe = TestProbe.create("probe", String.class);
        Recipient<String> sender = probe.sender();
        sender.send("hello");

        assertEquals("hello", probe.expectMessage(TIMEOUT));
    }

    @Test
    void testExpectMessageFailsWithoutMessage() {
        TestProbe<String> probe = TestProbe.create("probe", String.class);

        AssertionError error = assertThrows(AssertionError.class,
                () -> probe.expectMessage(Duration.ofMillis(50)));
        assertTrue(error.getMessage().contains("probe"));
    }

    @Test
    void testExpectMessageOfType() throws Exception {
        TestProbe<Object> probe = TestProbe.create("probe", Object.class);
        Recipient<Object> sender = probe.sender();
        sender.send(42);
        sender.send("not a number");

        assertEquals(42, probe.expectMessage(Integer.class, TIMEOUT));
        assertThrows(AssertionError.class, () -> probe.expectMessage(Integer.class, TIMEOUT));
    }

    @Test
    void testExpectMessageMatching() throws Exception {
        TestProbe<String> probe = TestProbe.create("probe", String.class);
        Recipient<String> sender = probe.sender();
        sender.send("temperature 21.5");
        sender.send("pressure 1013");

        assertEquals("temperature 21.5", probe.expectMessage(m -> m.startsWith("temperature"), TIMEOUT));
        assertThrows(AssertionError.class, () -> probe.expectMessage(m -> m.startsWith("temperature"), TIMEOUT));
    }

    @Test
    void testExpectMessagesKeepsArrivalOrder() throws Exception {
        TestProbe<Integer> probe = TestProbe.create("probe", Integer.class);
        Recipient<Integer> sender = probe.sender();
        for (int i = 0; i < 5; i++) {
            sender.send(i);
        }

        assertEquals(List.of(0, 1, 2, 3, 4), probe.expectMessages(5, TIMEOUT));
    }

    @Test
    void testExpectMessagesFailsWhenTooFewArrive() throws Exception {
        TestProbe<Integer> probe = TestProbe.create("probe", Integer.class);
        probe.sender().send(1);

        AssertionError error = assertThrows(AssertionError.class,
                () -> probe.expectMessages(2, Duration.ofMillis(100)));
        assertTrue(error.getMessage().contains("[1]"));
    }

    @Test
    void testExpectNoMessage() throws Exception {
        TestProbe<String> probe = TestProbe.create("probe", String.class);
        probe.expectNoMessage(Duration.ofMillis(50));

        probe.sender().send("unexpected");
        assertThrows(AssertionError.class, () -> probe.expectNoMessage(Duration.ofMillis(50)));
    }

    @Test
    void testEndOfStreamOnceEverySenderIsClosed() throws Exception {
        TestProbe<String> probe = TestProbe.create("probe", String.class);
        Recipient<String> first = probe.sender();
        Recipient<String> second = probe.sender();
        first.send("last words");
        first.close();

        assertThrows(AssertionError.class, () -> probe.expectEndOfStream(Duration.ofMillis(50)));
        assertThrows(AssertionError.class, () -> probe.expectEndOfStream(Duration.ofMillis(50)));

        second.close();
        probe.expectEndOfStream(TIMEOUT);
    }

    @Test
    void testReceiveMessageAndReceivedMessages() throws Exception {
        TestProbe<String> probe = TestProbe.create("probe", String.class);
        assertEquals(Optional.empty(), probe.receiveMessage(Duration.ofMillis(20)));

        Recipient<String> sender = probe.sender();
        sender.send("a");
        sender.send("b");
        sender.send("c");

        assertEquals(Optional.of("a"), probe.receiveMessage(TIMEOUT));
        assertEquals(List.of("b", "c"), probe.receivedMessages());
        assertEquals(List.of(), probe.receivedMessages());
    }
}
