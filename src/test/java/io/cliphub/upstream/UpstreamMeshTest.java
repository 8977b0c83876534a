package io.cliphub.upstream;

import io.cliphub.connection.Connection;
import io.cliphub.core.model.BusMessage;
import io.cliphub.core.model.DataItem;
import io.cliphub.core.model.Source;
import io.cliphub.envelope.Envelopes;
import io.cliphub.hub.Hub;
import io.cliphub.protocol.Frame;
import io.cliphub.selection.Selection;
import io.cliphub.selection.SelectionEngine;
import io.cliphub.selection.buffer.ExternalCommand;
import io.cliphub.selection.buffer.XselSelectionBuffer;
import io.cliphub.testing.RecordingSink;
import io.cliphub.transport.impl.RestRouter;
import io.cliphub.transport.type.NettyTransport;
import io.cliphub.upstream.client.NettyUpstreamConnector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Two hubs over loopback: hub B bridges to hub A.
 */
final class UpstreamMeshTest {

    private final ExternalCommand command = new ExternalCommand(Duration.ofMillis(100));
    private Hub hubA;
    private Hub hubB;
    private NettyTransport transportA;
    private NettyUpstreamConnector connector;
    private UpstreamBridge bridgeB;

    @BeforeEach
    void setUp() throws Exception {
        hubA = new Hub(new Envelopes(), 64, 16);
        hubA.start();
        final SelectionEngine idle = new SelectionEngine(hubA,
                new XselSelectionBuffer(Path.of("/nonexistent/xsel"), command), hubA.getEnvelopes(),
                new SelectionEngine.Settings(false, Map.of("c", Selection.CLIPBOARD),
                        Duration.ofMillis(50), Duration.ofMillis(50), Duration.ofMillis(50), 4));
        final UpstreamBridge noBridge = new UpstreamBridge(hubA, (uri, onText, timeout) -> {
            throw new UnsupportedOperationException();
        }, hubA.getEnvelopes(), new UpstreamBridge.Settings(false, URI.create("ws://unused:1/ws"),
                List.of(), Duration.ofSeconds(1), Duration.ofSeconds(1)));
        transportA = new NettyTransport("127.0.0.1", 0, "/ws", hubA, new RestRouter(hubA, idle, noBridge));
        transportA.start();

        hubB = new Hub(new Envelopes(), 64, 16);
        connector = new NettyUpstreamConnector();
        bridgeB = new UpstreamBridge(hubB, connector, hubB.getEnvelopes(), new UpstreamBridge.Settings(true,
                URI.create("ws://127.0.0.1:" + transportA.getPort() + "/ws"), List.of("c", "p", "s"),
                Duration.ofMillis(50), Duration.ofSeconds(2)));
        hubB.addListener(bridgeB);
        hubB.start();
        bridgeB.start();

        final long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (System.nanoTime() < deadline
                && !(bridgeB.isConnected() && hubA.snapshot().get().topics().containsAll(List.of("c", "p", "s")))) {
            Thread.sleep(10);
        }
        assertTrue(bridgeB.isConnected(), "bridge did not connect");
    }

    @AfterEach
    void tearDown() {
        bridgeB.close();
        connector.close();
        transportA.stop();
        hubB.close();
        hubA.close();
        command.close();
    }

    private static Object valueOf(final Frame frame) {
        return assertInstanceOf(Frame.Broadcast.class, frame).data().get(0).value();
    }

    @Test
    void localPublishReachesPeerSubscribers() throws Exception {
        final RecordingSink onA = new RecordingSink();
        final Connection a = hubA.attach(onA);
        hubA.subscribe(a, List.of("c")).get(2, TimeUnit.SECONDS);

        hubB.submit(new BusMessage(Source.NONE, null, List.of(DataItem.of("c", "from-b"))));

        assertEquals("from-b", valueOf(onA.next()));
        assertEquals("from-b", hubA.get("c").get(2, TimeUnit.SECONDS).orElseThrow().value());
    }

    @Test
    void peerUpdatesArriveOnceAndAreNotReflected() throws Exception {
        final RecordingSink onB = new RecordingSink();
        final Connection b = hubB.attach(onB);
        hubB.subscribe(b, List.of("p")).get(2, TimeUnit.SECONDS);

        hubA.submit(new BusMessage(Source.NONE, null, List.of(DataItem.of("p", "from-a"))));
        assertEquals("from-a", valueOf(onB.next()));

        hubB.submit(new BusMessage(Source.NONE, null, List.of(DataItem.of("p", "from-b"))));
        assertEquals("from-b", valueOf(onB.next()));

        /* A suppresses the echo to the bridge connection, so B sees its own update only once */
        assertNull(onB.poll(200));
    }
}
