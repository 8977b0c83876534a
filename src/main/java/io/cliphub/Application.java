package io.cliphub;

import io.cliphub.config.impl.HubConfig;
import io.cliphub.config.type.ConfigLoader;
import io.cliphub.envelope.Envelopes;
import io.cliphub.hub.Hub;
import io.cliphub.selection.SelectionEngine;
import io.cliphub.selection.buffer.ExternalCommand;
import io.cliphub.selection.buffer.XselSelectionBuffer;
import io.cliphub.transport.impl.RestRouter;
import io.cliphub.transport.type.NettyTransport;
import io.cliphub.upstream.UpstreamBridge;
import io.cliphub.upstream.client.NettyUpstreamConnector;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CountDownLatch;

/**
 * Main class to start the cliphub server.
 */
@Slf4j
public class Application {
    public static void main(final String[] args) throws Exception {
        if (args.length > 1) {
            System.err.println("Usage: java -jar cliphub.jar [cliphub.yaml]");
            System.exit(1);
        }

        /* Load settings; the bundled defaults apply without an argument */
        final HubConfig cfg = args.length == 1
                ? ConfigLoader.load(args[0])
                : ConfigLoader.loadDefault(System::getenv);

        final Envelopes envelopes = new Envelopes();
        final Hub hub = new Hub(envelopes, cfg.getBusCapacity(), cfg.getOutboundQueueCapacity());

        /* Selection mirroring */
        final ExternalCommand command = new ExternalCommand(cfg.getKillGrace());
        final SelectionEngine engine = new SelectionEngine(hub,
                new XselSelectionBuffer(cfg.xsel(), command), envelopes, cfg.selectionSettings());

        /* Upstream mesh link */
        final NettyUpstreamConnector connector = new NettyUpstreamConnector();
        final UpstreamBridge bridge = new UpstreamBridge(hub, connector, envelopes, cfg.upstreamSettings());

        hub.addListener(engine);
        hub.addListener(bridge);
        hub.start();
        engine.start();
        bridge.start();

        final NettyTransport transport = new NettyTransport(cfg.getBindAddress(), cfg.getBindPort(),
                cfg.getWsPath(), hub, new RestRouter(hub, engine, bridge));
        transport.start();

        final CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down cliphub");
            bridge.close();
            connector.close();
            engine.close();
            command.close();
            transport.stop();
            hub.close();
            stopped.countDown();
        }, "cliphub-shutdown"));

        log.info("cliphub started on {}:{}", cfg.getBindAddress(), transport.getPort());
        stopped.await();
    }
}
