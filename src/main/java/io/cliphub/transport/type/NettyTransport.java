package io.cliphub.transport.type;

import io.cliphub.hub.Hub;
import io.cliphub.transport.impl.HttpRequestHandler;
import io.cliphub.transport.impl.RequestRouter;
import io.cliphub.transport.impl.RestRouter;
import io.cliphub.transport.impl.WebSocketFrameHandler;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.IoHandlerFactory;
import io.netty.channel.MultiThreadIoEventLoopGroup;
import io.netty.channel.nio.NioIoHandler;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.flush.FlushConsolidationHandler;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

/**
 * HTTP server on one port: REST routes plus the WebSocket endpoint at {@code wsPath}.
 */
@Slf4j
public class NettyTransport {

    private static final int MAX_CONTENT_BYTES = 16 * 1024 * 1024;

    private final String host;
    @Getter private int port;
    private final String wsPath;
    private final Hub hub;
    private final RestRouter restRouter;
    private final RequestRouter requestRouter;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public NettyTransport(final String host,
                          final int port,
                          final String wsPath,
                          final Hub hub,
                          final RestRouter restRouter) {
        this.host = host;
        this.port = port;
        this.wsPath = wsPath;
        this.hub = hub;
        this.restRouter = restRouter;
        this.requestRouter = new RequestRouter(hub);
    }

    public void start() throws InterruptedException {
        final IoHandlerFactory factory = NioIoHandler.newFactory();

        /*
         * 1 boss thread accepts connections; worker threads default to availableProcessors * 2.
         * Frame writes happen on per-connection sender threads, never on these.
         */
        bossGroup = new MultiThreadIoEventLoopGroup(1, factory);
        workerGroup = new MultiThreadIoEventLoopGroup(0, factory);

        final ServerBootstrap b = new ServerBootstrap();
        b.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(final SocketChannel ch) {
                        final ChannelPipeline p = ch.pipeline();

                        p.addLast(new FlushConsolidationHandler(256, true));

                        /* HTTP/1.1 with whole-message aggregation, then the upgrade path */
                        p.addLast(new HttpServerCodec());
                        p.addLast(new HttpObjectAggregator(MAX_CONTENT_BYTES));
                        p.addLast(new HttpRequestHandler(wsPath, restRouter));
                        p.addLast(new WebSocketServerProtocolHandler(wsPath, null, false, MAX_CONTENT_BYTES));

                        /* Per-channel state: one hub connection each */
                        p.addLast(new WebSocketFrameHandler(hub, requestRouter));
                    }
                })

                /*
                 * TCP_NODELAY: small frames go out immediately.
                 * SO_KEEPALIVE: detect dead peers at TCP level.
                 */
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true);

        final ChannelFuture f = b.bind(host, port).sync();
        serverChannel = f.channel();
        port = ((InetSocketAddress) serverChannel.localAddress()).getPort();
        log.info("Netty transport listening on http://{}:{} (WebSocket {})", host, port, wsPath);
    }

    public void stop() {
        if (serverChannel != null) serverChannel.close().syncUninterruptibly();
        if (bossGroup != null) bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
        if (workerGroup != null) workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
        log.info("Netty transport stopped");
    }
}
