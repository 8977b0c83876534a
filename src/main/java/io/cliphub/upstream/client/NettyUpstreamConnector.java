package io.cliphub.upstream.client;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.IoHandlerFactory;
import io.netty.channel.MultiThreadIoEventLoopGroup;
import io.netty.channel.nio.NioIoHandler;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.nio.channels.ClosedChannelException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Netty WebSocket client for hub-to-hub links. One I/O thread serves every session it creates.
 */
@Slf4j
public final class NettyUpstreamConnector implements UpstreamConnector, AutoCloseable {

    private static final int MAX_FRAME_BYTES = 16 * 1024 * 1024;

    private final EventLoopGroup group;

    public NettyUpstreamConnector() {
        final IoHandlerFactory factory = NioIoHandler.newFactory();
        this.group = new MultiThreadIoEventLoopGroup(1, factory);
    }

    @Override
    public UpstreamSession connect(final URI uri, final Consumer<String> onText, final Duration timeout)
            throws IOException, InterruptedException {
        final String scheme = uri.getScheme() == null ? "ws" : uri.getScheme();
        if (!"ws".equalsIgnoreCase(scheme)) {
            throw new IOException("Unsupported upstream scheme: " + scheme);
        }
        final int port = uri.getPort() == -1 ? 80 : uri.getPort();

        final WebSocketClientHandshaker handshaker = WebSocketClientHandshakerFactory.newHandshaker(
                uri, WebSocketVersion.V13, null, false, new DefaultHttpHeaders(), MAX_FRAME_BYTES);
        final UpstreamClientHandler handler = new UpstreamClientHandler(handshaker, onText);

        final Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) timeout.toMillis())
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(final SocketChannel ch) {
                        ch.pipeline()
                                .addLast(new HttpClientCodec())
                                .addLast(new HttpObjectAggregator(MAX_FRAME_BYTES))
                                .addLast(handler);
                    }
                });

        final ChannelFuture connect = bootstrap.connect(uri.getHost(), port);
        if (!connect.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            connect.cancel(true);
            throw new IOException("Timed out connecting to " + uri);
        }
        if (!connect.isSuccess()) {
            throw new IOException("Cannot connect to " + uri, connect.cause());
        }

        final Channel channel = connect.channel();
        final ChannelFuture handshake = handler.handshakeFuture();
        if (!handshake.await(timeout.toMillis(), TimeUnit.MILLISECONDS) || !handshake.isSuccess()) {
            channel.close();
            throw new IOException("WebSocket handshake with " + uri + " failed", handshake.cause());
        }

        log.debug("Connected to {}", uri);
        return new NettySession(channel);
    }

    @Override
    public void close() {
        group.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
    }

    private static final class NettySession implements UpstreamSession {
        private final Channel channel;

        NettySession(final Channel channel) {
            this.channel = channel;
        }

        @Override
        public void send(final String text) throws IOException {
            if (!channel.isActive()) throw new ClosedChannelException();

            channel.writeAndFlush(new TextWebSocketFrame(text)).addListener(f -> {
                if (!f.isSuccess()) {
                    log.debug("Upstream write failed: {}", f.cause().toString());
                }
            });
        }

        @Override
        public void awaitClose() throws InterruptedException {
            channel.closeFuture().await();
        }

        @Override
        public void close() {
            if (channel.isActive()) {
                channel.writeAndFlush(new CloseWebSocketFrame());
            }
            channel.close().syncUninterruptibly();
        }
    }
}
