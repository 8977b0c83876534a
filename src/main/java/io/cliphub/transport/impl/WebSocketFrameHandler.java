package io.cliphub.transport.impl;

import io.cliphub.connection.Connection;
import io.cliphub.core.error.HubError;
import io.cliphub.envelope.Envelopes;
import io.cliphub.envelope.FrameCodec;
import io.cliphub.hub.Hub;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import lombok.extern.slf4j.Slf4j;

/**
 * One instance per channel. Attaches a hub connection once the handshake completes and detaches
 * it when the channel goes inactive.
 */
@Slf4j
public final class WebSocketFrameHandler extends SimpleChannelInboundHandler<WebSocketFrame> {

    private final Hub hub;
    private final RequestRouter router;
    private final FrameCodec codec;
    private Connection conn;

    public WebSocketFrameHandler(final Hub hub, final RequestRouter router) {
        this.hub = hub;
        this.router = router;
        this.codec = new FrameCodec(hub.getEnvelopes());
    }

    @Override
    public void userEventTriggered(final ChannelHandlerContext ctx, final Object evt) throws Exception {
        if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete) {
            connection(ctx);
        }
        super.userEventTriggered(ctx, evt);
    }

    /* frames only arrive after the upgrade, so attaching on first use is equivalent */
    private Connection connection(final ChannelHandlerContext ctx) {
        if (conn == null) {
            conn = hub.attach(new ChannelFrameSink(ctx.channel(), codec));
            log.debug("{} opened from {}", conn, ctx.channel().remoteAddress());
        }
        return conn;
    }

    @Override
    protected void channelRead0(final ChannelHandlerContext ctx, final WebSocketFrame frame) {
        final Connection c = connection(ctx);

        if (!(frame instanceof TextWebSocketFrame text)) {
            final Envelopes envelopes = hub.getEnvelopes();
            c.enqueue(envelopes.error(envelopes.getIds().next(), null,
                    HubError.validation("frames must be JSON text")));
            return;
        }

        router.route(c, text.text()).whenComplete((reply, ex) -> {
            if (ex != null) {
                log.debug("Request on {} failed: {}", c, ex.toString());
                return;
            }
            reply.ifPresent(c::enqueue);
        });
    }

    @Override
    public void channelInactive(final ChannelHandlerContext ctx) throws Exception {
        final Connection c = conn;
        if (c != null) {
            hub.disconnect(c).whenComplete((topics, ex) -> log.debug("{} closed, dropped {}", c, topics));
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
        log.debug("WebSocket error on {}: {}", ctx.channel().remoteAddress(), cause.toString());
        ctx.close();
    }
}
