package io.cliphub.transport.impl;

import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.QueryStringDecoder;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;

/**
 * Serves REST routes and passes requests for the WebSocket path on to the upgrade handler.
 */
@Slf4j
public final class HttpRequestHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private final String wsPath;
    private final RestRouter router;

    public HttpRequestHandler(final String wsPath, final RestRouter router) {
        this.wsPath = wsPath;
        this.router = router;
    }

    @Override
    protected void channelRead0(final ChannelHandlerContext ctx, final FullHttpRequest req) {
        if (wsPath.equals(new QueryStringDecoder(req.uri()).path())) {
            ctx.fireChannelRead(req.retain());
            return;
        }

        final boolean keepAlive = HttpUtil.isKeepAlive(req);
        final HttpVersion version = req.protocolVersion();
        final String method = req.method().name();
        final String uri = req.uri();
        final String body = req.content().toString(StandardCharsets.UTF_8);

        router.route(method, uri, body).whenComplete((resp, ex) -> {
            if (ex != null) {
                log.debug("{} {} failed: {}", method, uri, ex.toString());
                write(ctx, version, keepAlive, RestResponse.text(500, "internal error"));
                return;
            }
            write(ctx, version, keepAlive, resp);
        });
    }

    private static void write(final ChannelHandlerContext ctx,
                              final HttpVersion version,
                              final boolean keepAlive,
                              final RestResponse resp) {
        final FullHttpResponse out = new DefaultFullHttpResponse(version, HttpResponseStatus.valueOf(resp.status()),
                Unpooled.copiedBuffer(resp.body(), StandardCharsets.UTF_8));
        out.headers()
                .set(HttpHeaderNames.CONTENT_TYPE, resp.contentType())
                .setInt(HttpHeaderNames.CONTENT_LENGTH, out.content().readableBytes());

        if (keepAlive) {
            out.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.KEEP_ALIVE);
            ctx.writeAndFlush(out);
        } else {
            final ChannelFuture f = ctx.writeAndFlush(out);
            f.addListener(ChannelFutureListener.CLOSE);
        }
    }

    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
        log.debug("HTTP error on {}: {}", ctx.channel().remoteAddress(), cause.toString());
        ctx.close();
    }
}
