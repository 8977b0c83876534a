package io.cliphub.transport.impl;

import io.cliphub.connection.FrameSink;
import io.cliphub.envelope.FrameCodec;
import io.cliphub.protocol.Frame;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import lombok.RequiredArgsConstructor;

import java.io.IOException;
import java.nio.channels.ClosedChannelException;

/**
 * Writes frames to a WebSocket channel, one at a time, waiting for each write to complete.
 * Must not be called from the channel's event loop.
 */
@RequiredArgsConstructor
final class ChannelFrameSink implements FrameSink {

    private final Channel channel;
    private final FrameCodec codec;

    @Override
    public void send(final Frame frame) throws IOException, InterruptedException {
        if (!channel.isActive()) throw new ClosedChannelException();

        final ChannelFuture write = channel.writeAndFlush(new TextWebSocketFrame(codec.encode(frame)));
        write.await();
        if (!write.isSuccess()) {
            channel.close();
            throw new IOException("WebSocket write failed", write.cause());
        }
    }
}
