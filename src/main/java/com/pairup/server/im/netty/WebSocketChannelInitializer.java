package com.pairup.server.im.netty;

import com.pairup.server.im.auth.TokenVerifier;
import com.pairup.server.im.netty.handler.HandshakeAuthHandler;
import com.pairup.server.im.netty.handler.HeartbeatHandler;
import com.pairup.server.im.netty.handler.WebSocketHandler;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolConfig;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.stream.ChunkedWriteHandler;
import io.netty.handler.timeout.IdleStateHandler;
import io.netty.util.concurrent.EventExecutorGroup;

import java.util.concurrent.TimeUnit;

public class WebSocketChannelInitializer extends ChannelInitializer<SocketChannel> {

    private static final int MAX_CONTENT_LENGTH = 65536;

    private final String path;
    private final int readerIdleSeconds;
    private final EventExecutorGroup businessGroup;
    private final TokenVerifier tokenVerifier;
    private final HeartbeatHandler heartbeatHandler;
    private final WebSocketHandler webSocketHandler;

    public WebSocketChannelInitializer(String path, int readerIdleSeconds, EventExecutorGroup businessGroup,
                                       TokenVerifier tokenVerifier, HeartbeatHandler heartbeatHandler,
                                       WebSocketHandler webSocketHandler) {
        this.path = path;
        this.readerIdleSeconds = readerIdleSeconds;
        this.businessGroup = businessGroup;
        this.tokenVerifier = tokenVerifier;
        this.heartbeatHandler = heartbeatHandler;
        this.webSocketHandler = webSocketHandler;
    }

    @Override
    protected void initChannel(SocketChannel ch) throws Exception {
        ChannelPipeline pipeline = ch.pipeline();

        pipeline.addLast(new HttpServerCodec());
        pipeline.addLast(new ChunkedWriteHandler());
        pipeline.addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH));

        pipeline.addLast(new IdleStateHandler(readerIdleSeconds, 0, 0, TimeUnit.SECONDS));
        pipeline.addLast(heartbeatHandler);

        // token lookups hit Redis, keep them off the I/O thread
        pipeline.addLast(businessGroup, new HandshakeAuthHandler(path, tokenVerifier));

        pipeline.addLast(new WebSocketServerProtocolHandler(WebSocketServerProtocolConfig.newBuilder()
                .websocketPath(path)
                .checkStartsWith(true)
                .maxFramePayloadLength(MAX_CONTENT_LENGTH)
                .build()));
        pipeline.addLast(businessGroup, webSocketHandler);
    }
}
