package com.pairup.server.im.netty.handler;

import com.pairup.server.im.auth.TokenVerifier;
import com.pairup.server.im.netty.ChannelAttributes;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.util.ReferenceCountUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.OptionalLong;

/**
 * Authenticates the upgrade request before the WebSocket handshake. The token comes from an
 * {@code Authorization: Bearer} header or a {@code token} query parameter. On success the user id
 * is bound to the channel and this handler leaves the pipeline; otherwise the request is
 * answered with 401 and the connection closed.
 */
public class HandshakeAuthHandler extends ChannelInboundHandlerAdapter {

    private static final Logger log = LoggerFactory.getLogger(HandshakeAuthHandler.class);

    private static final String BEARER_PREFIX = "Bearer ";

    private final String path;
    private final TokenVerifier tokenVerifier;

    public HandshakeAuthHandler(String path, TokenVerifier tokenVerifier) {
        this.path = path;
        this.tokenVerifier = tokenVerifier;
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) throws Exception {
        if (!(msg instanceof FullHttpRequest)) {
            super.channelRead(ctx, msg);
            return;
        }

        FullHttpRequest request = (FullHttpRequest) msg;
        QueryStringDecoder decoder = new QueryStringDecoder(request.uri());
        if (!decoder.path().startsWith(path)) {
            ReferenceCountUtil.release(request);
            reject(ctx, HttpResponseStatus.NOT_FOUND);
            return;
        }

        String token = extractToken(request, decoder);
        OptionalLong userId = token == null ? OptionalLong.empty() : tokenVerifier.verify(token);
        if (userId.isEmpty()) {
            log.info("Rejecting WebSocket upgrade from {}: missing or invalid token", ctx.channel().remoteAddress());
            ReferenceCountUtil.release(request);
            reject(ctx, HttpResponseStatus.UNAUTHORIZED);
            return;
        }

        ctx.channel().attr(ChannelAttributes.USER_ID).set(userId.getAsLong());
        ctx.pipeline().remove(this);
        ctx.fireChannelRead(request);
    }

    static String extractToken(FullHttpRequest request, QueryStringDecoder decoder) {
        String header = request.headers().get(HttpHeaderNames.AUTHORIZATION);
        if (header != null && header.startsWith(BEARER_PREFIX)) {
            String token = header.substring(BEARER_PREFIX.length()).trim();
            if (!token.isEmpty()) {
                return token;
            }
        }
        List<String> values = decoder.parameters().get("token");
        if (values != null && !values.isEmpty() && !values.get(0).isEmpty()) {
            return values.get(0);
        }
        return null;
    }

    private static void reject(ChannelHandlerContext ctx, HttpResponseStatus status) {
        FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status);
        response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, 0);
        ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
    }
}
