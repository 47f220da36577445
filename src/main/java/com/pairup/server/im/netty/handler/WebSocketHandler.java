package com.pairup.server.im.netty.handler;

import com.pairup.server.im.netty.ChannelAttributes;
import com.pairup.server.im.netty.NettyClientConnection;
import com.pairup.server.im.session.ChatSession;
import com.pairup.server.im.session.ChatSessionFactory;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Binds a {@link ChatSession} to each upgraded channel and feeds it the text frames. Runs on the
 * business executor group, which calls it for one channel at a time.
 */
@Component
@ChannelHandler.Sharable
public class WebSocketHandler extends SimpleChannelInboundHandler<TextWebSocketFrame> {

    private static final Logger log = LoggerFactory.getLogger(WebSocketHandler.class);

    private final ChatSessionFactory sessionFactory;

    public WebSocketHandler(ChatSessionFactory sessionFactory) {
        this.sessionFactory = sessionFactory;
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete) {
            Long userId = ctx.channel().attr(ChannelAttributes.USER_ID).get();
            if (userId == null) {
                log.warn("Handshake completed on unauthenticated channel {}, closing", ctx.channel().id());
                ctx.close();
                return;
            }
            ChatSession session = sessionFactory.create(userId, new NettyClientConnection(ctx.channel()));
            ctx.channel().attr(ChannelAttributes.SESSION).set(session);
            session.open();
        } else {
            super.userEventTriggered(ctx, evt);
        }
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, TextWebSocketFrame frame) throws Exception {
        ChatSession session = ctx.channel().attr(ChannelAttributes.SESSION).get();
        if (session == null) {
            log.warn("Frame on channel {} without session, ignoring", ctx.channel().id());
            return;
        }
        session.onFrame(frame.text());
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        ChatSession session = ctx.channel().attr(ChannelAttributes.SESSION).getAndSet(null);
        if (session != null) {
            session.close();
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) throws Exception {
        log.error("WebSocket error on channel {}", ctx.channel().id(), cause);
        ctx.close();
    }
}
