package com.pairup.server.im.netty;

import com.pairup.server.im.session.ClientConnection;
import io.netty.channel.Channel;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ClientConnection} over a Netty channel. Writes are queued on the channel's event loop;
 * a channel over its write-buffer high-water mark gets the frame dropped instead.
 */
public class NettyClientConnection implements ClientConnection {

    private static final Logger log = LoggerFactory.getLogger(NettyClientConnection.class);

    private final Channel channel;

    public NettyClientConnection(Channel channel) {
        this.channel = channel;
    }

    @Override
    public String id() {
        return channel.id().asShortText();
    }

    @Override
    public boolean isOpen() {
        return channel.isActive();
    }

    @Override
    public boolean send(String frame) {
        if (!channel.isActive()) {
            return false;
        }
        if (!channel.isWritable()) {
            log.warn("Channel {} is not writable, dropping frame", id());
            return false;
        }
        channel.writeAndFlush(new TextWebSocketFrame(frame)).addListener(future -> {
            if (!future.isSuccess()) {
                log.warn("Write to channel {} failed", id(), future.cause());
            }
        });
        return true;
    }

    @Override
    public void close() {
        channel.close();
    }
}
