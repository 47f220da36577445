package com.pairup.server.im.netty;

import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NettyClientConnectionTest {

    @Test
    void writesTextFrames() {
        EmbeddedChannel channel = new EmbeddedChannel();
        NettyClientConnection connection = new NettyClientConnection(channel);

        assertThat(connection.send("{\"a\":1}")).isTrue();

        TextWebSocketFrame frame = channel.readOutbound();
        assertThat(frame.text()).isEqualTo("{\"a\":1}");
        frame.release();
    }

    @Test
    void closedChannelRefusesFrames() {
        EmbeddedChannel channel = new EmbeddedChannel();
        NettyClientConnection connection = new NettyClientConnection(channel);

        connection.close();

        assertThat(connection.isOpen()).isFalse();
        assertThat(connection.send("x")).isFalse();
    }
}
