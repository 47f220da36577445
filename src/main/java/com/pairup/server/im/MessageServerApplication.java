package com.pairup.server.im;

import com.pairup.server.im.netty.NettyWebSocketServer;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;

@SpringBootApplication
public class MessageServerApplication implements ApplicationListener<ContextClosedEvent> {

    @Autowired
    private NettyWebSocketServer nettyWebSocketServer;

    public static void main(String[] args) {
        SpringApplication.run(MessageServerApplication.class, args);
    }

    @Override
    public void onApplicationEvent(ContextClosedEvent event) {
        // published at the start of close(), while Redis and the push executors are still alive
        if (nettyWebSocketServer != null) {
            nettyWebSocketServer.stop();
        }
    }
}
