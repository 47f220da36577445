package com.pairup.server.im.netty;

import com.pairup.server.im.auth.TokenVerifier;
import com.pairup.server.im.netty.handler.HeartbeatHandler;
import com.pairup.server.im.netty.handler.WebSocketHandler;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import io.netty.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;

import java.util.concurrent.TimeUnit;

@Component
public class NettyWebSocketServer {

    private static final Logger log = LoggerFactory.getLogger(NettyWebSocketServer.class);

    @Value("${netty.port:8088}")
    private int port;

    @Value("${netty.path:/ws/chat}")
    private String path;

    @Value("${netty.reader-idle-seconds:60}")
    private int readerIdleSeconds;

    @Value("${netty.business-threads:16}")
    private int businessThreads;

    private final TokenVerifier tokenVerifier;
    private final HeartbeatHandler heartbeatHandler;
    private final WebSocketHandler webSocketHandler;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private EventExecutorGroup businessGroup;
    private ChannelFuture channelFuture;

    public NettyWebSocketServer(TokenVerifier tokenVerifier, HeartbeatHandler heartbeatHandler,
                                WebSocketHandler webSocketHandler) {
        this.tokenVerifier = tokenVerifier;
        this.heartbeatHandler = heartbeatHandler;
        this.webSocketHandler = webSocketHandler;
    }

    @PostConstruct
    public void start() {
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        businessGroup = new DefaultEventExecutorGroup(businessThreads);

        Thread serverThread = new Thread(() -> {
            try {
                ServerBootstrap b = new ServerBootstrap();
                b.group(bossGroup, workerGroup)
                        .channel(NioServerSocketChannel.class)
                        .childHandler(new WebSocketChannelInitializer(path, readerIdleSeconds, businessGroup,
                                tokenVerifier, heartbeatHandler, webSocketHandler));

                channelFuture = b.bind(port).sync();
                log.info("Netty WebSocket server started on port: {}, path: {}", port, path);
                channelFuture.channel().closeFuture().sync();
            } catch (InterruptedException e) {
                log.error("Netty server interrupted", e);
                Thread.currentThread().interrupt();
            } finally {
                bossGroup.shutdownGracefully();
                workerGroup.shutdownGracefully();
            }
        }, "netty-server");
        serverThread.start();
    }

    // called from MessageServerApplication on context close, before the store beans go away
    public void stop() {
        log.info("Stopping Netty WebSocket server...");
        // stop accepting, then close live connections (each unregisters its session), then drain handlers
        shutdown("bossGroup", bossGroup);
        shutdown("workerGroup", workerGroup);
        shutdown("businessGroup", businessGroup);
        log.info("Netty WebSocket server stopped.");
    }

    private void shutdown(String name, EventExecutorGroup group) {
        if (group == null) {
            return;
        }
        Future<?> termination = group.shutdownGracefully(0, 5, TimeUnit.SECONDS);
        try {
            termination.sync();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Netty {} shutdown interrupted", name);
        }
    }
}
