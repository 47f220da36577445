package com.pairup.server.im.session;

/**
 * Transport handle of one live client connection.
 */
public interface ClientConnection {

    String id();

    boolean isOpen();

    /**
     * Queues a text frame without blocking the caller.
     *
     * @return {@code false} when the frame was not accepted (closed or saturated connection)
     */
    boolean send(String frame);

    void close();
}
