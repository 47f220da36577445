package com.pairup.server.im.push;

/**
 * Transport to the platform push providers. Implementations must honour thread interruption,
 * which is how deliveries running past their deadline are cancelled.
 */
public interface PushGateway {

    DeliveryOutcome deliver(PushToken token, NotificationPayload payload);
}
