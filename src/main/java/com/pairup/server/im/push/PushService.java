package com.pairup.server.im.push;

import com.pairup.server.im.exception.PushDeliveryException;

/**
 * Device token registry plus delivery to every registered device of a user.
 */
public interface PushService {

    void saveToken(long userId, String token, String platform, String deviceId);

    void deleteToken(long userId, String token);

    /**
     * Delivers to every registered token of the user, forgetting tokens the provider reports as invalid.
     *
     * @throws PushDeliveryException when the user has no token or no delivery succeeded
     */
    void sendNotification(long userId, NotificationPayload payload);
}
