package com.pairup.server.im.push;

import com.pairup.server.im.exception.ErrorKind;
import com.pairup.server.im.exception.MessagingException;
import com.pairup.server.im.exception.NotFoundException;
import com.pairup.server.im.exception.PushDeliveryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

@Service
public class PushNotificationService implements PushService {

    private static final Logger log = LoggerFactory.getLogger(PushNotificationService.class);

    private final PushTokenRepository tokenRepository;
    private final PushGateway gateway;
    private final Clock clock;

    public PushNotificationService(PushTokenRepository tokenRepository, PushGateway gateway, Clock clock) {
        this.tokenRepository = tokenRepository;
        this.gateway = gateway;
        this.clock = clock;
    }

    @Override
    public void saveToken(long userId, String token, String platform, String deviceId) {
        if (token == null || token.isBlank()) {
            throw new MessagingException(ErrorKind.INVALID_REQUEST, "token cannot be empty");
        }
        Platform parsed = Platform.parse(platform);
        if (parsed == null) {
            throw new MessagingException(ErrorKind.INVALID_REQUEST, "invalid platform: must be 'ios' or 'android'");
        }
        tokenRepository.save(new PushToken(userId, token, parsed, deviceId, clock.millis()));
        log.info("Registered {} push token for user {}", parsed, userId);
    }

    @Override
    public void deleteToken(long userId, String token) {
        if (!tokenRepository.delete(userId, token)) {
            throw new NotFoundException("token not found");
        }
        log.info("Unregistered push token for user {}", userId);
    }

    @Override
    public void sendNotification(long userId, NotificationPayload payload) {
        List<PushToken> tokens = tokenRepository.findByUser(userId);
        if (tokens.isEmpty()) {
            throw new PushDeliveryException("no push tokens registered for user " + userId);
        }

        int delivered = 0;
        for (PushToken token : tokens) {
            if (Thread.currentThread().isInterrupted()) {
                throw new PushDeliveryException("push delivery to user " + userId + " cancelled");
            }
            DeliveryOutcome outcome;
            try {
                outcome = gateway.deliver(token, payload);
            } catch (RuntimeException e) {
                log.warn("Push to user {} ({} device {}) failed", userId, token.getPlatform(), token.getDeviceId(), e);
                continue;
            }
            switch (outcome) {
                case DELIVERED:
                    delivered++;
                    break;
                case INVALID_TOKEN:
                    log.info("Removing invalid {} push token of user {}", token.getPlatform(), userId);
                    try {
                        tokenRepository.delete(userId, token.getToken());
                    } catch (MessagingException e) {
                        log.warn("Could not remove invalid push token of user {}", userId, e);
                    }
                    break;
                default:
                    log.warn("Push to user {} ({} device {}) was not accepted", userId, token.getPlatform(), token.getDeviceId());
            }
        }

        if (delivered == 0) {
            throw new PushDeliveryException("all " + tokens.size() + " push deliveries to user " + userId + " failed");
        }
    }
}
