package com.pairup.server.im.push;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Default gateway when the deployment provides no provider transport: records what would have been sent.
 * A real transport replaces it by declaring its {@link PushGateway} bean {@code @Primary}.
 */
@Component
public class LogOnlyPushGateway implements PushGateway {

    private static final Logger log = LoggerFactory.getLogger(LogOnlyPushGateway.class);

    @Override
    public DeliveryOutcome deliver(PushToken token, NotificationPayload payload) {
        log.info("No push transport configured, dropping notification '{}' for user {} ({} device {})",
                payload.getTitle(), token.getUserId(), token.getPlatform(), token.getDeviceId());
        return DeliveryOutcome.DELIVERED;
    }
}
