package com.pairup.server.im.service;

import com.pairup.server.im.event.ChatEvent;
import com.pairup.server.im.event.EventCodec;
import com.pairup.server.im.exception.MessagingException;
import com.pairup.server.im.session.ClientConnection;
import com.pairup.server.im.session.PresenceRegistry;
import com.pairup.server.im.store.ChatStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Delivers a frame to every participant of a chat that has a live connection.
 *
 * <p>
 * Recipients come from the chat store, never from presence. Each delivery is independent and
 * non-blocking: a closed or saturated connection is logged and skipped. Participants without a
 * connection are reported as offline for the caller to fall back on push.
 * </p>
 */
@Service
public class BroadcastEngine {

    private static final Logger log = LoggerFactory.getLogger(BroadcastEngine.class);

    private final ChatStore chatStore;
    private final PresenceRegistry presenceRegistry;
    private final EventCodec codec;

    public BroadcastEngine(ChatStore chatStore, PresenceRegistry presenceRegistry, EventCodec codec) {
        this.chatStore = chatStore;
        this.presenceRegistry = presenceRegistry;
        this.codec = codec;
    }

    public BroadcastReport broadcast(String chatId, ChatEvent event) {
        return broadcast(chatId, event, null);
    }

    /**
     * @param excludedUserId participant that must not receive the frame, or {@code null}
     */
    public BroadcastReport broadcast(String chatId, ChatEvent event, Long excludedUserId) {
        List<Long> participants;
        try {
            participants = chatStore.participants(chatId);
        } catch (MessagingException e) {
            log.error("Error fetching participants of chat {}, {} not broadcast", chatId, event.getType(), e);
            return BroadcastReport.empty();
        }

        String frame = codec.encode(event);
        BroadcastReport report = new BroadcastReport();

        for (Long userId : participants) {
            if (userId.equals(excludedUserId)) {
                continue;
            }
            Optional<ClientConnection> connection = presenceRegistry.lookup(userId);
            if (connection.isEmpty()) {
                report.offline(userId);
                continue;
            }
            try {
                if (connection.get().send(frame)) {
                    report.delivered(userId);
                } else {
                    log.warn("Connection {} of user {} did not accept {} for chat {}",
                            connection.get().id(), userId, event.getType(), chatId);
                    report.failed(userId);
                }
            } catch (RuntimeException e) {
                log.warn("Error sending {} to user {}", event.getType(), userId, e);
                report.failed(userId);
            }
        }

        log.debug("Broadcast {} in chat {}: delivered={}, failed={}, offline={}", event.getType(), chatId,
                report.getDelivered(), report.getFailed(), report.getOffline());
        return report;
    }
}
