package com.pairup.server.im.service;

import cn.hutool.core.util.StrUtil;
import com.pairup.server.im.event.ChatMessageEvent;
import com.pairup.server.im.exception.MessagingException;
import com.pairup.server.im.profile.ProfileDirectory;
import com.pairup.server.im.profile.UserProfile;
import com.pairup.server.im.push.NotificationPayload;
import com.pairup.server.im.push.PushService;
import com.pairup.server.im.store.Chat;
import com.pairup.server.im.store.ChatStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Push fallback for participants that missed a chat message because they had no live connection.
 *
 * <p>
 * One delivery task per recipient on a bounded pool; each is cancelled once it has been running
 * longer than the push timeout. Failures are logged and never reach the message write or the live broadcast.
 * </p>
 */
@Service
public class PresenceAwareNotifier {

    private static final Logger log = LoggerFactory.getLogger(PresenceAwareNotifier.class);

    static final String DEFAULT_SOUND = "default";
    static final int PREVIEW_LENGTH = 200;

    private final ChatStore chatStore;
    private final ProfileDirectory profileDirectory;
    private final PushService pushService;
    private final ExecutorService pushExecutor;
    private final ScheduledExecutorService timeoutScheduler;
    private final long timeoutMillis;

    public PresenceAwareNotifier(ChatStore chatStore,
                                 ProfileDirectory profileDirectory,
                                 PushService pushService,
                                 @Qualifier("pushExecutor") ExecutorService pushExecutor,
                                 @Qualifier("pushTimeoutScheduler") ScheduledExecutorService timeoutScheduler,
                                 @Value("${messaging.push.timeout-ms:5000}") long timeoutMillis) {
        this.chatStore = chatStore;
        this.profileDirectory = profileDirectory;
        this.pushService = pushService;
        this.pushExecutor = pushExecutor;
        this.timeoutScheduler = timeoutScheduler;
        this.timeoutMillis = timeoutMillis;
    }

    public void notifyOffline(ChatMessageEvent message, Collection<Long> recipients) {
        if (recipients == null || recipients.isEmpty()) {
            return;
        }

        Optional<NotificationPayload> payload;
        try {
            payload = buildPayload(message);
        } catch (MessagingException e) {
            log.error("Error building push notification for message {}", message.getMessageId(), e);
            return;
        }
        if (payload.isEmpty()) {
            return;
        }

        for (Long recipient : recipients) {
            dispatch(recipient, payload.get());
        }
    }

    Optional<NotificationPayload> buildPayload(ChatMessageEvent message) {
        Optional<UserProfile> sender = profileDirectory.find(message.getSenderId());
        if (sender.isEmpty()) {
            log.warn("No profile for sender {}, skipping push notification", message.getSenderId());
            return Optional.empty();
        }
        Optional<Chat> chat = chatStore.findChat(message.getChatId());
        if (chat.isEmpty()) {
            log.warn("Chat {} vanished, skipping push notification", message.getChatId());
            return Optional.empty();
        }

        String title = sender.get().getDisplayName();
        if (chat.get().isGroup() && chat.get().getChatName() != null) {
            title = title + " in " + chat.get().getChatName();
        }

        return Optional.of(NotificationPayload.builder()
                .title(title)
                .body(StrUtil.maxLength(message.getContent(), PREVIEW_LENGTH))
                .sound(DEFAULT_SOUND)
                .badge(1)
                .imageUrl(sender.get().getAvatarUrl())
                .build());
    }

    private void dispatch(long recipient, NotificationPayload payload) {
        try {
            pushExecutor.execute(() -> deliver(recipient, payload));
        } catch (RejectedExecutionException e) {
            log.warn("Push queue full, dropping notification to user {}", recipient);
        }
    }

    /**
     * Runs on a push thread. The timeout starts here, so time spent queued behind other recipients
     * does not count against this delivery.
     */
    private void deliver(long recipient, NotificationPayload payload) {
        FutureTask<Void> delivery = new FutureTask<>(() -> {
            try {
                pushService.sendNotification(recipient, payload);
            } catch (RuntimeException e) {
                log.warn("Error sending push notification to user {}: {}", recipient, e.getMessage());
            }
        }, null);

        ScheduledFuture<?> deadline = timeoutScheduler.schedule(() -> {
            if (delivery.cancel(true)) {
                log.warn("Push notification to user {} timed out after {} ms", recipient, timeoutMillis);
            }
        }, timeoutMillis, TimeUnit.MILLISECONDS);
        try {
            delivery.run();
        } finally {
            deadline.cancel(false);
            // clear an interrupt that raced the end of the delivery so it cannot leak into the next task
            Thread.interrupted();
        }
    }
}
