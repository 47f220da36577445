package com.pairup.server.im.service;

import cn.hutool.core.util.IdUtil;
import com.pairup.server.im.exception.DuplicateIdException;
import com.pairup.server.im.exception.SelfChatException;
import com.pairup.server.im.exception.StoreUnavailableException;
import com.pairup.server.im.store.ChatStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

/**
 * The one direct chat of an unordered pair of users, created on first use.
 *
 * <p>
 * Concurrent first calls for the same pair may both try to create it; the store accepts one and
 * rejects the other as a duplicate, and the loser answers with the winner's chat.
 * </p>
 */
@Service
public class DirectChatResolver {

    private static final Logger log = LoggerFactory.getLogger(DirectChatResolver.class);

    private final ChatStore chatStore;
    private final Clock clock;

    public DirectChatResolver(ChatStore chatStore, Clock clock) {
        this.chatStore = chatStore;
        this.clock = clock;
    }

    public String getOrCreate(long userA, long userB) {
        if (userA == userB) {
            throw new SelfChatException(userA);
        }

        Optional<String> existing = chatStore.findDirectChat(userA, userB);
        if (existing.isPresent()) {
            return existing.get();
        }

        String chatId = IdUtil.fastUUID();
        try {
            chatStore.createDirectChat(chatId, userA, userB, clock.instant());
            log.info("Created direct chat {} for users {} and {}", chatId, userA, userB);
            return chatId;
        } catch (DuplicateIdException e) {
            log.info("Lost direct chat creation race for users {} and {}, re-reading", userA, userB);
            return chatStore.findDirectChat(userA, userB)
                    .orElseThrow(() -> new StoreUnavailableException(
                            "direct chat of users " + userA + " and " + userB + " reported as existing but not found", e));
        }
    }
}
