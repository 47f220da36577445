package com.pairup.server.im.service;

import cn.hutool.core.util.IdUtil;
import cn.hutool.core.util.StrUtil;
import com.pairup.server.im.event.ChatMessageEvent;
import com.pairup.server.im.event.ReactionEvent;
import com.pairup.server.im.event.ReactionRemovedEvent;
import com.pairup.server.im.event.ReadReceiptEvent;
import com.pairup.server.im.event.TypingEvent;
import com.pairup.server.im.exception.DuplicateIdException;
import com.pairup.server.im.exception.ErrorKind;
import com.pairup.server.im.exception.InvalidReactionCodeException;
import com.pairup.server.im.exception.MessagingException;
import com.pairup.server.im.exception.NotFoundException;
import com.pairup.server.im.exception.NotParticipantException;
import com.pairup.server.im.profile.ProfileDirectory;
import com.pairup.server.im.store.Chat;
import com.pairup.server.im.store.ChatStore;
import com.pairup.server.im.store.Reaction;
import com.pairup.server.im.store.StoredMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Chat operations shared by the real-time and the request/response path, so both produce the
 * same store writes and the same fan-out.
 */
@Service
public class MessagingService {

    private static final Logger log = LoggerFactory.getLogger(MessagingService.class);

    private final ChatStore chatStore;
    private final BroadcastEngine broadcastEngine;
    private final PresenceAwareNotifier notifier;
    private final DirectChatResolver directChatResolver;
    private final ReactionCatalog reactionCatalog;
    private final ProfileDirectory profileDirectory;
    private final Clock clock;
    private final int defaultPageSize;
    private final int maxPageSize;

    public MessagingService(ChatStore chatStore,
                            BroadcastEngine broadcastEngine,
                            PresenceAwareNotifier notifier,
                            DirectChatResolver directChatResolver,
                            ReactionCatalog reactionCatalog,
                            ProfileDirectory profileDirectory,
                            Clock clock,
                            @Value("${messaging.default-page-size:50}") int defaultPageSize,
                            @Value("${messaging.max-page-size:200}") int maxPageSize) {
        this.chatStore = chatStore;
        this.broadcastEngine = broadcastEngine;
        this.notifier = notifier;
        this.directChatResolver = directChatResolver;
        this.reactionCatalog = reactionCatalog;
        this.profileDirectory = profileDirectory;
        this.clock = clock;
        this.defaultPageSize = defaultPageSize;
        this.maxPageSize = maxPageSize;
    }

    // ---------------------------------------------------------------- messages

    /**
     * Stores and fans out a message. A repeated message id is answered with the original message
     * and triggers neither broadcast nor push.
     */
    public MessageResult sendMessage(long senderId, String chatId, String messageId, String content) {
        if (StrUtil.isBlank(messageId)) {
            throw new MessagingException(ErrorKind.INVALID_REQUEST, "message_id is required");
        }
        if (StrUtil.isBlank(content)) {
            throw new MessagingException(ErrorKind.INVALID_REQUEST, "content cannot be empty");
        }
        requireParticipant(senderId, chatId);

        StoredMessage stored;
        try {
            stored = chatStore.insertMessage(messageId, chatId, senderId, content, clock.instant());
        } catch (DuplicateIdException e) {
            log.info("Duplicate message detected (ID: {}), ignoring", messageId);
            StoredMessage original = chatStore.findMessage(messageId).orElseThrow(() -> e);
            if (!original.getChatId().equals(chatId) || original.getSenderId() != senderId) {
                // the id belongs to someone else's message
                throw e;
            }
            return MessageResult.duplicate(original);
        }

        ChatMessageEvent event = new ChatMessageEvent();
        event.setChatId(chatId);
        event.setMessageId(stored.getMessageId());
        event.setSenderId(senderId);
        event.setContent(stored.getContent());
        event.setSentAt(stored.getSentAt().toString());

        BroadcastReport report = broadcastEngine.broadcast(chatId, event);

        Set<Long> offline = new LinkedHashSet<>(report.getOffline());
        offline.remove(senderId);
        notifier.notifyOffline(event, offline);

        return MessageResult.created(stored);
    }

    public List<StoredMessage> messages(long userId, String chatId, Integer limit, Integer offset) {
        requireParticipant(userId, chatId);
        int pageSize = limit == null || limit <= 0 ? defaultPageSize : Math.min(limit, maxPageSize);
        int skip = offset == null || offset < 0 ? 0 : offset;
        return chatStore.messages(chatId, pageSize, skip);
    }

    // ---------------------------------------------------------------- reactions

    /**
     * @return {@code false} when the reaction id was already used, nothing is broadcast then
     */
    public boolean addReaction(long userId, String reactionId, String messageId, String reactionCode) {
        if (StrUtil.isBlank(reactionId)) {
            throw new MessagingException(ErrorKind.INVALID_REQUEST, "reaction_id is required");
        }
        if (!reactionCatalog.contains(reactionCode)) {
            throw new InvalidReactionCodeException(reactionCode);
        }
        String chatId = chatOfMessage(messageId);
        requireParticipant(userId, chatId);

        Instant now = clock.instant();
        try {
            chatStore.insertReaction(new Reaction(reactionId, messageId, userId, reactionCode, now));
        } catch (DuplicateIdException e) {
            log.info("Duplicate reaction detected (ID: {}), ignoring", reactionId);
            return false;
        }

        ReactionEvent event = new ReactionEvent();
        event.setChatId(chatId);
        event.setReactionId(reactionId);
        event.setMessageId(messageId);
        event.setUserId(userId);
        event.setReactionCode(reactionCode);
        event.setReactedAt(now.toString());
        broadcastEngine.broadcast(chatId, event);
        return true;
    }

    /**
     * Removes the user's reactions with the code. The removal frame goes out even when nothing matched.
     *
     * @return number of reactions removed
     */
    public int removeReaction(long userId, String messageId, String reactionCode) {
        if (StrUtil.isBlank(reactionCode)) {
            throw new MessagingException(ErrorKind.INVALID_REQUEST, "reaction_code is required");
        }
        String chatId = chatOfMessage(messageId);
        requireParticipant(userId, chatId);

        int removed = chatStore.removeReactions(messageId, userId, reactionCode);

        ReactionRemovedEvent event = new ReactionRemovedEvent();
        event.setChatId(chatId);
        event.setMessageId(messageId);
        event.setUserId(userId);
        event.setReactionCode(reactionCode);
        event.setRemovedAt(clock.instant().toString());
        broadcastEngine.broadcast(chatId, event);
        return removed;
    }

    // ---------------------------------------------------------------- ephemeral signals

    public void typing(long userId, String chatId, boolean isTyping) {
        requireParticipant(userId, chatId);
        Instant now = clock.instant();
        try {
            chatStore.storeTyping(userId, chatId, now);
        } catch (MessagingException e) {
            log.warn("Error storing typing indicator of user {} in chat {}", userId, chatId, e);
        }

        TypingEvent event = new TypingEvent();
        event.setChatId(chatId);
        event.setUserId(userId);
        event.setTyping(isTyping);
        event.setTimestamp(now.toString());
        broadcastEngine.broadcast(chatId, event, userId);
    }

    public long readReceipt(long userId, String chatId, String messageId) {
        requireParticipant(userId, chatId);
        Instant now = clock.instant();
        OptionalLong seq = chatStore.storeReadReceipt(userId, chatId, messageId, now);
        if (seq.isEmpty()) {
            throw new NotFoundException("message " + messageId + " not found in chat " + chatId);
        }

        ReadReceiptEvent event = new ReadReceiptEvent();
        event.setChatId(chatId);
        event.setUserId(userId);
        event.setMessageId(messageId);
        event.setReadAt(now.toString());
        broadcastEngine.broadcast(chatId, event, userId);
        return seq.getAsLong();
    }

    // ---------------------------------------------------------------- chats

    /**
     * Creates a group chat. The creator always participates.
     *
     * @param chatId caller supplied id, generated when blank
     * @return the chat id
     */
    public String createChat(long creatorId, String chatId, String chatName, List<Long> participants) {
        if (participants == null || participants.isEmpty()) {
            throw new MessagingException(ErrorKind.INVALID_REQUEST, "at least one participant is required");
        }
        Set<Long> members = new LinkedHashSet<>();
        members.add(creatorId);
        members.addAll(participants);

        String id = StrUtil.isBlank(chatId) ? IdUtil.fastUUID() : chatId;
        String name = StrUtil.isBlank(chatName) ? null : chatName.trim();
        chatStore.createChat(new Chat(id, name, clock.instant(), true, new ArrayList<>(members)));
        log.info("Chat {} created by user {} with {} participants", id, creatorId, members.size());
        return id;
    }

    public String getOrCreateDirectChat(long userId, long otherUserId) {
        return directChatResolver.getOrCreate(userId, otherUserId);
    }

    public List<Chat> chats(long userId) {
        List<Chat> chats = chatStore.chatsForUser(userId);
        chats.forEach(chat -> nameForViewer(chat, userId));
        return chats;
    }

    public Chat chat(long userId, String chatId) {
        requireParticipant(userId, chatId);
        Chat chat = chatStore.findChat(chatId).orElseThrow(() -> new NotFoundException("chat " + chatId + " not found"));
        nameForViewer(chat, userId);
        return chat;
    }

    public void addParticipant(long actorId, String chatId, long userId) {
        requireParticipant(actorId, chatId);
        Chat chat = chatStore.findChat(chatId).orElseThrow(() -> new NotFoundException("chat " + chatId + " not found"));
        if (!chat.isGroup()) {
            throw new MessagingException(ErrorKind.INVALID_REQUEST, "direct chats cannot gain participants");
        }
        chatStore.addParticipant(chatId, userId);
        log.info("User {} added user {} to chat {}", actorId, userId, chatId);
    }

    public void removeParticipant(long actorId, String chatId, long userId) {
        requireParticipant(actorId, chatId);
        if (actorId != userId) {
            throw new MessagingException(ErrorKind.FORBIDDEN, "not authorized to remove this user");
        }
        Chat chat = chatStore.findChat(chatId).orElseThrow(() -> new NotFoundException("chat " + chatId + " not found"));
        if (!chat.isGroup()) {
            throw new MessagingException(ErrorKind.INVALID_REQUEST, "cannot leave a direct chat");
        }
        chatStore.removeParticipant(chatId, userId);
        log.info("User {} left chat {}", userId, chatId);
    }

    // ---------------------------------------------------------------- helpers

    public boolean isParticipant(long userId, String chatId) {
        return chatId != null && chatStore.isParticipant(userId, chatId);
    }

    private void requireParticipant(long userId, String chatId) {
        if (!isParticipant(userId, chatId)) {
            throw new NotParticipantException(userId, chatId);
        }
    }

    private String chatOfMessage(String messageId) {
        if (StrUtil.isBlank(messageId)) {
            throw new MessagingException(ErrorKind.INVALID_REQUEST, "message_id is required");
        }
        return chatStore.chatIdForMessage(messageId)
                .orElseThrow(() -> new NotFoundException("message " + messageId + " not found"));
    }

    // direct chats are shown under the other participant's name
    private void nameForViewer(Chat chat, long viewerId) {
        if (chat.isGroup()) {
            return;
        }
        for (Long participant : chat.getParticipants()) {
            if (participant != viewerId) {
                try {
                    profileDirectory.find(participant).ifPresent(p -> chat.setChatName(p.getDisplayName()));
                } catch (MessagingException e) {
                    log.warn("Error naming chat {} for user {}", chat.getChatId(), viewerId, e);
                }
            }
        }
    }
}
