package com.pairup.server.im.store;

import com.pairup.server.im.exception.DuplicateIdException;
import com.pairup.server.im.exception.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * {@link ChatStore} on Redis. Every multi-key write is a Lua script so it applies atomically;
 * scripts report an existing identifier with a sentinel return value which is turned into
 * {@link DuplicateIdException} here.
 */
@Repository
public class RedisChatStore implements ChatStore {

    private static final Logger log = LoggerFactory.getLogger(RedisChatStore.class);

    private static final RedisScript<Long> CREATE_CHAT = script("create_chat");
    private static final RedisScript<Long> CREATE_DIRECT_CHAT = script("create_direct_chat");
    private static final RedisScript<Long> INSERT_MESSAGE = script("insert_message");
    private static final RedisScript<Long> INSERT_REACTION = script("insert_reaction");
    private static final RedisScript<Long> REMOVE_REACTIONS = script("remove_reactions");
    private static final RedisScript<Long> READ_RECEIPT = script("read_receipt");

    private final StringRedisTemplate redisTemplate;
    private final Duration typingTtl;

    public RedisChatStore(StringRedisTemplate redisTemplate,
                          @Value("${messaging.typing-ttl-seconds:10}") long typingTtlSeconds) {
        this.redisTemplate = redisTemplate;
        this.typingTtl = Duration.ofSeconds(typingTtlSeconds);
    }

    private static RedisScript<Long> script(String name) {
        return RedisScript.of(new ClassPathResource("scripts/" + name + ".lua"), Long.class);
    }

    @Override
    public boolean isParticipant(long userId, String chatId) {
        return call("isParticipant", () -> Boolean.TRUE.equals(
                redisTemplate.opsForSet().isMember(RedisKeys.participants(chatId), String.valueOf(userId))));
    }

    @Override
    public List<Long> participants(String chatId) {
        return call("participants", () -> toUserIds(redisTemplate.opsForSet().members(RedisKeys.participants(chatId))));
    }

    @Override
    public Optional<Chat> findChat(String chatId) {
        return call("findChat", () -> {
            Map<Object, Object> info = redisTemplate.opsForHash().entries(RedisKeys.chatInfo(chatId));
            if (info == null || info.isEmpty()) {
                return Optional.empty();
            }
            Chat chat = new Chat();
            chat.setChatId(chatId);
            String name = (String) info.get("name");
            chat.setChatName(name == null || name.isEmpty() ? null : name);
            chat.setGroup("1".equals(info.get("group")));
            chat.setCreatedAt(Instant.ofEpochMilli(Long.parseLong((String) info.get("createdAt"))));
            chat.setParticipants(toUserIds(redisTemplate.opsForSet().members(RedisKeys.participants(chatId))));
            return Optional.of(chat);
        });
    }

    @Override
    public List<Chat> chatsForUser(long userId) {
        Set<String> chatIds = call("chatsForUser", () -> redisTemplate.opsForSet().members(RedisKeys.userChats(userId)));
        if (chatIds == null || chatIds.isEmpty()) {
            return new ArrayList<>();
        }
        List<Chat> chats = new ArrayList<>(chatIds.size());
        for (String chatId : chatIds) {
            findChat(chatId).ifPresent(chats::add);
        }
        chats.sort(Comparator.comparing(Chat::getCreatedAt).reversed());
        return chats;
    }

    @Override
    public void createChat(Chat chat) {
        List<String> keys = new ArrayList<>();
        keys.add(RedisKeys.chatInfo(chat.getChatId()));
        keys.add(RedisKeys.participants(chat.getChatId()));

        List<String> args = new ArrayList<>();
        args.add(chat.getChatId());
        args.add(chat.getChatName() == null ? "" : chat.getChatName());
        args.add(chat.isGroup() ? "1" : "0");
        args.add(String.valueOf(chat.getCreatedAt().toEpochMilli()));
        for (Long participant : chat.getParticipants()) {
            keys.add(RedisKeys.userChats(participant));
            args.add(String.valueOf(participant));
        }

        Long created = runScript(CREATE_CHAT, keys, args.toArray(new String[0]));
        if (created == null || created == 0L) {
            throw new DuplicateIdException("chat", chat.getChatId());
        }
    }

    @Override
    public Optional<String> findDirectChat(long userA, long userB) {
        return call("findDirectChat", () ->
                Optional.ofNullable(redisTemplate.opsForValue().get(RedisKeys.directPair(userA, userB))));
    }

    @Override
    public void createDirectChat(String chatId, long userA, long userB, Instant createdAt) {
        List<String> keys = List.of(
                RedisKeys.directPair(userA, userB),
                RedisKeys.chatInfo(chatId),
                RedisKeys.participants(chatId),
                RedisKeys.userChats(userA),
                RedisKeys.userChats(userB));

        Long created = runScript(CREATE_DIRECT_CHAT, keys,
                chatId, String.valueOf(createdAt.toEpochMilli()), String.valueOf(userA), String.valueOf(userB));
        if (created == null || created == 0L) {
            throw new DuplicateIdException("direct chat", chatId);
        }
    }

    @Override
    public void addParticipant(String chatId, long userId) {
        call("addParticipant", () -> redisTemplate.execute(new SessionCallback<List<Object>>() {
            @Override
            @SuppressWarnings("unchecked")
            public <K, V> List<Object> execute(RedisOperations<K, V> operations) throws DataAccessException {
                RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
                ops.multi();
                ops.opsForSet().add(RedisKeys.participants(chatId), String.valueOf(userId));
                ops.opsForSet().add(RedisKeys.userChats(userId), chatId);
                return ops.exec();
            }
        }));
    }

    @Override
    public void removeParticipant(String chatId, long userId) {
        call("removeParticipant", () -> redisTemplate.execute(new SessionCallback<List<Object>>() {
            @Override
            @SuppressWarnings("unchecked")
            public <K, V> List<Object> execute(RedisOperations<K, V> operations) throws DataAccessException {
                RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
                ops.multi();
                ops.opsForSet().remove(RedisKeys.participants(chatId), String.valueOf(userId));
                ops.opsForSet().remove(RedisKeys.userChats(userId), chatId);
                return ops.exec();
            }
        }));
    }

    @Override
    public StoredMessage insertMessage(String messageId, String chatId, long senderId, String content, Instant sentAt) {
        List<String> keys = List.of(
                RedisKeys.message(messageId),
                RedisKeys.sequence(chatId),
                RedisKeys.chatMessages(chatId));

        Long seq = runScript(INSERT_MESSAGE, keys,
                messageId, chatId, String.valueOf(senderId), content, String.valueOf(sentAt.toEpochMilli()));
        if (seq == null || seq < 0) {
            throw new DuplicateIdException("message", messageId);
        }
        return new StoredMessage(messageId, chatId, senderId, content, sentAt, seq);
    }

    @Override
    public Optional<StoredMessage> findMessage(String messageId) {
        return call("findMessage", () -> {
            Map<Object, Object> fields = redisTemplate.opsForHash().entries(RedisKeys.message(messageId));
            return fields == null || fields.isEmpty() ? Optional.empty() : Optional.of(toMessage(fields));
        });
    }

    @Override
    public Optional<String> chatIdForMessage(String messageId) {
        return call("chatIdForMessage", () -> Optional.ofNullable(
                (String) redisTemplate.opsForHash().get(RedisKeys.message(messageId), "chatId")));
    }

    @Override
    public List<StoredMessage> messages(String chatId, int limit, int offset) {
        return call("messages", () -> {
            Set<String> ids = redisTemplate.opsForZSet()
                    .reverseRange(RedisKeys.chatMessages(chatId), offset, (long) offset + limit - 1);
            List<StoredMessage> messages = new ArrayList<>();
            if (ids == null) {
                return messages;
            }
            for (String id : ids) {
                Map<Object, Object> fields = redisTemplate.opsForHash().entries(RedisKeys.message(id));
                if (fields != null && !fields.isEmpty()) {
                    messages.add(toMessage(fields));
                }
            }
            return messages;
        });
    }

    @Override
    public void insertReaction(Reaction reaction) {
        List<String> keys = List.of(
                RedisKeys.reaction(reaction.getReactionId()),
                RedisKeys.messageReactions(reaction.getMessageId()));

        Long created = runScript(INSERT_REACTION, keys,
                reaction.getReactionId(), reaction.getMessageId(), String.valueOf(reaction.getUserId()),
                reaction.getReactionCode(), String.valueOf(reaction.getReactedAt().toEpochMilli()));
        if (created == null || created == 0L) {
            throw new DuplicateIdException("reaction", reaction.getReactionId());
        }
    }

    @Override
    public int removeReactions(String messageId, long userId, String reactionCode) {
        Long removed = runScript(REMOVE_REACTIONS, List.of(RedisKeys.messageReactions(messageId)),
                String.valueOf(userId), reactionCode, RedisKeys.REACTION_PREFIX);
        return removed == null ? 0 : removed.intValue();
    }

    @Override
    public void storeTyping(long userId, String chatId, Instant at) {
        call("storeTyping", () -> {
            redisTemplate.opsForValue().set(RedisKeys.typing(chatId, userId), String.valueOf(at.toEpochMilli()), typingTtl);
            return null;
        });
    }

    @Override
    public OptionalLong storeReadReceipt(long userId, String chatId, String messageId, Instant readAt) {
        List<String> keys = List.of(
                RedisKeys.message(messageId),
                RedisKeys.readSeq(chatId),
                RedisKeys.readAt(chatId));

        Long seq = runScript(READ_RECEIPT, keys, chatId, String.valueOf(userId), String.valueOf(readAt.toEpochMilli()));
        return seq == null || seq < 0 ? OptionalLong.empty() : OptionalLong.of(seq);
    }

    private Long runScript(RedisScript<Long> script, List<String> keys, String... args) {
        return call("script", () -> redisTemplate.execute(script, keys, (Object[]) args));
    }

    private <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            log.error("Chat store operation {} failed", operation, e);
            throw new StoreUnavailableException("chat store operation " + operation + " failed", e);
        }
    }

    private static List<Long> toUserIds(Set<String> members) {
        if (members == null) {
            return new ArrayList<>();
        }
        return members.stream().map(Long::valueOf).sorted().collect(Collectors.toList());
    }

    private static StoredMessage toMessage(Map<Object, Object> fields) {
        return new StoredMessage(
                (String) fields.get("id"),
                (String) fields.get("chatId"),
                Long.parseLong((String) fields.get("senderId")),
                (String) fields.get("content"),
                Instant.ofEpochMilli(Long.parseLong((String) fields.get("sentAt"))),
                Long.parseLong((String) fields.get("seq")));
    }
}
