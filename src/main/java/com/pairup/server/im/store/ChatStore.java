package com.pairup.server.im.store;

import com.pairup.server.im.exception.DuplicateIdException;
import com.pairup.server.im.exception.StoreUnavailableException;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Durable chat state. The single source of truth for membership and the arbiter of identifier
 * uniqueness: every insert keyed by a caller-supplied id throws {@link DuplicateIdException}
 * instead of writing twice.
 *
 * <p>
 * Any backend failure is raised as {@link StoreUnavailableException}.
 * </p>
 */
public interface ChatStore {

    boolean isParticipant(long userId, String chatId);

    /**
     * @return participant ids, empty when the chat does not exist
     */
    List<Long> participants(String chatId);

    Optional<Chat> findChat(String chatId);

    /**
     * @return chats the user participates in, newest first
     */
    List<Chat> chatsForUser(long userId);

    /**
     * Creates a group chat with its participants in one atomic step.
     *
     * @throws DuplicateIdException when the chat id is taken
     */
    void createChat(Chat chat);

    /**
     * @return the non-group chat whose participants are exactly {@code {userA, userB}}
     */
    Optional<String> findDirectChat(long userA, long userB);

    /**
     * Creates the direct chat of an unordered pair in one atomic step.
     *
     * @throws DuplicateIdException when the pair already has a direct chat or the id is taken
     */
    void createDirectChat(String chatId, long userA, long userB, Instant createdAt);

    void addParticipant(String chatId, long userId);

    void removeParticipant(String chatId, long userId);

    /**
     * Stores a message, assigning the server timestamp and the next per-chat sequence number.
     *
     * @throws DuplicateIdException when a message with this id exists
     */
    StoredMessage insertMessage(String messageId, String chatId, long senderId, String content, Instant sentAt);

    Optional<StoredMessage> findMessage(String messageId);

    Optional<String> chatIdForMessage(String messageId);

    /**
     * @return messages of the chat, highest sequence first
     */
    List<StoredMessage> messages(String chatId, int limit, int offset);

    /**
     * @throws DuplicateIdException when a reaction with this id exists
     */
    void insertReaction(Reaction reaction);

    /**
     * Removes every reaction of the user with this code on the message.
     *
     * @return number of reactions removed, 0 when there was none
     */
    int removeReactions(String messageId, long userId, String reactionCode);

    void storeTyping(long userId, String chatId, Instant at);

    /**
     * Raises the user's read high-water mark in the chat to the sequence of the message.
     *
     * @return sequence of the referenced message, empty when it is not a message of that chat
     */
    OptionalLong storeReadReceipt(long userId, String chatId, String messageId, Instant readAt);
}
