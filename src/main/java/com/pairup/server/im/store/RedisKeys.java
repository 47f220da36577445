package com.pairup.server.im.store;

/**
 * Key layout of the chat store.
 */
final class RedisKeys {

    static final String REACTION_PREFIX = "reaction:";

    private RedisKeys() {
    }

    static String chatInfo(String chatId) {
        return "chat:info:" + chatId;
    }

    static String participants(String chatId) {
        return "chat:participants:" + chatId;
    }

    static String userChats(long userId) {
        return "user:chats:" + userId;
    }

    // unordered pair, smaller id first
    static String directPair(long userA, long userB) {
        return "chat:direct:" + Math.min(userA, userB) + ":" + Math.max(userA, userB);
    }

    static String sequence(String chatId) {
        return "chat:seq:" + chatId;
    }

    static String chatMessages(String chatId) {
        return "chat:messages:" + chatId;
    }

    static String message(String messageId) {
        return "message:" + messageId;
    }

    static String reaction(String reactionId) {
        return REACTION_PREFIX + reactionId;
    }

    static String messageReactions(String messageId) {
        return "message:reactions:" + messageId;
    }

    static String typing(String chatId, long userId) {
        return "chat:typing:" + chatId + ":" + userId;
    }

    static String readSeq(String chatId) {
        return "chat:read:" + chatId;
    }

    static String readAt(String chatId) {
        return "chat:read-at:" + chatId;
    }
}
