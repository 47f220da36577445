package com.pairup.server.im.handler;

import com.pairup.server.im.event.ChatEvent;
import com.pairup.server.im.event.ChatEventVisitor;
import com.pairup.server.im.event.ChatMessageEvent;
import com.pairup.server.im.event.ReactionEvent;
import com.pairup.server.im.event.ReactionRemovedEvent;
import com.pairup.server.im.event.ReadReceiptEvent;
import com.pairup.server.im.event.TypingEvent;
import com.pairup.server.im.exception.MessagingException;
import com.pairup.server.im.handler.impl.ChatMessageHandler;
import com.pairup.server.im.handler.impl.ReactionHandler;
import com.pairup.server.im.handler.impl.ReadReceiptHandler;
import com.pairup.server.im.handler.impl.RemoveReactionHandler;
import com.pairup.server.im.handler.impl.TypingHandler;
import com.pairup.server.im.store.ChatStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Authorizes a decoded frame against the chat it names and hands it to the handler of its type.
 * Frames of non-participants are dropped without a reply.
 */
@Component
public class EventRouter {

    private static final Logger log = LoggerFactory.getLogger(EventRouter.class);

    private final ChatStore chatStore;
    private final ChatMessageHandler chatMessageHandler;
    private final ReactionHandler reactionHandler;
    private final RemoveReactionHandler removeReactionHandler;
    private final TypingHandler typingHandler;
    private final ReadReceiptHandler readReceiptHandler;

    public EventRouter(ChatStore chatStore,
                       ChatMessageHandler chatMessageHandler,
                       ReactionHandler reactionHandler,
                       RemoveReactionHandler removeReactionHandler,
                       TypingHandler typingHandler,
                       ReadReceiptHandler readReceiptHandler) {
        this.chatStore = chatStore;
        this.chatMessageHandler = chatMessageHandler;
        this.reactionHandler = reactionHandler;
        this.removeReactionHandler = removeReactionHandler;
        this.typingHandler = typingHandler;
        this.readReceiptHandler = readReceiptHandler;
    }

    public void route(long userId, ChatEvent event) {
        String chatId = event.getChatId();
        if (chatId == null || chatId.isEmpty()) {
            log.warn("Dropping {} from user {}: missing chat_id", event.getType(), userId);
            return;
        }

        boolean allowed;
        try {
            allowed = chatStore.isParticipant(userId, chatId);
        } catch (MessagingException e) {
            log.error("Authorization check failed for user {} in chat {}, dropping {}", userId, chatId, event.getType(), e);
            return;
        }
        if (!allowed) {
            log.warn("User {} is not a participant of chat {}, dropping {}", userId, chatId, event.getType());
            return;
        }

        event.accept(new Dispatch(userId));
    }

    private final class Dispatch implements ChatEventVisitor<Void> {

        private final long userId;

        private Dispatch(long userId) {
            this.userId = userId;
        }

        @Override
        public Void visitChatMessage(ChatMessageEvent event) {
            chatMessageHandler.handle(userId, event);
            return null;
        }

        @Override
        public Void visitReaction(ReactionEvent event) {
            reactionHandler.handle(userId, event);
            return null;
        }

        @Override
        public Void visitReactionRemoved(ReactionRemovedEvent event) {
            removeReactionHandler.handle(userId, event);
            return null;
        }

        @Override
        public Void visitTyping(TypingEvent event) {
            typingHandler.handle(userId, event);
            return null;
        }

        @Override
        public Void visitReadReceipt(ReadReceiptEvent event) {
            readReceiptHandler.handle(userId, event);
            return null;
        }
    }
}
