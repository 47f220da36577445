package com.pairup.server.im.event;

/**
 * Exhaustive match over the frame variants.
 */
public interface ChatEventVisitor<R> {

    R visitChatMessage(ChatMessageEvent event);

    R visitReaction(ReactionEvent event);

    R visitReactionRemoved(ReactionRemovedEvent event);

    R visitTyping(TypingEvent event);

    R visitReadReceipt(ReadReceiptEvent event);
}
