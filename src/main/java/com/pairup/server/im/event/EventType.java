package com.pairup.server.im.event;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Wire discriminator of a real-time frame, with the frame class it decodes to.
 */
public enum EventType {

    CHAT_MESSAGE("chat_message", ChatMessageEvent.class),
    REACTION("reaction", ReactionEvent.class),
    REMOVE_REACTION("remove_reaction", ReactionRemovedEvent.class),
    TYPING("typing", TypingEvent.class),
    READ_RECEIPT("read_receipt", ReadReceiptEvent.class);

    private static final Map<String, EventType> BY_WIRE_NAME = Arrays.stream(values())
            .collect(Collectors.toMap(EventType::getWireName, Function.identity()));

    private final String wireName;
    private final Class<? extends ChatEvent> frameClass;

    EventType(String wireName, Class<? extends ChatEvent> frameClass) {
        this.wireName = wireName;
        this.frameClass = frameClass;
    }

    public String getWireName() {
        return wireName;
    }

    public Class<? extends ChatEvent> getFrameClass() {
        return frameClass;
    }

    /**
     * @return the type for a wire name, or {@code null} when nothing matches
     */
    public static EventType fromWireName(String wireName) {
        return wireName == null ? null : BY_WIRE_NAME.get(wireName);
    }
}
