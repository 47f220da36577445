package com.pairup.server.im.exception;

public class NotParticipantException extends MessagingException {

    public NotParticipantException(long userId, String chatId) {
        super(ErrorKind.NOT_PARTICIPANT, "user " + userId + " is not a participant of chat " + chatId);
    }
}
