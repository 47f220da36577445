package com.pairup.server.im.exception;

public class UnknownEventException extends MessagingException {

    private final String type;

    public UnknownEventException(String type) {
        super(ErrorKind.UNKNOWN_EVENT, "unknown event type: " + type);
        this.type = type;
    }

    public String getType() {
        return type;
    }
}
