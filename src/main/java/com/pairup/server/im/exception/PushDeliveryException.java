package com.pairup.server.im.exception;

public class PushDeliveryException extends MessagingException {

    public PushDeliveryException(String message) {
        super(ErrorKind.PUSH_FAILED, message);
    }
}
