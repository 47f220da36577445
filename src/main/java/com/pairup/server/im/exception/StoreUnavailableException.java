package com.pairup.server.im.exception;

public class StoreUnavailableException extends MessagingException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(ErrorKind.STORE_UNAVAILABLE, message, cause);
    }
}
