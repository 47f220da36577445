package com.pairup.server.im.exception;

public class NotFoundException extends MessagingException {

    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }
}
