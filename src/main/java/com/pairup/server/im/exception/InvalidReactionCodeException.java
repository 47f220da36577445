package com.pairup.server.im.exception;

public class InvalidReactionCodeException extends MessagingException {

    public InvalidReactionCodeException(String code) {
        super(ErrorKind.INVALID_REACTION_CODE, "invalid reaction code: " + code);
    }
}
