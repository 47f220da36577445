package com.pairup.server.im.exception;

public class MalformedFrameException extends MessagingException {

    public MalformedFrameException(String message, Throwable cause) {
        super(ErrorKind.MALFORMED_FRAME, message, cause);
    }

    public MalformedFrameException(String message) {
        super(ErrorKind.MALFORMED_FRAME, message);
    }
}
