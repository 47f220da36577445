package com.pairup.server.im.exception;

/**
 * Raised by the store when an identifier (chat, message, reaction, direct pair) already exists.
 */
public class DuplicateIdException extends MessagingException {

    private final String id;

    public DuplicateIdException(String entity, String id) {
        super(ErrorKind.DUPLICATE_ID, entity + " already exists with id " + id);
        this.id = id;
    }

    public String getId() {
        return id;
    }
}
