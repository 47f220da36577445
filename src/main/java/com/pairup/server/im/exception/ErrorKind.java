package com.pairup.server.im.exception;

/**
 * Distinguishes failure causes without inspecting exception messages.
 */
public enum ErrorKind {
    DUPLICATE_ID,
    NOT_PARTICIPANT,
    NOT_FOUND,
    FORBIDDEN,
    SELF_CHAT,
    INVALID_REACTION_CODE,
    INVALID_REQUEST,
    MALFORMED_FRAME,
    UNKNOWN_EVENT,
    STORE_UNAVAILABLE,
    PUSH_FAILED
}
