package com.pairup.server.im.push;

public enum DeliveryOutcome {
    DELIVERED,
    /** The provider rejected the token for good; it should be forgotten. */
    INVALID_TOKEN,
    FAILED
}
