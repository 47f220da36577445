package com.pairup.server.im.auth;

import java.util.OptionalLong;

/**
 * Resolves an access token issued by the auth service to the user it belongs to.
 */
public interface TokenVerifier {

    /**
     * @return the user id, empty when the token is unknown or expired
     */
    OptionalLong verify(String token);
}
