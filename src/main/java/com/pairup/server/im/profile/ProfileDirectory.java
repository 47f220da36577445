package com.pairup.server.im.profile;

import java.util.Optional;

/**
 * Read access to display profiles owned by the profile service.
 */
public interface ProfileDirectory {

    Optional<UserProfile> find(long userId);
}
