package com.contactsbook.backend.modules.auth.application;

import java.time.Duration;
import java.util.Optional;

/**
 * Disposable projection of authentication state: user snapshots for the validation fast path
 * and the denylist of access tokens revoked before their natural expiry.
 * <p>
 * Implementations never throw on backend failure. Reads degrade to a miss, writes to a no-op,
 * and {@link #checkDenylist(String)} reports {@link DenylistStatus#UNKNOWN}.
 */
public interface SessionCache {

    Optional<UserSnapshot> getUserSnapshot(String username);

    void putUserSnapshot(UserSnapshot snapshot, Duration ttl);

    void evictUserSnapshot(String username);

    DenylistStatus checkDenylist(String rawToken);

    /**
     * Denylists the token for {@code ttl}. A zero or negative ttl is ignored.
     *
     * @return whether the entry was written
     */
    boolean denylist(String rawToken, Duration ttl);
}
