package com.contactsbook.backend.support;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import com.contactsbook.backend.modules.auth.application.DenylistStatus;
import com.contactsbook.backend.modules.auth.application.SessionCache;
import com.contactsbook.backend.modules.auth.application.UserSnapshot;

/**
 * Map-backed {@link SessionCache} honouring entry expiry against the given clock. Setting
 * {@link #setUnavailable(boolean)} makes it behave like an unreachable Redis.
 */
public class InMemorySessionCache implements SessionCache {

    private final Clock clock;
    private final Map<String, Entry<UserSnapshot>> snapshots = new HashMap<>();
    private final Map<String, Entry<Duration>> denylist = new HashMap<>();
    private boolean unavailable;

    public InMemorySessionCache(Clock clock) {
        this.clock = clock;
    }

    public void setUnavailable(boolean unavailable) {
        this.unavailable = unavailable;
    }

    @Override
    public Optional<UserSnapshot> getUserSnapshot(String username) {
        if (unavailable) {
            return Optional.empty();
        }
        return live(snapshots.get(username)).map(Entry::value);
    }

    @Override
    public void putUserSnapshot(UserSnapshot snapshot, Duration ttl) {
        if (!unavailable) {
            snapshots.put(snapshot.username(), new Entry<>(snapshot, clock.instant().plus(ttl)));
        }
    }

    @Override
    public void evictUserSnapshot(String username) {
        if (!unavailable) {
            snapshots.remove(username);
        }
    }

    @Override
    public DenylistStatus checkDenylist(String rawToken) {
        if (unavailable) {
            return DenylistStatus.UNKNOWN;
        }
        return live(denylist.get(rawToken)).isPresent() ? DenylistStatus.LISTED : DenylistStatus.CLEAR;
    }

    @Override
    public boolean denylist(String rawToken, Duration ttl) {
        if (unavailable || ttl.isZero() || ttl.isNegative()) {
            return false;
        }
        denylist.put(rawToken, new Entry<>(ttl, clock.instant().plus(ttl)));
        return true;
    }

    public boolean hasSnapshot(String username) {
        return live(snapshots.get(username)).isPresent();
    }

    public Optional<Duration> denylistTtl(String rawToken) {
        return live(denylist.get(rawToken)).map(Entry::value);
    }

    public int denylistSize() {
        return denylist.size();
    }

    private <T> Optional<Entry<T>> live(Entry<T> entry) {
        if (entry == null || !clock.instant().isBefore(entry.expiresAt())) {
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    private record Entry<T>(T value, Instant expiresAt) {
    }
}
