package com.contactsbook.backend.modules.auth.infrastructure.cache;

import java.time.Duration;
import java.util.Optional;

import com.contactsbook.backend.modules.auth.application.DenylistStatus;
import com.contactsbook.backend.modules.auth.application.SessionCache;
import com.contactsbook.backend.modules.auth.application.UserSnapshot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Redis-backed {@link SessionCache}. Snapshots are stored as JSON strings; denylist entries as
 * a {@code "1"} sentinel whose expiry equals the token's remaining lifetime.
 */
@Component
public class RedisSessionCache implements SessionCache {

    private static final Logger log = LoggerFactory.getLogger(RedisSessionCache.class);

    static final String USER_KEY_PREFIX = "user:";
    static final String DENYLIST_KEY_PREFIX = "bl:";
    private static final String DENYLIST_SENTINEL = "1";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    public RedisSessionCache(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<UserSnapshot> getUserSnapshot(String username) {
        String json;
        try {
            json = redisTemplate.opsForValue().get(USER_KEY_PREFIX + username);
        } catch (DataAccessException ex) {
            log.warn("Session cache read failed for user={}, falling back to store: {}", username, ex.getMessage());
            return Optional.empty();
        }
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, UserSnapshot.class));
        } catch (JsonProcessingException ex) {
            log.warn("Discarding unreadable cached snapshot for user={}", username);
            evictUserSnapshot(username);
            return Optional.empty();
        }
    }

    @Override
    public void putUserSnapshot(UserSnapshot snapshot, Duration ttl) {
        try {
            String json = objectMapper.writeValueAsString(snapshot);
            redisTemplate.opsForValue().set(USER_KEY_PREFIX + snapshot.username(), json, ttl);
        } catch (JsonProcessingException | DataAccessException ex) {
            log.warn("Session cache write failed for user={}: {}", snapshot.username(), ex.getMessage());
        }
    }

    @Override
    public void evictUserSnapshot(String username) {
        try {
            redisTemplate.delete(USER_KEY_PREFIX + username);
        } catch (DataAccessException ex) {
            log.warn("Session cache evict failed for user={}: {}", username, ex.getMessage());
        }
    }

    @Override
    public DenylistStatus checkDenylist(String rawToken) {
        try {
            Boolean present = redisTemplate.hasKey(DENYLIST_KEY_PREFIX + rawToken);
            return Boolean.TRUE.equals(present) ? DenylistStatus.LISTED : DenylistStatus.CLEAR;
        } catch (DataAccessException ex) {
            log.warn("Denylist lookup failed: {}", ex.getMessage());
            return DenylistStatus.UNKNOWN;
        }
    }

    @Override
    public boolean denylist(String rawToken, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            return false;
        }
        try {
            redisTemplate.opsForValue().set(DENYLIST_KEY_PREFIX + rawToken, DENYLIST_SENTINEL, ttl);
            return true;
        } catch (DataAccessException ex) {
            log.warn("Denylist write failed: {}", ex.getMessage());
            return false;
        }
    }
}
