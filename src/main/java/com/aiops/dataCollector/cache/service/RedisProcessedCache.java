package com.aiops.dataCollector.cache.service;

import com.aiops.dataCollector.cache.exception.CacheUnavailableException;
import com.aiops.dataCollector.config.CollectorProperties;
import com.aiops.dataCollector.identity.AccountIdMasker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Processed cache shared between collector instances, backed by Redis.
 * Uses SET with expiry and EXISTS; both are atomic on the server.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "collector.cache", name = "type", havingValue = "redis", matchIfMissing = true)
public class RedisProcessedCache implements ProcessedCache {

    private static final String MARKER = "1";

    private final StringRedisTemplate redisTemplate;
    private final Duration processWindow;

    public RedisProcessedCache(StringRedisTemplate redisTemplate, CollectorProperties properties) {
        this.redisTemplate = redisTemplate;
        this.processWindow = properties.getCache().getProcessWindow();
    }

    @Override
    public boolean processed(int accountId) {
        try {
            return Boolean.TRUE.equals(redisTemplate.hasKey(key(accountId)));
        } catch (DataAccessException e) {
            throw new CacheUnavailableException("Unable to read processed state for account " + AccountIdMasker.mask(accountId), e);
        }
    }

    @Override
    public void markProcessed(int accountId) {
        try {
            redisTemplate.opsForValue().set(key(accountId), MARKER, processWindow);
            log.debug("Account marked processed - accountId: {}, window: {}", AccountIdMasker.mask(accountId), processWindow);
        } catch (DataAccessException e) {
            throw new CacheUnavailableException("Unable to mark account " + AccountIdMasker.mask(accountId) + " processed", e);
        }
    }

    @Override
    public boolean ping() {
        try {
            String reply = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
            return reply != null;
        } catch (DataAccessException e) {
            log.debug("Redis not available - error: {}", e.getMessage());
            return false;
        }
    }

    private static String key(int accountId) {
        return String.valueOf(accountId);
    }
}
