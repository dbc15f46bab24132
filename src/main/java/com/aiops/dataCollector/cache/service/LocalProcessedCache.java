package com.aiops.dataCollector.cache.service;

import com.aiops.dataCollector.config.CollectorProperties;
import com.aiops.dataCollector.identity.AccountIdMasker;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * In-process processed cache using Caffeine.
 * Not shared between instances; meant for single-instance deployments and local runs.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "collector.cache", name = "type", havingValue = "local")
public class LocalProcessedCache implements ProcessedCache {

    /**
     * Key: account number. Entries expire once the processing window has elapsed since marking.
     */
    private final Cache<Integer, Boolean> processedAccounts;

    @Autowired
    public LocalProcessedCache(CollectorProperties properties) {
        this(properties.getCache().getProcessWindow(), Ticker.systemTicker());
    }

    LocalProcessedCache(Duration processWindow, Ticker ticker) {
        this.processedAccounts = Caffeine.newBuilder()
                .expireAfterWrite(processWindow)
                .ticker(ticker)
                .maximumSize(100_000)
                .build();
    }

    @Override
    public boolean processed(int accountId) {
        return processedAccounts.getIfPresent(accountId) != null;
    }

    @Override
    public void markProcessed(int accountId) {
        processedAccounts.put(accountId, Boolean.TRUE);
        log.debug("Account marked processed - accountId: {}", AccountIdMasker.mask(accountId));
    }

    @Override
    public boolean ping() {
        return true;
    }
}
