package com.aiops.dataCollector.cache.service;

import com.aiops.dataCollector.cache.exception.CacheUnavailableException;

/**
 * Records which accounts were forwarded recently.
 *
 * Entries expire on their own after the processing window; there is no invalidation.
 * Deduplication is best-effort: concurrent submissions for one account may both observe
 * {@code processed == false} before either marks it.
 */
public interface ProcessedCache {

    /**
     * @param accountId Account number
     * @return true if the account was marked within the processing window
     * @throws CacheUnavailableException if the store cannot be reached
     */
    boolean processed(int accountId);

    /**
     * Marks the account as processed for the processing window.
     *
     * @param accountId Account number
     * @throws CacheUnavailableException if the store cannot be reached
     */
    void markProcessed(int accountId);

    /**
     * @return true if the store answers
     */
    boolean ping();
}
