package com.taskledger.core.memory;

import com.taskledger.core.metrics.LedgerMetrics;
import com.taskledger.core.persistence.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically removes expired items from the durable key-value store.
 */
@Component
public class ExpiredMemoryCleaner {

    private static final Logger log = LoggerFactory.getLogger(ExpiredMemoryCleaner.class);

    private final KeyValueStore store;
    private final LedgerMetrics metrics;

    public ExpiredMemoryCleaner(@Qualifier("durableKeyValueStore") KeyValueStore store, LedgerMetrics metrics) {
        this.store = store;
        this.metrics = metrics;
    }

    @Scheduled(fixedDelayString = "${taskledger.memory.cleanup-interval:PT10M}")
    public int cleanup() {
        try {
            int removed = store.deleteExpired();
            metrics.recordExpiredMemoryCleanup(removed);
            log.debug("Expired memory sweep removed {} items", removed);
            return removed;
        } catch (StoreException e) {
            log.warn("Expired memory sweep failed: {}", e.getMessage(), e);
            return 0;
        }
    }
}
