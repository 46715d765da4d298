package com.phoneauth.store;

import com.phoneauth.exception.AuthException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically trims revocation entries whose tokens have expired.
 *
 * Reads already ignore expired entries, so a missed run only costs memory.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.revocation", name = "eviction-enabled", havingValue = "true", matchIfMissing = true)
public class RevocationEvictionTask {

    private final RevocationStore revocationStore;

    @Scheduled(
            fixedDelayString = "${app.revocation.eviction-interval:PT10M}",
            initialDelayString = "${app.revocation.eviction-interval:PT10M}"
    )
    public void evictExpired() {
        try {
            long removed = revocationStore.evictExpired();
            if (removed > 0) {
                log.info("Evicted {} expired revocation entries", removed);
            }
        } catch (AuthException ex) {
            log.warn("Revocation eviction skipped, store unavailable: {}", ex.getErrorCode().getCode());
        }
    }
}
