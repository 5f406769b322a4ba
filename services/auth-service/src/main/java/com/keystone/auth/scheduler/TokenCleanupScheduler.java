package com.keystone.auth.scheduler;

import com.keystone.auth.service.TokenService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scheduled jobs for the auth service
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TokenCleanupScheduler {

    private final TokenService tokenService;

    /**
     * Delete expired stored tokens
     * Runs every hour at minute 0 unless configured otherwise
     */
    @Scheduled(cron = "${keystone.auth.tokens.cleanup-cron:0 0 * * * *}")
    public void purgeExpiredTokens() {
        log.debug("=== Scheduled Job: Purge Expired Tokens ===");
        try {
            int deleted = tokenService.sweepExpired();
            if (deleted > 0) {
                log.info("Deleted {} expired tokens", deleted);
            }
        } catch (Exception e) {
            log.error("Error purging expired tokens", e);
        }
    }
}
