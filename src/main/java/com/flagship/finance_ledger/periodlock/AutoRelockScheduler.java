package com.flagship.finance_ledger.periodlock;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs the auto-relock sweep on a fixed delay. Safe to enable on every instance.
 */
@Component
@ConditionalOnProperty(name = "ledger.period-lock.auto-relock.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class AutoRelockScheduler {

    private final PeriodLockService periodLockService;

    @Scheduled(fixedDelayString = "${ledger.period-lock.auto-relock.interval-ms:60000}")
    public void relockExpiredWindows() {
        try {
            int relocked = periodLockService.autoRelock();
            if (relocked > 0) {
                log.info("Auto-relocked {} expired amendment window(s)", relocked);
            }
        } catch (DataAccessException e) {
            log.error("Auto-relock sweep failed: {}", e.getMessage(), e);
        }
    }
}
