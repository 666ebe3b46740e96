package com.flagship.finance_ledger.periodlock;

import com.flagship.finance_ledger.exception.ConflictException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.YearMonth;

import static org.junit.jupiter.api.Assertions.*;

class PeriodLockTest {

    private static final Instant NOW = Instant.parse("2025-07-10T06:00:00Z");
    private static final Duration WEEK = Duration.ofDays(7);

    private final PeriodLock locked = PeriodLock.create("org-1", YearMonth.of(2025, 6), "u-1", "June close", NOW);

    @Test
    @DisplayName("A new record is locked at version 0")
    void create() {
        assertEquals(PeriodLockStatus.LOCKED, locked.getStatus());
        assertEquals(0, locked.getVersion());
        assertTrue(locked.blocksWritesAt(NOW));
    }

    @Test
    @DisplayName("Unlock opens an amendment window and bumps the version")
    void unlock() {
        PeriodLock open = locked.unlock("u-2", "Correct vendor bill", Duration.ofHours(72), NOW);

        assertEquals(PeriodLockStatus.UNLOCKED_AMENDMENT, open.getStatus());
        assertEquals(NOW.plus(Duration.ofHours(72)), open.getUnlockExpiresAt());
        assertEquals(1, open.getVersion());
        assertFalse(open.blocksWritesAt(NOW));
        assertTrue(open.blocksWritesAt(NOW.plus(Duration.ofHours(72))), "expired window blocks before the sweep");
    }

    @Test
    @DisplayName("Only locked periods can be unlocked and only open ones extended")
    void illegalTransitions() {
        PeriodLock open = locked.unlock("u-2", "Correct vendor bill", Duration.ofHours(1), NOW);

        assertThrows(ConflictException.class, () -> open.unlock("u-2", "again please", Duration.ofHours(1), NOW));
        assertThrows(ConflictException.class, () -> locked.extend(Duration.ofHours(1), 2, WEEK, NOW));
        assertThrows(ConflictException.class, () -> locked.relock("u-1", "again", NOW));
        assertThrows(ConflictException.class, () -> open.autoRelock("system", NOW), "window not yet expired");
    }

    @Test
    @DisplayName("Extensions stop at the limit and never pass seven days from the unlock")
    void extensionLimits() {
        PeriodLock open = locked.unlock("u-2", "Correct vendor bill", Duration.ofHours(120), NOW);

        PeriodLock once = open.extend(Duration.ofHours(72), 2, WEEK, NOW);
        assertEquals(NOW.plus(WEEK), once.getUnlockExpiresAt());
        assertEquals(1, once.getUnlockExtensionCount());

        PeriodLock twice = once.extend(Duration.ofHours(1), 2, WEEK, NOW);
        assertEquals(2, twice.getUnlockExtensionCount());

        ConflictException e = assertThrows(ConflictException.class,
                () -> twice.extend(Duration.ofHours(1), 2, WEEK, NOW));
        assertTrue(e.getMessage().contains("Maximum extensions"));
    }

    @Test
    @DisplayName("Relock clears amendment fields and resets the extension count")
    void relockClearsAmendment() {
        PeriodLock open = locked.unlock("u-2", "Correct vendor bill", Duration.ofHours(1), NOW)
                .extend(Duration.ofHours(1), 2, WEEK, NOW);

        PeriodLock relocked = open.autoRelock("system_auto_relock", NOW.plus(Duration.ofHours(3)));

        assertEquals(PeriodLockStatus.LOCKED, relocked.getStatus());
        assertEquals(PeriodLock.AUTO_RELOCK_REASON, relocked.getLockReason());
        assertNull(relocked.getUnlockExpiresAt());
        assertNull(relocked.getUnlockedBy());
        assertEquals(0, relocked.getUnlockExtensionCount());
        assertEquals(3, relocked.getVersion());
    }
}
