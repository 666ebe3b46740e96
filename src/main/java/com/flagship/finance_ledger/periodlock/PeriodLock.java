package com.flagship.finance_ledger.periodlock;

import com.flagship.finance_ledger.exception.ConflictException;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.time.YearMonth;
import java.util.UUID;

/**
 * Lock state of one accounting period for one organization.
 *
 * Immutable: every transition returns a new instance with {@code version} bumped, and rejects
 * the call with {@link ConflictException} when the current state does not allow it. The store
 * applies the result only if the persisted row still matches this instance's status,
 * extension count and version.
 *
 * While {@link PeriodLockStatus#UNLOCKED_AMENDMENT} the window closes at
 * {@code unlockExpiresAt}. An expired window still blocks writes until the sweep relocks it.
 */
@Value
@Builder(toBuilder = true)
public class PeriodLock {

    public static final String AUTO_RELOCK_REASON = "Auto-relocked after amendment window expired";

    UUID lockId;
    String organizationId;
    YearMonth period;
    PeriodLockStatus status;
    String lockedBy;
    Instant lockedAt;
    String lockReason;
    String unlockedBy;
    Instant unlockedAt;
    String unlockReason;
    Instant unlockExpiresAt;
    int unlockExtensionCount;
    long version;
    Instant createdAt;
    Instant updatedAt;

    /**
     * First lock of a period: creates the record.
     */
    public static PeriodLock create(String organizationId, YearMonth period, String lockedBy,
                                    String reason, Instant now) {
        return PeriodLock.builder()
                .lockId(UUID.randomUUID())
                .organizationId(organizationId)
                .period(period)
                .status(PeriodLockStatus.LOCKED)
                .lockedBy(lockedBy)
                .lockedAt(now)
                .lockReason(reason == null ? "" : reason)
                .unlockExtensionCount(0)
                .version(0)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * Manual re-lock of a period that is open for amendment. Clears the amendment fields.
     */
    public PeriodLock relock(String lockedBy, String reason, Instant now) {
        if (status == PeriodLockStatus.LOCKED) {
            throw new ConflictException(String.format("Period %s is already locked", period));
        }
        return lockedAgain(lockedBy, reason == null ? "" : reason, now);
    }

    public PeriodLock unlock(String unlockedBy, String reason, Duration window, Instant now) {
        if (status != PeriodLockStatus.LOCKED) {
            throw new ConflictException(String.format(
                    "Period %s is not locked (current status: %s)", period, status.wireValue()));
        }
        return toBuilder()
                .status(PeriodLockStatus.UNLOCKED_AMENDMENT)
                .unlockedBy(unlockedBy)
                .unlockedAt(now)
                .unlockReason(reason)
                .unlockExpiresAt(now.plus(window))
                .unlockExtensionCount(0)
                .version(version + 1)
                .updatedAt(now)
                .build();
    }

    /**
     * Pushes the amendment deadline out by {@code additional}, never past
     * {@code unlockedAt + maxTotalWindow}.
     *
     * A window past its expiry counts as closed, whether or not the sweep has relocked it yet,
     * and cannot be extended; reopening it takes a new unlock.
     */
    public PeriodLock extend(Duration additional, int maxExtensions, Duration maxTotalWindow, Instant now) {
        if (status != PeriodLockStatus.UNLOCKED_AMENDMENT) {
            throw new ConflictException(String.format(
                    "Period %s is not open for amendment (current status: %s)", period, status.wireValue()));
        }
        if (isAmendmentExpired(now)) {
            throw new ConflictException(String.format(
                    "Amendment window for period %s expired at %s", period, unlockExpiresAt));
        }
        if (unlockExtensionCount >= maxExtensions) {
            throw new ConflictException(String.format(
                    "Maximum extensions (%d) reached for period %s", maxExtensions, period));
        }
        Instant requested = unlockExpiresAt.plus(additional);
        Instant ceiling = unlockedAt.plus(maxTotalWindow);
        return toBuilder()
                .unlockExpiresAt(requested.isAfter(ceiling) ? ceiling : requested)
                .unlockExtensionCount(unlockExtensionCount + 1)
                .version(version + 1)
                .updatedAt(now)
                .build();
    }

    /**
     * Closes an expired amendment window on behalf of the background sweep.
     */
    public PeriodLock autoRelock(String systemUser, Instant now) {
        if (status != PeriodLockStatus.UNLOCKED_AMENDMENT || !isAmendmentExpired(now)) {
            throw new ConflictException(String.format(
                    "Period %s has no expired amendment window", period));
        }
        return lockedAgain(systemUser, AUTO_RELOCK_REASON, now);
    }

    public boolean isAmendmentExpired(Instant now) {
        return status == PeriodLockStatus.UNLOCKED_AMENDMENT
                && unlockExpiresAt != null
                && !unlockExpiresAt.isAfter(now);
    }

    /**
     * True when financial writes dated in this period must be rejected at {@code now}.
     *
     * An amendment window is only open while its expiry lies in the future, so a window past
     * its expiry blocks writes even if the relock sweep has not yet set the status back to
     * locked.
     */
    public boolean blocksWritesAt(Instant now) {
        return status == PeriodLockStatus.LOCKED || isAmendmentExpired(now);
    }

    private PeriodLock lockedAgain(String lockedBy, String reason, Instant now) {
        return toBuilder()
                .status(PeriodLockStatus.LOCKED)
                .lockedBy(lockedBy)
                .lockedAt(now)
                .lockReason(reason)
                .unlockedBy(null)
                .unlockedAt(null)
                .unlockReason(null)
                .unlockExpiresAt(null)
                .unlockExtensionCount(0)
                .version(version + 1)
                .updatedAt(now)
                .build();
    }
}
