package com.flagship.finance_ledger.periodlock.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.finance_ledger.periodlock.PeriodLock;
import com.flagship.finance_ledger.periodlock.Periods;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.YearMonth;
import java.util.UUID;

/**
 * Status view of one period. A period without a record is reported as "unlocked".
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PeriodLockResponse {

    public static final String STATUS_UNLOCKED = "unlocked";

    @JsonProperty("lock_id")
    UUID lockId;

    @JsonProperty("period")
    String period;

    @JsonProperty("status")
    String status;

    @JsonProperty("locked_by")
    String lockedBy;

    @JsonProperty("locked_at")
    Instant lockedAt;

    @JsonProperty("lock_reason")
    String lockReason;

    @JsonProperty("unlocked_by")
    String unlockedBy;

    @JsonProperty("unlocked_at")
    Instant unlockedAt;

    @JsonProperty("unlock_reason")
    String unlockReason;

    @JsonProperty("unlock_expires_at")
    Instant unlockExpiresAt;

    @JsonProperty("unlock_extension_count")
    Integer unlockExtensionCount;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static PeriodLockResponse from(PeriodLock lock) {
        return PeriodLockResponse.builder()
            .lockId(lock.getLockId())
            .period(Periods.format(lock.getPeriod()))
            .status(lock.getStatus().wireValue())
            .lockedBy(lock.getLockedBy())
            .lockedAt(lock.getLockedAt())
            .lockReason(lock.getLockReason())
            .unlockedBy(lock.getUnlockedBy())
            .unlockedAt(lock.getUnlockedAt())
            .unlockReason(lock.getUnlockReason())
            .unlockExpiresAt(lock.getUnlockExpiresAt())
            .unlockExtensionCount(lock.getUnlockExtensionCount())
            .updatedAt(lock.getUpdatedAt())
            .build();
    }

    public static PeriodLockResponse unlocked(YearMonth period) {
        return PeriodLockResponse.builder()
            .period(Periods.format(period))
            .status(STATUS_UNLOCKED)
            .build();
    }
}
