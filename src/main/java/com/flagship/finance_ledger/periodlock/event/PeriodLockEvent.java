package com.flagship.finance_ledger.periodlock.event;

import com.flagship.finance_ledger.actor.Actor;
import com.flagship.finance_ledger.periodlock.PeriodLock;
import com.flagship.finance_ledger.periodlock.Periods;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published on every lock transition so downstream modules can refresh cached period state.
 */
@Value
public class PeriodLockEvent {
    UUID eventId;
    String eventType;
    String organizationId;
    UUID lockId;
    String period;
    String status;
    String actorUserId;
    String lockedBy;
    Instant unlockExpiresAt;
    int unlockExtensionCount;
    Instant occurredAt;

    public static PeriodLockEvent of(PeriodLockEventType type, PeriodLock lock, Actor actor, Instant now) {
        return new PeriodLockEvent(
            UUID.randomUUID(),
            type.eventName(),
            lock.getOrganizationId(),
            lock.getLockId(),
            Periods.format(lock.getPeriod()),
            lock.getStatus().wireValue(),
            actor.getUserId(),
            lock.getLockedBy(),
            lock.getUnlockExpiresAt(),
            lock.getUnlockExtensionCount(),
            now
        );
    }
}
