package com.flagship.finance_ledger.periodlock;

import com.flagship.finance_ledger.actor.Actor;
import com.flagship.finance_ledger.actor.ActorHeaders;
import com.flagship.finance_ledger.periodlock.dto.AuditEntryResponse;
import com.flagship.finance_ledger.periodlock.dto.CheckPeriodRequest;
import com.flagship.finance_ledger.periodlock.dto.ExtendUnlockRequest;
import com.flagship.finance_ledger.periodlock.dto.LockFiscalYearRequest;
import com.flagship.finance_ledger.periodlock.dto.LockPeriodRequest;
import com.flagship.finance_ledger.periodlock.dto.PeriodCheckResponse;
import com.flagship.finance_ledger.periodlock.dto.PeriodLockListResponse;
import com.flagship.finance_ledger.periodlock.dto.PeriodLockResponse;
import com.flagship.finance_ledger.periodlock.dto.UnlockPeriodRequest;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.YearMonth;
import java.util.List;
import java.util.Map;

/**
 * Administrative surface for period locks.
 *
 * Identity comes from gateway headers: X-Organization-Id scopes every call, X-User-Id and
 * X-User-Role identify the actor for permission checks and the audit trail.
 */
@RestController
@RequestMapping("/api/v1/period-locks")
@RequiredArgsConstructor
@Slf4j
public class PeriodLockController {

    private final PeriodLockService periodLockService;

    @GetMapping
    public ResponseEntity<PeriodLockListResponse> list(
            @RequestHeader(ActorHeaders.ORGANIZATION_ID) String organizationId,
            @RequestParam(name = "year", required = false) Integer year) {

        List<PeriodLockResponse> locks = periodLockService.list(organizationId, year)
            .stream()
            .map(PeriodLockResponse::from)
            .toList();
        return ResponseEntity.ok(PeriodLockListResponse.of(locks));
    }

    @GetMapping("/{period}")
    public ResponseEntity<PeriodLockResponse> get(
            @RequestHeader(ActorHeaders.ORGANIZATION_ID) String organizationId,
            @PathVariable("period") String period) {

        YearMonth yearMonth = Periods.parse(period);
        return ResponseEntity.ok(periodLockService.get(organizationId, period)
            .map(PeriodLockResponse::from)
            .orElseGet(() -> PeriodLockResponse.unlocked(yearMonth)));
    }

    @GetMapping("/{period}/history")
    public ResponseEntity<Map<String, List<AuditEntryResponse>>> history(
            @RequestHeader(ActorHeaders.ORGANIZATION_ID) String organizationId,
            @PathVariable("period") String period) {

        List<AuditEntryResponse> history = periodLockService.history(organizationId, period)
            .stream()
            .map(AuditEntryResponse::from)
            .toList();
        return ResponseEntity.ok(Map.of("history", history));
    }

    @PostMapping("/lock")
    public ResponseEntity<Map<String, PeriodLockResponse>> lock(
            @RequestHeader(ActorHeaders.ORGANIZATION_ID) String organizationId,
            @Valid @RequestBody LockPeriodRequest request,
            HttpServletRequest httpRequest) {

        Actor actor = ActorHeaders.resolve(httpRequest);
        log.info("Lock requested: period={}, by={}", request.getPeriod(), actor.getUserId());

        PeriodLock lock = periodLockService.lock(organizationId, request.getPeriod(), actor, request.getReason());
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(Map.of("lock", PeriodLockResponse.from(lock)));
    }

    @PostMapping("/unlock")
    public ResponseEntity<Map<String, PeriodLockResponse>> unlock(
            @RequestHeader(ActorHeaders.ORGANIZATION_ID) String organizationId,
            @Valid @RequestBody UnlockPeriodRequest request,
            HttpServletRequest httpRequest) {

        Actor actor = ActorHeaders.resolve(httpRequest);
        log.info("Unlock requested: period={}, windowHours={}, by={}",
                request.getPeriod(), request.getWindowHours(), actor.getUserId());

        PeriodLock lock = periodLockService.unlock(organizationId, request.getPeriod(), actor,
                request.getReason(), request.getWindowHours());
        return ResponseEntity.ok(Map.of("lock", PeriodLockResponse.from(lock)));
    }

    @PostMapping("/extend")
    public ResponseEntity<Map<String, PeriodLockResponse>> extend(
            @RequestHeader(ActorHeaders.ORGANIZATION_ID) String organizationId,
            @Valid @RequestBody ExtendUnlockRequest request,
            HttpServletRequest httpRequest) {

        Actor actor = ActorHeaders.resolve(httpRequest);
        log.info("Extension requested: period={}, additionalHours={}, by={}",
                request.getPeriod(), request.getAdditionalHours(), actor.getUserId());

        PeriodLock lock = periodLockService.extend(organizationId, request.getPeriod(), actor,
                request.getAdditionalHours());
        return ResponseEntity.ok(Map.of("lock", PeriodLockResponse.from(lock)));
    }

    /**
     * 200 with the period when writes are allowed; 409 PERIOD_LOCKED otherwise.
     */
    @PostMapping("/check")
    public ResponseEntity<PeriodCheckResponse> check(
            @RequestHeader(ActorHeaders.ORGANIZATION_ID) String organizationId,
            @RequestBody CheckPeriodRequest request) {

        YearMonth period = periodLockService.check(organizationId, request.getDate());
        return ResponseEntity.ok(PeriodCheckResponse.open(Periods.format(period)));
    }

    @PostMapping("/lock-fiscal-year")
    public ResponseEntity<Map<String, List<FiscalYearLockResult>>> lockFiscalYear(
            @RequestHeader(ActorHeaders.ORGANIZATION_ID) String organizationId,
            @Valid @RequestBody LockFiscalYearRequest request,
            HttpServletRequest httpRequest) {

        Actor actor = ActorHeaders.resolve(httpRequest);
        log.info("Fiscal year close requested: year={}, startMonth={}, by={}",
                request.getYear(), request.getFiscalYearStartMonth(), actor.getUserId());

        List<FiscalYearLockResult> results = periodLockService.lockFiscalYear(organizationId,
                request.getYear(), actor, request.getFiscalYearStartMonth());
        return ResponseEntity.ok(Map.of("results", results));
    }

    @PostMapping("/auto-relock")
    public ResponseEntity<Map<String, Integer>> autoRelock(HttpServletRequest httpRequest) {
        Actor actor = ActorHeaders.resolve(httpRequest);
        int relocked = periodLockService.autoRelock(actor);
        return ResponseEntity.ok(Map.of("relocked_count", relocked));
    }
}
