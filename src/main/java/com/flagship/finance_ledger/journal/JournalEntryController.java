package com.flagship.finance_ledger.journal;

import com.flagship.finance_ledger.actor.Actor;
import com.flagship.finance_ledger.actor.ActorHeaders;
import com.flagship.finance_ledger.exception.ApiError;
import com.flagship.finance_ledger.exception.NotFoundException;
import com.flagship.finance_ledger.exception.ValidationException;
import com.flagship.finance_ledger.journal.dto.JournalEntryPageResponse;
import com.flagship.finance_ledger.journal.dto.JournalEntryResponse;
import com.flagship.finance_ledger.journal.dto.ReversalResponse;
import com.flagship.finance_ledger.journal.dto.ReverseEntryRequest;
import com.flagship.finance_ledger.periodlock.EffectiveDateParser;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
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

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Read access to posted journal entries and the reversal endpoint.
 */
@RestController
@RequestMapping("/api/v1/journal-entries")
@RequiredArgsConstructor
@Slf4j
public class JournalEntryController {

    static final int MAX_PAGE_SIZE = 200;

    private final JournalEntryPoster poster;
    private final PostingGate postingGate;
    private final Clock clock;

    @GetMapping
    public ResponseEntity<JournalEntryPageResponse> list(
            @RequestHeader(ActorHeaders.ORGANIZATION_ID) String organizationId,
            @RequestParam(name = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(name = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(name = "entry_type", required = false) String entryType,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "50") int size) {

        if (page < 0 || size < 1 || size > MAX_PAGE_SIZE) {
            throw new ValidationException("page must be >= 0 and size between 1 and " + MAX_PAGE_SIZE);
        }
        if (from != null && to != null && from.isAfter(to)) {
            throw new ValidationException("'from' must not be after 'to'");
        }

        JournalEntryFilter filter = JournalEntryFilter.builder()
            .from(from)
            .to(to)
            .entryType(parseEntryType(entryType))
            .page(page)
            .size(size)
            .build();

        List<JournalEntryResponse> entries = poster.list(organizationId, filter)
            .stream()
            .map(JournalEntryResponse::from)
            .toList();
        return ResponseEntity.ok(new JournalEntryPageResponse(entries, page, size));
    }

    @GetMapping("/{entryId}")
    public ResponseEntity<JournalEntryResponse> get(
            @RequestHeader(ActorHeaders.ORGANIZATION_ID) String organizationId,
            @PathVariable("entryId") UUID entryId) {

        return poster.get(organizationId, entryId)
            .map(entry -> ResponseEntity.ok(JournalEntryResponse.from(entry)))
            .orElseThrow(() -> new NotFoundException("Journal entry not found: " + entryId));
    }

    /**
     * 201 with the new reversal; 200 with the earlier reversal when the entry was already reversed.
     */
    @PostMapping("/{entryId}/reverse")
    public ResponseEntity<?> reverse(
            @RequestHeader(ActorHeaders.ORGANIZATION_ID) String organizationId,
            @PathVariable("entryId") UUID entryId,
            @Valid @RequestBody ReverseEntryRequest request,
            HttpServletRequest httpRequest) {

        Actor actor = ActorHeaders.resolve(httpRequest);
        LocalDate reversalDate = EffectiveDateParser.parse(request.getDate());
        log.info("Reversal requested: entryId={}, date={}, by={}", entryId, reversalDate, actor.getUserId());

        PostingResult result = postingGate.reverse(organizationId, entryId, reversalDate, request.getReason(), actor);

        if (!result.isOk()) {
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ApiError.builder()
                .error("POSTING_FAILED")
                .message(result.getMessage())
                .timestamp(clock.instant())
                .build());
        }

        ReversalResponse body = new ReversalResponse(
            result.isDuplicate() ? "Journal entry already reversed" : "Journal entry reversed",
            JournalEntryResponse.from(result.getEntry()));
        return ResponseEntity.status(result.isDuplicate() ? HttpStatus.OK : HttpStatus.CREATED).body(body);
    }

    private static EntryType parseEntryType(String entryType) {
        if (entryType == null || entryType.isBlank()) {
            return null;
        }
        try {
            return EntryType.fromString(entryType);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown entry type: " + entryType);
        }
    }
}
