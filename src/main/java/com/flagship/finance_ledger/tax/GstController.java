package com.flagship.finance_ledger.tax;

import com.flagship.finance_ledger.tax.dto.GstinValidationResponse;
import com.flagship.finance_ledger.tax.dto.StateResponse;
import com.flagship.finance_ledger.tax.dto.ValidateGstinRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * GST lookups used by invoice and vendor forms. Stateless; no organization scope.
 */
@RestController
@RequestMapping("/api/v1/gst")
public class GstController {

    /**
     * Always 200: an invalid GSTIN is a normal answer, reported through {@code valid=false}.
     */
    @PostMapping("/validate-gstin")
    public ResponseEntity<GstinValidationResponse> validateGstin(@RequestBody ValidateGstinRequest request) {
        return ResponseEntity.ok(GstinValidationResponse.from(GstinValidator.validate(request.getGstin())));
    }

    @GetMapping("/states")
    public ResponseEntity<Map<String, List<StateResponse>>> states() {
        List<StateResponse> states = Arrays.stream(IndianState.values())
            .map(StateResponse::from)
            .toList();
        return ResponseEntity.ok(Map.of("states", states));
    }
}
