package com.flagship.flight_cover.policy;

import com.flagship.flight_cover.exception.ErrorCode;
import com.flagship.flight_cover.exception.PolicyValidationException;
import com.flagship.flight_cover.policy.dto.CreatePolicyRequest;
import com.flagship.flight_cover.policy.dto.FlightStatusUpdateRequest;
import com.flagship.flight_cover.policy.dto.PolicyIdsResponse;
import com.flagship.flight_cover.policy.dto.PolicyResponse;
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

import java.util.Optional;

/**
 * REST adapter over {@link PolicyLifecycleService}.
 *
 * The caller identity arrives in {@code X-Caller-Id}, authenticated upstream.
 * Creation requires {@code Idempotency-Key}: a replay returns 200 with the
 * original policy instead of 201.
 */
@RestController
@RequestMapping("/api/policies")
@RequiredArgsConstructor
@Slf4j
public class PolicyController {

    private static final String CALLER_HEADER = "X-Caller-Id";
    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final PolicyLifecycleService lifecycleService;
    private final IdempotencyService idempotencyService;

    @PostMapping
    public ResponseEntity<PolicyResponse> createPolicy(
            @Valid @RequestBody CreatePolicyRequest request,
            @RequestHeader(CALLER_HEADER) String caller,
            @RequestHeader(IDEMPOTENCY_KEY_HEADER) String idempotencyKey) {

        Optional<Long> existingId = idempotencyService.checkIdempotencyKey(idempotencyKey);
        if (existingId.isPresent()) {
            log.info("Idempotency key already used, returning policy {}", existingId.get());
            return ResponseEntity.ok(PolicyResponse.from(lifecycleService.getPolicy(existingId.get())));
        }

        Policy policy = lifecycleService.createPolicy(
            idempotencyKey,
            caller,
            request.getFlightNumber(),
            request.getScheduledDeparture(),
            request.getMaxPayout(),
            request.getPremium());
        return ResponseEntity.status(HttpStatus.CREATED).body(PolicyResponse.from(policy));
    }

    @GetMapping("/{id}")
    public PolicyResponse getPolicy(@PathVariable("id") Long id) {
        return PolicyResponse.from(lifecycleService.getPolicy(id));
    }

    /**
     * Policy ids by holder or by flight number; exactly one must be given.
     */
    @GetMapping
    public PolicyIdsResponse findPolicies(
            @RequestParam(value = "holder", required = false) String holder,
            @RequestParam(value = "flightNumber", required = false) String flightNumber) {
        boolean byHolder = holder != null && !holder.isBlank();
        boolean byFlight = flightNumber != null && !flightNumber.isBlank();
        if (byHolder == byFlight) {
            throw new PolicyValidationException(ErrorCode.INVALID_REQUEST,
                "Exactly one of 'holder' or 'flightNumber' is required");
        }
        return new PolicyIdsResponse(byHolder
            ? lifecycleService.getPoliciesByHolder(holder)
            : lifecycleService.getPoliciesByFlight(flightNumber));
    }

    @PostMapping("/{id}/flight-status")
    public PolicyResponse updateFlightStatus(
            @PathVariable("id") Long id,
            @Valid @RequestBody FlightStatusUpdateRequest request,
            @RequestHeader(CALLER_HEADER) String caller) {
        return PolicyResponse.from(lifecycleService.updateFlightStatus(
            id, request.getFlightStatus(), request.getActualDeparture(), caller));
    }

    @PostMapping("/{id}/payout")
    public PolicyResponse processPayout(@PathVariable("id") Long id,
                                        @RequestHeader(CALLER_HEADER) String caller) {
        return PolicyResponse.from(lifecycleService.processPayout(id, caller));
    }

    @PostMapping("/{id}/cancel")
    public PolicyResponse cancelPolicy(@PathVariable("id") Long id,
                                       @RequestHeader(CALLER_HEADER) String caller) {
        return PolicyResponse.from(lifecycleService.cancelPolicy(id, caller));
    }

    @PostMapping("/{id}/expire")
    public PolicyResponse expirePolicy(@PathVariable("id") Long id,
                                       @RequestHeader(CALLER_HEADER) String caller) {
        return PolicyResponse.from(lifecycleService.expirePolicy(id, caller));
    }
}
