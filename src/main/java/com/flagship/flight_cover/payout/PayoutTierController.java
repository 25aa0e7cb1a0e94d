package com.flagship.flight_cover.payout;

import com.flagship.flight_cover.payout.dto.AddTierRequest;
import com.flagship.flight_cover.payout.dto.PayoutTierResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/payout-tiers")
@RequiredArgsConstructor
public class PayoutTierController {

    private static final String CALLER_HEADER = "X-Caller-Id";

    private final PayoutTierTable tierTable;

    @GetMapping
    public List<PayoutTierResponse> listTiers() {
        return tierTable.listTiers().stream()
            .map(PayoutTierResponse::from)
            .toList();
    }

    @PostMapping
    public ResponseEntity<PayoutTierResponse> addTier(
            @Valid @RequestBody AddTierRequest request,
            @RequestHeader(CALLER_HEADER) String caller) {
        PayoutTier tier = tierTable.addTier(
            request.getMinDelay(), request.getMaxDelay(), request.getMultiplier(), caller);
        return ResponseEntity.status(HttpStatus.CREATED).body(PayoutTierResponse.from(tier));
    }
}
