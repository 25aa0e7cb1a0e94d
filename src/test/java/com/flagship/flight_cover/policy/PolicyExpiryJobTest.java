package com.flagship.flight_cover.policy;

import com.flagship.flight_cover.auth.AuthorityPolicy;
import com.flagship.flight_cover.exception.ErrorCode;
import com.flagship.flight_cover.exception.PolicyStateException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PolicyExpiryJobTest {

    private static final String AUTHORITY = "oracle-authority";

    @Mock
    private PolicyLifecycleService lifecycleService;

    private PolicyExpiryJob job;

    @BeforeEach
    void setUp() {
        job = new PolicyExpiryJob(lifecycleService, new AuthorityPolicy(AUTHORITY));
    }

    @Test
    @DisplayName("Every candidate is expired as the authority")
    void testExpireStalePolicies_ExpiresAllCandidates() {
        when(lifecycleService.findExpirablePolicyIds()).thenReturn(List.of(1L, 2L, 3L));

        assertEquals(3, job.expireStalePolicies());

        verify(lifecycleService).expirePolicy(1L, AUTHORITY);
        verify(lifecycleService).expirePolicy(2L, AUTHORITY);
        verify(lifecycleService).expirePolicy(3L, AUTHORITY);
    }

    @Test
    @DisplayName("A policy that changed since the scan is skipped, the rest still expire")
    void testExpireStalePolicies_SkipsRacedPolicy() {
        when(lifecycleService.findExpirablePolicyIds()).thenReturn(List.of(1L, 2L));
        when(lifecycleService.expirePolicy(1L, AUTHORITY))
            .thenThrow(new PolicyStateException(ErrorCode.POLICY_NOT_ACTIVE, 1L, "Policy 1 is CLAIMED"));

        assertEquals(1, job.expireStalePolicies());

        verify(lifecycleService).expirePolicy(2L, AUTHORITY);
    }

    @Test
    @DisplayName("No candidates, no work")
    void testExpireStalePolicies_NoCandidates() {
        when(lifecycleService.findExpirablePolicyIds()).thenReturn(List.of());

        assertEquals(0, job.expireStalePolicies());

        verify(lifecycleService, never()).expirePolicy(any(), anyString());
    }

    @Test
    @DisplayName("A failed scan does not escape the scheduler")
    void testRun_ContainsFailures() {
        when(lifecycleService.findExpirablePolicyIds()).thenThrow(new IllegalStateException("db down"));

        job.run();
    }
}
