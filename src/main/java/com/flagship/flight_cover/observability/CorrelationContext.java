package com.flagship.flight_cover.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC keys and helpers shared by the request filter, the policy services and
 * the scheduled jobs. The logging pattern prints all three keys.
 *
 * Requests take their correlation id from {@code X-Correlation-ID} when the
 * client sends one. Scheduled jobs have no request, so each run gets an id
 * prefixed with the job name, e.g. {@code expiry-3f2a9c1d}.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CALLER_ID_HEADER = "X-Caller-Id";

    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String POLICY_ID_MDC_KEY = "policyId";
    public static final String CALLER_ID_MDC_KEY = "callerId";

    private CorrelationContext() {
    }

    /**
     * Binds a request to the MDC. A blank client id is replaced by a fresh one.
     *
     * @return the correlation id in effect
     */
    public static String beginRequest(String clientCorrelationId, String callerId) {
        String id = clientCorrelationId != null && !clientCorrelationId.isBlank()
            ? clientCorrelationId
            : shortId();
        MDC.put(CORRELATION_ID_MDC_KEY, id);
        if (callerId != null && !callerId.isBlank()) {
            MDC.put(CALLER_ID_MDC_KEY, callerId);
        }
        return id;
    }

    /**
     * Starts a scheduled job run, leaving any id already set by a caller alone.
     *
     * @return true when this call set the id and the caller should {@link #clear()} it
     */
    public static boolean beginJob(String jobName) {
        if (MDC.get(CORRELATION_ID_MDC_KEY) != null) {
            return false;
        }
        MDC.put(CORRELATION_ID_MDC_KEY, jobName + "-" + shortId());
        return true;
    }

    public static void putPolicyId(Long policyId) {
        if (policyId != null) {
            MDC.put(POLICY_ID_MDC_KEY, policyId.toString());
        }
    }

    public static void clearPolicyId() {
        MDC.remove(POLICY_ID_MDC_KEY);
    }

    public static String getCorrelationId() {
        return MDC.get(CORRELATION_ID_MDC_KEY);
    }

    public static void clear() {
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(CALLER_ID_MDC_KEY);
        MDC.remove(POLICY_ID_MDC_KEY);
    }

    private static String shortId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
