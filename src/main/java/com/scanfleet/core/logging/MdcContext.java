package com.scanfleet.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing scanfleet-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setJob(String projectKey) {
        MDC.put("projectKey", projectKey);
        MDC.remove("phase");
    }

    public static void setPhase(String phase) {
        MDC.put("phase", phase);
    }

    public static void clear() {
        MDC.remove("projectKey");
        MDC.remove("phase");
    }
}
