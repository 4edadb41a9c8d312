package com.gamewright.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Gamewright-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    static void setRequest(String requestId, String projectName) {
        MDC.put("requestId", requestId);
        MDC.put("projectName", projectName);
    }

    public static void setGeneration(String requestId, String projectName, String taskKind, String provider) {
        setRequest(requestId, projectName);
        MDC.put("taskKind", taskKind);
        MDC.put("provider", provider);
    }

    public static void clear() {
        MDC.remove("requestId");
        MDC.remove("projectName");
        MDC.remove("taskKind");
        MDC.remove("provider");
    }
}
