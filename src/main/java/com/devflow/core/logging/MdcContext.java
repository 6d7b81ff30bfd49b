package com.devflow.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing devflow MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setProject(String projectPath) {
        MDC.put("projectPath", projectPath);
    }

    public static void setDecision(String projectPath, String decisionId) {
        MDC.put("projectPath", projectPath);
        MDC.put("decisionId", decisionId);
    }

    public static void clear() {
        MDC.remove("projectPath");
        MDC.remove("decisionId");
    }
}
