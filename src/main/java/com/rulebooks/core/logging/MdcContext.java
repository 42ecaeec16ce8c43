package com.rulebooks.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing importer-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setImport(String projectName, String projectUrl) {
        MDC.put("projectName", projectName);
        MDC.put("projectUrl", projectUrl);
    }

    public static void setProjectId(long projectId) {
        MDC.put("projectId", String.valueOf(projectId));
    }

    public static void setRulebook(String rulebook) {
        MDC.put("rulebook", rulebook);
    }

    public static void clearRulebook() {
        MDC.remove("rulebook");
    }

    public static void clear() {
        MDC.remove("projectName");
        MDC.remove("projectUrl");
        MDC.remove("projectId");
        MDC.remove("rulebook");
    }
}
