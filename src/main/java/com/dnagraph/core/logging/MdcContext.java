package com.dnagraph.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing dna-graph MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String COMMAND = "command";
    public static final String DECISION_ID = "decisionId";

    private MdcContext() {}

    public static void setCommand(String command) {
        MDC.put(COMMAND, command);
    }

    public static void setDecision(String command, String decisionId) {
        MDC.put(COMMAND, command);
        if (decisionId != null) {
            MDC.put(DECISION_ID, decisionId);
        }
    }

    public static void clear() {
        MDC.remove(COMMAND);
        MDC.remove(DECISION_ID);
    }
}
