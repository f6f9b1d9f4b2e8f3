package com.ryuqq.devloop.adapter.runner;

import org.slf4j.MDC;

/**
 * Utility for managing dev-loop MDC keys for structured logging.
 */
public final class MdcContext {

    static final String SESSION_ID = "sessionId";
    static final String PHASE = "phase";
    static final String ACTOR = "actor";

    private MdcContext() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static void setSession(String sessionId, String phase) {
        MDC.put(SESSION_ID, sessionId);
        MDC.put(PHASE, phase);
    }

    public static void setPhase(String phase) {
        MDC.put(PHASE, phase);
    }

    public static void setActor(String actor) {
        MDC.put(ACTOR, actor);
    }

    public static void clearActor() {
        MDC.remove(ACTOR);
    }

    public static void clear() {
        MDC.remove(SESSION_ID);
        MDC.remove(PHASE);
        MDC.remove(ACTOR);
    }
}
