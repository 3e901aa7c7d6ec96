package com.barometer.core.logging;

import org.slf4j.MDC;

/**
 * MDC keys naming the running agent and the target being measured; the
 * log pattern prints {@code agent}.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setAgent(String agent) {
        MDC.put("agent", agent);
    }

    public static void setTarget(String target) {
        MDC.put("target", target);
    }

    public static void clearTarget() {
        MDC.remove("target");
    }

    public static void clear() {
        MDC.remove("agent");
        MDC.remove("target");
    }
}
