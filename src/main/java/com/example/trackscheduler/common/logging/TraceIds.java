package com.example.trackscheduler.common.logging;

import org.slf4j.MDC;

public final class TraceIds {

    private TraceIds() {
    }

    public static String current() {
        String traceId = MDC.get(AccessLogFilter.MDC_REQUEST_ID);
        return traceId == null || traceId.isEmpty() ? "unknown" : traceId;
    }
}
