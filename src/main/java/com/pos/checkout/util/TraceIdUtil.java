package com.pos.checkout.util;

import java.util.UUID;

/**
 * 链路追踪ID
 * - 每个请求或后台任务一个ID，保存在 ThreadLocal 中
 * - 写入订单、支付记录和对账队列项，并随 MQ 事件传递
 */
public final class TraceIdUtil {

    private static final ThreadLocal<String> TRACE_ID_HOLDER = new ThreadLocal<>();

    private TraceIdUtil() {
    }

    public static String generateTraceId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    public static void setTraceId(String traceId) {
        TRACE_ID_HOLDER.set(traceId);
    }

    /**
     * Current trace id. Threads outside a request (tests, scheduled jobs) get a fresh one on first use.
     */
    public static String getTraceId() {
        String traceId = TRACE_ID_HOLDER.get();
        if (traceId == null) {
            traceId = generateTraceId();
            TRACE_ID_HOLDER.set(traceId);
        }
        return traceId;
    }

    public static void clearTraceId() {
        TRACE_ID_HOLDER.remove();
    }
}
