package com.inboundlogger.types.enums;

/**
 * 单个请求在采集过滤器中经历的阶段。
 */
public enum CaptureStage {

    IDLE,
    ADMITTED,
    BODY_CAPTURED,
    HANDLER_INVOKED,
    RESPONSE_EVALUATED,
    LOGGED,
    SUPPRESSED,
    CLEARED;

    public boolean isTerminal() {
        return this == CLEARED;
    }
}
