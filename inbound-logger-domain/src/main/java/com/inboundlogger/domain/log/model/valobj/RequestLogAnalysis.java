package com.inboundlogger.domain.log.model.valobj;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 请求统计：总数、2xx/4xx/5xx 数量以及成功率、错误率（百分比，保留两位小数）。
 * 总数为 0 时只有 totalRequests。
 */
@Value
@Builder
public class RequestLogAnalysis {

    long totalRequests;
    Long successfulRequests;
    Long clientErrorRequests;
    Long serverErrorRequests;
    Double successRate;
    Double errorRate;

    public static RequestLogAnalysis empty() {
        return RequestLogAnalysis.builder().totalRequests(0L).build();
    }

    public static RequestLogAnalysis of(long total, long successful, long clientErrors, long serverErrors) {
        if (total <= 0) {
            return empty();
        }
        return RequestLogAnalysis.builder()
                .totalRequests(total)
                .successfulRequests(successful)
                .clientErrorRequests(clientErrors)
                .serverErrorRequests(serverErrors)
                .successRate(percent(successful, total))
                .errorRate(percent(clientErrors + serverErrors, total))
                .build();
    }

    private static double percent(long part, long total) {
        return BigDecimal.valueOf(part * 100.0D / total).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
