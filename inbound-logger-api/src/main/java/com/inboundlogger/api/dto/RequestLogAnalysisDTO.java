package com.inboundlogger.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

/**
 * 请求日志统计 DTO。总数为 0 时只返回 totalRequests。
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RequestLogAnalysisDTO {

    private Long totalRequests;
    private Long successfulRequests;
    private Long clientErrorRequests;
    private Long serverErrorRequests;
    /** 成功率（百分比，两位小数） */
    private Double successRate;
    /** 错误率（百分比，两位小数） */
    private Double errorRate;
}
