package com.inboundlogger.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 入站请求日志 PO
 *
 * @since 2026-10-17
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InboundRequestLogPO {

    /**
     * 主键 ID
     */
    private Long id;

    private String requestId;

    private String httpMethod;

    private String url;

    private String ipAddress;

    private String userAgent;

    private String referrer;

    /**
     * 请求头 (JSON)
     */
    private String requestHeaders;

    /**
     * 请求体 (JSON)
     */
    private String requestBody;

    private Integer statusCode;

    /**
     * 响应头 (JSON)
     */
    private String responseHeaders;

    /**
     * 响应体 (JSON)
     */
    private String responseBody;

    private Double durationMs;

    private String loggableType;

    private Long loggableId;

    /**
     * 元数据 (JSON)
     */
    private String metadata;

    /**
     * 创建时间
     */
    private LocalDateTime createdAt;
}
