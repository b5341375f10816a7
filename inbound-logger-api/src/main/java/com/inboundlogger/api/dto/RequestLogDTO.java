package com.inboundlogger.api.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 入站请求日志 DTO。
 */
@Data
public class RequestLogDTO {

    private Long id;
    private String requestId;
    private String httpMethod;
    private String url;
    private String ipAddress;
    private String userAgent;
    private String referrer;
    private Map<String, String> requestHeaders;
    private Object requestBody;
    private Integer statusCode;
    private String statusText;
    private Map<String, String> responseHeaders;
    private Object responseBody;
    private Double durationMs;
    private String formattedDuration;
    private String loggableType;
    private Long loggableId;
    private Map<String, Object> metadata;
    private LocalDateTime createdAt;
}
