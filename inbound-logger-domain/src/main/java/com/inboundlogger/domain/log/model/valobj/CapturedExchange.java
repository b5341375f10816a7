package com.inboundlogger.domain.log.model.valobj;

import com.inboundlogger.domain.context.model.valobj.HandlerDescriptor;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * 采集过滤器记录下的一次请求/响应交换，尚未脱敏。
 * <p>
 * requestBody 为解析后的结构化值、原始文本或 null；responseBody 为原始文本或 null。
 * </p>
 */
@Value
@Builder
public class CapturedExchange {

    String requestId;
    String httpMethod;
    /** 不含查询串的路径，用于路径排除判断 */
    String path;
    /** 含查询串的完整路径 */
    String fullPath;
    String ipAddress;
    String userAgent;
    String referrer;
    Map<String, String> requestHeaders;
    Object requestBody;
    Integer statusCode;
    Map<String, String> responseHeaders;
    Object responseBody;
    double durationMs;
    HandlerDescriptor handler;
}
