package com.inboundlogger.domain.log.model.entity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.inboundlogger.types.common.Constants;
import com.inboundlogger.types.enums.ErrorCode;
import com.inboundlogger.types.exception.InboundLoggerException;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpStatus;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 入站请求日志领域实体
 * <p>
 * 每个被采集的请求对应一条记录，只追加不更新；仅保留期清理会删除。
 * </p>
 *
 * @since 2026-10-17
 */
@Data
public class InboundRequestLogEntity {

    private static final ObjectMapper PRETTY_MAPPER = new ObjectMapper();

    /**
     * 主键 ID
     */
    private Long id;

    /**
     * 关联 ID（请求头传入或自动生成）
     */
    private String requestId;

    /**
     * HTTP 方法
     */
    private String httpMethod;

    /**
     * 完整路径（含查询串）
     */
    private String url;

    /**
     * 客户端地址
     */
    private String ipAddress;

    private String userAgent;

    private String referrer;

    /**
     * 请求头（已脱敏）
     */
    private Map<String, String> requestHeaders;

    /**
     * 请求体：结构化数据、文本或空（已脱敏、受大小限制）
     */
    private Object requestBody;

    /**
     * 响应状态码
     */
    private Integer statusCode;

    /**
     * 响应头（已脱敏）
     */
    private Map<String, String> responseHeaders;

    /**
     * 响应体：结构化数据、文本或空
     */
    private Object responseBody;

    /**
     * 耗时（毫秒）
     */
    private Double durationMs;

    /**
     * 关联对象类型
     */
    private String loggableType;

    /**
     * 关联对象 ID
     */
    private Long loggableId;

    /**
     * 元数据
     */
    private Map<String, Object> metadata;

    /**
     * 创建时间
     */
    private LocalDateTime createdAt;

    /**
     * 校验记录是否有效
     */
    public void validate() {
        if (StringUtils.isBlank(httpMethod)) {
            throw new InboundLoggerException(ErrorCode.VALIDATION_ERROR.getCode(), "HTTP method cannot be empty");
        }
        if (StringUtils.isBlank(url)) {
            throw new InboundLoggerException(ErrorCode.VALIDATION_ERROR.getCode(), "URL cannot be empty");
        }
        if (statusCode == null) {
            throw new InboundLoggerException(ErrorCode.VALIDATION_ERROR.getCode(), "Status code cannot be empty");
        }
        if (durationMs != null && durationMs < 0) {
            throw new InboundLoggerException(ErrorCode.VALIDATION_ERROR.getCode(), "Duration cannot be negative");
        }
    }

    public String formattedCall() {
        return httpMethod + " " + url;
    }

    public String formattedRequest() {
        return formattedCall() + "\n" + formattedHeaders(requestHeaders) + "\n\n" + formattedBody(requestBody);
    }

    public String formattedResponse() {
        return "HTTP " + statusCode + " " + statusText() + "\n" + formattedHeaders(responseHeaders) + "\n\n"
                + formattedBody(responseBody);
    }

    /**
     * 2xx 与 3xx 视为成功
     */
    public boolean isSuccess() {
        return statusCode != null && statusCode >= 200 && statusCode <= 399;
    }

    public boolean isFailure() {
        return !isSuccess();
    }

    public boolean isSlow() {
        return isSlow(Constants.DEFAULT_SLOW_THRESHOLD_MS);
    }

    public boolean isSlow(long thresholdMs) {
        return durationMs != null && durationMs > thresholdMs;
    }

    public Double durationSeconds() {
        if (durationMs == null) {
            return null;
        }
        return BigDecimal.valueOf(durationMs / 1000.0D).setScale(6, RoundingMode.HALF_UP).doubleValue();
    }

    public String formattedDuration() {
        if (durationMs == null) {
            return "N/A";
        }
        if (durationMs < 1000) {
            return round2(durationMs) + "ms";
        }
        return round2(durationMs / 1000.0D) + "s";
    }

    public String statusText() {
        if (statusCode == null) {
            return "";
        }
        HttpStatus status = HttpStatus.resolve(statusCode);
        return status != null ? status.getReasonPhrase() : String.valueOf(statusCode);
    }

    public boolean hasLoggable() {
        return loggableType != null && loggableId != null;
    }

    private static String formattedHeaders(Map<String, String> headers) {
        if (headers == null) {
            return "";
        }
        return headers.entrySet().stream()
                .map(entry -> entry.getKey() + ": " + entry.getValue())
                .collect(Collectors.joining("\n"));
    }

    private static String formattedBody(Object body) {
        if (body == null) {
            return "";
        }
        if (body instanceof String text) {
            return text;
        }
        if (body instanceof Map || body instanceof Collection) {
            try {
                return PRETTY_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(body);
            } catch (JsonProcessingException ex) {
                return String.valueOf(body);
            }
        }
        return String.valueOf(body);
    }

    private static String round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).stripTrailingZeros().toPlainString();
    }
}
