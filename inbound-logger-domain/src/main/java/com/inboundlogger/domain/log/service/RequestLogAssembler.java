package com.inboundlogger.domain.log.service;

import com.inboundlogger.domain.config.model.entity.LoggerConfiguration;
import com.inboundlogger.domain.config.model.valobj.BodyParseResult;
import com.inboundlogger.domain.config.service.ConfigurationScope;
import com.inboundlogger.domain.config.service.FilterRules;
import com.inboundlogger.domain.config.service.JsonBodyParser;
import com.inboundlogger.domain.context.model.valobj.HandlerDescriptor;
import com.inboundlogger.domain.context.model.valobj.LoggableReference;
import com.inboundlogger.domain.context.service.RequestLogContextHolder;
import com.inboundlogger.domain.log.model.entity.InboundRequestLogEntity;
import com.inboundlogger.domain.log.model.valobj.CapturedExchange;
import com.inboundlogger.domain.log.model.valobj.LogRequestOptions;
import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * 把一次采集到的交换组装为日志实体：合并上下文元数据、脱敏请求头与 body、计算耗时。
 */
public class RequestLogAssembler {

    private final ConfigurationScope configurationScope;
    private final Clock clock;

    public RequestLogAssembler(ConfigurationScope configurationScope) {
        this(configurationScope, Clock.systemDefaultZone());
    }

    public RequestLogAssembler(ConfigurationScope configurationScope, Clock clock) {
        this.configurationScope = configurationScope;
        this.clock = clock;
    }

    /**
     * 路径被排除或缺失时返回 null。
     */
    public InboundRequestLogEntity assemble(CapturedExchange exchange, LogRequestOptions options) {
        if (exchange == null || exchange.getPath() == null) {
            return null;
        }
        LoggerConfiguration configuration = configurationScope.current();
        FilterRules rules = configuration.filterRules();
        if (!rules.shouldLogPath(exchange.getPath())) {
            return null;
        }
        LogRequestOptions effectiveOptions = options == null ? LogRequestOptions.none() : options;

        InboundRequestLogEntity entity = new InboundRequestLogEntity();
        entity.setRequestId(StringUtils.defaultIfBlank(exchange.getRequestId(), UUID.randomUUID().toString()));
        entity.setHttpMethod(exchange.getHttpMethod());
        entity.setUrl(StringUtils.defaultIfBlank(exchange.getFullPath(), exchange.getPath()));
        entity.setIpAddress(exchange.getIpAddress());
        entity.setUserAgent(exchange.getUserAgent());
        entity.setReferrer(exchange.getReferrer());
        entity.setRequestHeaders(rules.filterHeaders(exchange.getRequestHeaders()));
        entity.setRequestBody(filterBodyForStorage(rules, exchange.getRequestBody()));
        entity.setStatusCode(exchange.getStatusCode());
        entity.setResponseHeaders(rules.filterHeaders(exchange.getResponseHeaders()));
        entity.setResponseBody(filterBodyForStorage(rules, exchange.getResponseBody()));
        entity.setDurationMs(roundMillis(exchange.getDurationMs()));
        entity.setMetadata(resolveMetadata(exchange.getHandler(), effectiveOptions));

        LoggableReference loggable = resolveLoggable(effectiveOptions);
        if (loggable != null) {
            entity.setLoggableType(loggable.getType());
            entity.setLoggableId(loggable.getId());
        }
        entity.setCreatedAt(LocalDateTime.now(clock));
        return entity;
    }

    /**
     * 文本 body 能解析为 JSON 时转换为脱敏后的结构化值，否则原样保留；超过大小上限的文本不做处理。
     * 已解析的 Map/List 直接递归脱敏。
     */
    private Object filterBodyForStorage(FilterRules rules, Object body) {
        if (body == null) {
            return null;
        }
        if (body instanceof Map || body instanceof Collection) {
            return rules.filterSensitiveData(body);
        }
        if (!(body instanceof String text) || text.isEmpty()) {
            return body;
        }
        if (rules.exceedsMaxBodySize(text)) {
            return text;
        }
        BodyParseResult result = JsonBodyParser.parse(text);
        if (result.isParsed() && (result.getValue() instanceof Map || result.getValue() instanceof Collection)) {
            return rules.filterSensitiveData(result.getValue());
        }
        return text;
    }

    private Map<String, Object> resolveMetadata(HandlerDescriptor handler, LogRequestOptions options) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (RequestLogContextHolder.hasMetadata()) {
            metadata.putAll(RequestLogContextHolder.getMetadata());
        } else if (options.getMetadata() != null) {
            metadata.putAll(options.getMetadata());
        }
        if (handler != null) {
            metadata.put("controller", handler.getControllerName());
            metadata.put("action", handler.getActionName());
        }
        return metadata;
    }

    private LoggableReference resolveLoggable(LogRequestOptions options) {
        LoggableReference loggable = RequestLogContextHolder.getLoggable();
        return loggable != null ? loggable : options.getLoggable();
    }

    private static double roundMillis(double durationMs) {
        return BigDecimal.valueOf(durationMs).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
