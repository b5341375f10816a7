package com.inboundlogger.trigger.capture;

import com.google.common.base.Ticker;
import com.inboundlogger.domain.config.model.entity.LoggerConfiguration;
import com.inboundlogger.domain.config.model.valobj.BodyParseResult;
import com.inboundlogger.domain.config.service.ConfigurationScope;
import com.inboundlogger.domain.config.service.FilterRules;
import com.inboundlogger.domain.config.service.JsonBodyParser;
import com.inboundlogger.domain.context.model.valobj.HandlerDescriptor;
import com.inboundlogger.domain.context.service.RequestLogContextHolder;
import com.inboundlogger.domain.log.model.valobj.CapturedExchange;
import com.inboundlogger.domain.log.model.valobj.LogRequestOptions;
import com.inboundlogger.domain.log.service.RequestLogSinkDispatcher;
import com.inboundlogger.types.enums.CaptureStage;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingResponseWrapper;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * 入站请求采集过滤器。
 * <p>
 * 处理顺序：准入判断 -> 采集请求体 -> 调用下游 -> 评估响应 -> 组装并写入各 sink -> 清理上下文。
 * 下游调用本身不做 catch，业务异常原样抛出；采集与持久化各自捕获异常，只上报给配置的 logger。
 * 响应体经缓冲后在 finally 中完整写回客户端。
 * </p>
 */
@Slf4j
public class InboundRequestLoggingFilter extends OncePerRequestFilter {

    public static final String HEADER_REQUEST_ID = "X-Request-Id";
    public static final String MDC_REQUEST_ID = "requestId";
    public static final String REQUEST_ID_ATTRIBUTE = InboundRequestLoggingFilter.class.getName() + ".requestId";

    private final ConfigurationScope configurationScope;
    private final RequestLogSinkDispatcher requestLogSinkDispatcher;
    private final Ticker ticker;

    public InboundRequestLoggingFilter(ConfigurationScope configurationScope,
                                       RequestLogSinkDispatcher requestLogSinkDispatcher) {
        this(configurationScope, requestLogSinkDispatcher, Ticker.systemTicker());
    }

    public InboundRequestLoggingFilter(ConfigurationScope configurationScope,
                                       RequestLogSinkDispatcher requestLogSinkDispatcher,
                                       Ticker ticker) {
        this.configurationScope = configurationScope;
        this.requestLogSinkDispatcher = requestLogSinkDispatcher;
        this.ticker = ticker;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        LoggerConfiguration configuration = configurationScope.current();
        if (!admitted(configuration, request)) {
            try {
                filterChain.doFilter(request, response);
            } finally {
                RequestLogContextHolder.clear();
            }
            return;
        }

        String requestId = StringUtils.defaultIfBlank(StringUtils.trimToNull(request.getHeader(HEADER_REQUEST_ID)),
                UUID.randomUUID().toString());
        request.setAttribute(REQUEST_ID_ATTRIBUTE, requestId);
        MDC.put(MDC_REQUEST_ID, requestId);

        CapturedRequest captured = captureRequest(configuration, request);
        ContentCachingResponseWrapper responseWrapper = response instanceof ContentCachingResponseWrapper
                ? (ContentCachingResponseWrapper) response
                : new ContentCachingResponseWrapper(response);

        long startNanos = ticker.read();
        try {
            filterChain.doFilter(captured.request, responseWrapper);
            double durationMs = (ticker.read() - startNanos) / 1_000_000.0D;
            logExchange(configuration, captured, responseWrapper, requestId, durationMs);
        } finally {
            responseWrapper.copyBodyToResponse();
            RequestLogContextHolder.clear();
            MDC.remove(MDC_REQUEST_ID);
        }
    }

    private boolean admitted(LoggerConfiguration configuration, HttpServletRequest request) {
        try {
            return configuration.isEnabled() && configuration.shouldLogPath(request.getRequestURI());
        } catch (RuntimeException ex) {
            report(configuration, CaptureStage.ADMITTED, ex);
            return false;
        }
    }

    /**
     * 读取请求体：声明长度超过上限时不读取（交给下游原样消费）；长度未知时至多读取上限 + 1 个字节，
     * 超过上限或读取中途出错时记录为 absent，下游仍能读到完整请求体。
     */
    private CapturedRequest captureRequest(LoggerConfiguration configuration, HttpServletRequest request) {
        long declaredLength = request.getContentLengthLong();
        if (declaredLength > configuration.getMaxBodySize()) {
            return new CapturedRequest(request, null);
        }
        CachedBodyHttpServletRequest cached;
        try {
            cached = CachedBodyHttpServletRequest.capture(request, configuration.getMaxBodySize());
        } catch (RuntimeException ex) {
            report(configuration, CaptureStage.BODY_CAPTURED, ex);
            return new CapturedRequest(request, null);
        }
        if (cached.getCaptureFailure() != null) {
            report(configuration, CaptureStage.BODY_CAPTURED, cached.getCaptureFailure());
            return new CapturedRequest(cached, null);
        }
        byte[] body = cached.getCachedBody();
        if (!cached.isComplete() || body.length == 0) {
            return new CapturedRequest(cached, null);
        }
        try {
            Charset charset = cached.resolveCharset();
            BodyParseResult parsed = parseBody(new String(body, charset), request.getContentType(), charset);
            return new CapturedRequest(cached, parsed.valueOrRaw());
        } catch (RuntimeException ex) {
            report(configuration, CaptureStage.BODY_CAPTURED, ex);
            return new CapturedRequest(cached, null);
        }
    }

    private void logExchange(LoggerConfiguration configuration,
                             CapturedRequest captured,
                             ContentCachingResponseWrapper response,
                             String requestId,
                             double durationMs) {
        try {
            HttpServletRequest request = captured.request;
            String contentType = response.getContentType();
            if (!configuration.shouldLogContentType(contentType)) {
                return;
            }
            HandlerDescriptor handler = resolveHandler(request);
            if (handler != null && !configuration.enabledForController(handler.getControllerName(), handler.getActionName())) {
                return;
            }
            Object responseBody = shouldCaptureResponseBody(configuration, response.getStatus(), contentType)
                    ? captureResponseBody(configuration, response)
                    : null;

            CapturedExchange exchange = CapturedExchange.builder()
                    .requestId(requestId)
                    .httpMethod(request.getMethod())
                    .path(request.getRequestURI())
                    .fullPath(fullPath(request))
                    .ipAddress(resolveClientIp(request))
                    .userAgent(request.getHeader(HttpHeaders.USER_AGENT))
                    .referrer(request.getHeader(HttpHeaders.REFERER))
                    .requestHeaders(requestHeaders(request))
                    .requestBody(captured.body)
                    .statusCode(response.getStatus())
                    .responseHeaders(responseHeaders(response))
                    .responseBody(responseBody)
                    .durationMs(durationMs)
                    .handler(handler)
                    .build();
            requestLogSinkDispatcher.dispatch(exchange, LogRequestOptions.none());
        } catch (RuntimeException ex) {
            report(configuration, CaptureStage.LOGGED, ex);
        }
    }

    private boolean shouldCaptureResponseBody(LoggerConfiguration configuration, int status, String contentType) {
        if (status == HttpStatus.NO_CONTENT.value()) {
            return false;
        }
        if (status >= 300 && status < 400) {
            return false;
        }
        return configuration.shouldLogContentType(contentType);
    }

    private Object captureResponseBody(LoggerConfiguration configuration, ContentCachingResponseWrapper response) {
        byte[] body = response.getContentAsByteArray();
        if (body.length == 0 || body.length > configuration.getMaxBodySize()) {
            return null;
        }
        Charset charset = resolveCharset(response.getCharacterEncoding());
        return parseBody(new String(body, charset), response.getContentType(), charset).valueOrRaw();
    }

    /**
     * JSON 类型解析为结构化值，表单解析为键值对，其余按原文保留；解析失败退回原文。
     */
    private BodyParseResult parseBody(String text, String contentType, Charset charset) {
        if (StringUtils.isEmpty(text)) {
            return BodyParseResult.absent();
        }
        String mediaType = mediaType(contentType);
        if (mediaType == null) {
            return BodyParseResult.unparsed(text);
        }
        if (mediaType.equals(MediaType.APPLICATION_JSON_VALUE) || mediaType.endsWith("+json")) {
            return JsonBodyParser.parse(text);
        }
        if (mediaType.equals(MediaType.APPLICATION_FORM_URLENCODED_VALUE)) {
            return FormBodyParser.parse(text, charset);
        }
        return BodyParseResult.unparsed(text);
    }

    private HandlerDescriptor resolveHandler(HttpServletRequest request) {
        Object attribute = request.getAttribute(HandlerDescriptor.REQUEST_ATTRIBUTE);
        return attribute instanceof HandlerDescriptor descriptor ? descriptor : null;
    }

    private Map<String, String> requestHeaders(HttpServletRequest request) {
        Map<String, String> headers = new LinkedHashMap<>();
        Collections.list(request.getHeaderNames()).forEach(name ->
                headers.put(name, String.join(", ", Collections.list(request.getHeaders(name)))));
        return headers;
    }

    private Map<String, String> responseHeaders(ContentCachingResponseWrapper response) {
        Map<String, String> headers = new LinkedHashMap<>();
        for (String name : response.getHeaderNames()) {
            Collection<String> values = response.getHeaders(name);
            headers.put(name, String.join(", ", values));
        }
        if (response.getContentType() != null && headers.keySet().stream().noneMatch(HttpHeaders.CONTENT_TYPE::equalsIgnoreCase)) {
            headers.put(HttpHeaders.CONTENT_TYPE, response.getContentType());
        }
        return headers;
    }

    private String fullPath(HttpServletRequest request) {
        String query = request.getQueryString();
        return StringUtils.isBlank(query) ? request.getRequestURI() : request.getRequestURI() + "?" + query;
    }

    private String resolveClientIp(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (StringUtils.isNotBlank(forwarded)) {
            String[] segments = forwarded.split(",");
            if (segments.length > 0 && StringUtils.isNotBlank(segments[0])) {
                return segments[0].trim();
            }
        }
        String realIp = request.getHeader("X-Real-IP");
        if (StringUtils.isNotBlank(realIp)) {
            return realIp.trim();
        }
        return request.getRemoteAddr();
    }

    private static String mediaType(String contentType) {
        if (StringUtils.isBlank(contentType)) {
            return null;
        }
        return contentType.split(";")[0].trim().toLowerCase(Locale.ROOT);
    }

    private static Charset resolveCharset(String encoding) {
        if (StringUtils.isBlank(encoding)) {
            return StandardCharsets.UTF_8;
        }
        try {
            return Charset.forName(encoding);
        } catch (IllegalArgumentException ex) {
            return StandardCharsets.UTF_8;
        }
    }

    private static void report(LoggerConfiguration configuration, CaptureStage stage, Exception ex) {
        Logger logger = configuration.logger();
        if (configuration.isDebugLogging()) {
            logger.error("HTTP_CAPTURE_ERROR stage={}, errorType={}, errorMessage={}",
                    stage, ex.getClass().getSimpleName(), ex.getMessage(), ex);
        } else {
            logger.error("HTTP_CAPTURE_ERROR stage={}, errorType={}, errorMessage={}",
                    stage, ex.getClass().getSimpleName(), ex.getMessage());
        }
    }

    private static final class CapturedRequest {

        private final HttpServletRequest request;
        private final Object body;

        private CapturedRequest(HttpServletRequest request, Object body) {
            this.request = request;
            this.body = body;
        }
    }
}
