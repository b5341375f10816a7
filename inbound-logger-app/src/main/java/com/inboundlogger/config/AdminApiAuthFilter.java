package com.inboundlogger.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.inboundlogger.api.response.Response;
import com.inboundlogger.types.enums.ErrorCode;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * `/admin/inbound-logs/**` 鉴权过滤器。
 * <p>
 * 请求需携带 {@code Authorization: Bearer <token>}，token 与 inbound-http-logger.admin.token 一致才放行。
 * 未配置 token 时管理接口全部拒绝。
 * </p>
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 20)
public class AdminApiAuthFilter extends OncePerRequestFilter {

    public static final String ADMIN_PREFIX = "/admin/inbound-logs";
    private static final String BEARER_PREFIX = "Bearer ";

    private final ObjectMapper objectMapper;
    private final InboundLoggerProperties properties;

    public AdminApiAuthFilter(ObjectMapper objectMapper, InboundLoggerProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (request == null) {
            return true;
        }
        if ("OPTIONS".equalsIgnoreCase(request.getMethod())) {
            return true;
        }
        String path = normalizePath(request.getRequestURI());
        return !(path.equals(ADMIN_PREFIX) || path.startsWith(ADMIN_PREFIX + "/"));
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        try {
            requireValidToken(request.getHeader(HttpHeaders.AUTHORIZATION));
        } catch (IllegalArgumentException ex) {
            if (log.isDebugEnabled()) {
                log.debug("ADMIN_AUTH_REJECTED method={}, path={}, reason={}",
                        request.getMethod(), normalizePath(request.getRequestURI()), ex.getMessage());
            }
            writeUnauthorized(response, ex.getMessage());
            return;
        }
        filterChain.doFilter(request, response);
    }

    private void requireValidToken(String authorization) {
        String expected = StringUtils.trimToNull(properties.getAdmin().getToken());
        if (expected == null) {
            throw new IllegalArgumentException("Admin API token is not configured");
        }
        String value = StringUtils.trimToNull(authorization);
        if (value == null || !StringUtils.startsWithIgnoreCase(value, BEARER_PREFIX)) {
            throw new IllegalArgumentException("Missing bearer token");
        }
        String presented = value.substring(BEARER_PREFIX.length()).trim();
        if (!MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8), presented.getBytes(StandardCharsets.UTF_8))) {
            throw new IllegalArgumentException("Invalid bearer token");
        }
    }

    private void writeUnauthorized(HttpServletResponse response, String message) throws IOException {
        Response<Void> body = Response.<Void>builder()
                .code(ErrorCode.ILLEGAL_PARAMETER.getCode())
                .info(StringUtils.defaultIfBlank(message, "未授权"))
                .build();
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write(objectMapper.writeValueAsString(body));
        response.getWriter().flush();
    }

    private String normalizePath(String path) {
        if (StringUtils.isBlank(path)) {
            return "/";
        }
        return path.trim();
    }
}
