package com.inboundlogger.domain.config.model.valobj;

import java.util.List;

/**
 * 新建配置时使用的默认过滤规则。
 */
public final class LoggerDefaults {

    private LoggerDefaults() {
    }

    public static final List<String> EXCLUDED_PATHS = List.of(
            "^/assets/",
            "^/packs/",
            "^/health$",
            "^/ping$",
            "^/favicon\\.ico$",
            "^/robots\\.txt$",
            "^/sitemap\\.xml$",
            "^/actuator(/|$)",
            "\\.css$",
            "\\.js$",
            "\\.map$",
            "\\.ico$",
            "\\.png$",
            "\\.jpg$",
            "\\.jpeg$",
            "\\.gif$",
            "\\.svg$",
            "\\.woff$",
            "\\.woff2$",
            "\\.ttf$",
            "\\.eot$"
    );

    public static final List<String> EXCLUDED_CONTENT_TYPES = List.of(
            "text/html",
            "text/css",
            "text/javascript",
            "application/javascript",
            "application/x-javascript",
            "image/png",
            "image/jpeg",
            "image/gif",
            "image/svg+xml",
            "image/webp",
            "image/x-icon",
            "video/mp4",
            "video/webm",
            "audio/mpeg",
            "audio/wav",
            "font/woff",
            "font/woff2",
            "application/font-woff",
            "application/font-woff2"
    );

    public static final List<String> SENSITIVE_HEADERS = List.of(
            "authorization",
            "cookie",
            "set-cookie",
            "x-api-key",
            "x-auth-token",
            "x-access-token",
            "bearer",
            "x-csrf-token",
            "x-session-id"
    );

    public static final List<String> SENSITIVE_BODY_KEYS = List.of(
            "password",
            "secret",
            "token",
            "key",
            "auth",
            "credential",
            "private",
            "ssn",
            "social_security_number",
            "credit_card",
            "card_number",
            "cvv",
            "pin"
    );

    /** Framework-internal handlers that never produce useful records. */
    public static final List<String> EXCLUDED_CONTROLLERS = List.of(
            "basicError",
            "health",
            "info"
    );
}
