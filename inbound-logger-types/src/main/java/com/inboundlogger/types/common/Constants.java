package com.inboundlogger.types.common;

/**
 * 全局常量。
 *
 * @since 2026-10-17
 */
public class Constants {

    /** 敏感请求头/请求体字段的脱敏占位符 */
    public final static String REDACTION_MARKER = "[FILTERED]";

    /** 默认最大采集 body 字节数 */
    public final static int DEFAULT_MAX_BODY_SIZE = 10_000;

    /** cleanup 未指定天数时的默认保留天数 */
    public final static int DEFAULT_RETENTION_DAYS = 90;

    /** 慢请求阈值（毫秒） */
    public final static long DEFAULT_SLOW_THRESHOLD_MS = 1000L;

    /** 入站请求日志表名 */
    public final static String TABLE_NAME = "inbound_request_logs";

    /** 辅助 sink 使用的命名连接 */
    public final static String SECONDARY_CONNECTION_NAME = "inbound_http_logger_secondary";

    /** 测试 sink 使用的命名连接 */
    public final static String TEST_CONNECTION_NAME = "inbound_http_logger_test";

    /** 默认 logger 名称 */
    public final static String LOGGER_NAME = "InboundHttpLogger";

    public final static String SPLIT = ",";

}
