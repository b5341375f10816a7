package com.inboundlogger.types.enums;

import lombok.Getter;

/**
 * 统一错误码枚举。
 * <p>
 * 日志核心与管理接口共用。
 * </p>
 *
 * @since 2026-10-17
 */
@Getter
public enum ErrorCode {

    /** 成功 */
    SUCCESS("0000", "成功"),

    /** 未知错误 */
    UN_ERROR("0001", "未知失败"),

    /** 非法参数 */
    ILLEGAL_PARAMETER("0002", "非法参数"),

    /** 日志配置非法 */
    CONFIGURATION_ERROR("0100", "日志配置非法"),

    /** 命名存储连接不可用 */
    CONNECTION_UNAVAILABLE("0101", "存储连接不可用"),

    /** 日志记录持久化失败 */
    PERSISTENCE_ERROR("0102", "日志记录持久化失败"),

    /** 日志记录校验失败 */
    VALIDATION_ERROR("0103", "日志记录校验失败");

    private final String code;
    private final String info;

    ErrorCode(String code, String info) {
        this.code = code;
        this.info = info;
    }

}
