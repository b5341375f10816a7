package com.inboundlogger.types.exception;

import com.inboundlogger.types.enums.ErrorCode;

/**
 * 配置期异常。
 * <p>
 * 启动或管理调用时发现无法执行的配置（未知适配器类型、非法连接串、only 与 except 同时声明等）立即抛出。
 * </p>
 */
public class ConfigurationException extends InboundLoggerException {

    private static final long serialVersionUID = -1725871183526470581L;

    public ConfigurationException(String message) {
        super(ErrorCode.CONFIGURATION_ERROR.getCode(), message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(ErrorCode.CONFIGURATION_ERROR.getCode(), message, cause);
    }
}
