package com.inboundlogger.types.exception;

import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * 请求日志组件异常基类。
 * <p>
 * 包含错误码和错误描述。配置期错误直接抛出，
 * 单次请求的持久化错误只会上报给配置中的 logger。
 * </p>
 *
 * @since 2026-10-17
 */
@EqualsAndHashCode(callSuper = true)
@Data
public class InboundLoggerException extends RuntimeException {

    private static final long serialVersionUID = 3194475301962127721L;

    /** 错误码 */
    private String code;

    /** 错误信息 */
    private String info;

    /**
     * 创建只包含错误码的异常。
     *
     * @param code 错误码
     */
    public InboundLoggerException(String code) {
        super(code);
        this.code = code;
        this.info = code;
    }

    public InboundLoggerException(String code, Throwable cause) {
        super(cause == null ? null : cause.getMessage(), cause);
        this.code = code;
        this.info = cause == null ? null : cause.getMessage();
    }

    /**
     * 创建包含错误码和描述信息的异常。
     *
     * @param code 错误码
     * @param message 错误描述
     */
    public InboundLoggerException(String code, String message) {
        super(message);
        this.code = code;
        this.info = message;
    }

    public InboundLoggerException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.info = message;
    }

    @Override
    public String getMessage() {
        return info != null ? info : super.getMessage();
    }

    @Override
    public String toString() {
        return getClass().getName() + "{" +
                "code='" + code + '\'' +
                ", info='" + info + '\'' +
                '}';
    }

}
