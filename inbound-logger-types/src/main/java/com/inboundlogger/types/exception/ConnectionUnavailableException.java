package com.inboundlogger.types.exception;

import com.inboundlogger.types.enums.ErrorCode;

/**
 * 命名存储连接在 I/O 时无法解析。不会回退到宿主默认连接。
 */
public class ConnectionUnavailableException extends InboundLoggerException {

    private static final long serialVersionUID = 6418810320972284409L;

    private final String connectionName;

    public ConnectionUnavailableException(String connectionName, String message) {
        super(ErrorCode.CONNECTION_UNAVAILABLE.getCode(), message);
        this.connectionName = connectionName;
    }

    public ConnectionUnavailableException(String connectionName, String message, Throwable cause) {
        super(ErrorCode.CONNECTION_UNAVAILABLE.getCode(), message, cause);
        this.connectionName = connectionName;
    }

    public String getConnectionName() {
        return connectionName;
    }
}
