package com.inboundlogger.infrastructure.connection;

import com.inboundlogger.types.enums.StorageAdapterKind;
import lombok.Value;

/**
 * 解析后的连接描述：JDBC URL 与可选的账号密码。
 */
@Value
public class StorageLocation {

    StorageAdapterKind kind;

    /** 用户给出的原始连接串 */
    String location;

    String jdbcUrl;

    String username;

    String password;

    /**
     * 不含密码，用于日志输出。
     */
    public String describe() {
        return kind.getValue() + "(" + jdbcUrl + ")";
    }
}
