package com.inboundlogger.types.enums;

import com.inboundlogger.types.exception.ConfigurationException;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

import java.util.Locale;

/**
 * 存储适配器类型。
 */
@Getter
public enum StorageAdapterKind {

    /** 嵌入式单文件数据库，body 以 JSON 文本存储 */
    SQLITE("sqlite", "org.sqlite.JDBC", false),

    /** 服务端数据库，body 以原生 JSONB 存储 */
    POSTGRESQL("postgresql", "org.postgresql.Driver", true);

    private final String value;
    private final String driverClassName;
    private final boolean structuredStorage;

    StorageAdapterKind(String value, String driverClassName, boolean structuredStorage) {
        this.value = value;
        this.driverClassName = driverClassName;
        this.structuredStorage = structuredStorage;
    }

    /**
     * 按配置名解析类型，忽略大小写。
     * 支持 sqlite、sqlite3、postgresql、postgres、pg。
     *
     * @throws ConfigurationException 名称为空或未知
     */
    public static StorageAdapterKind fromValue(String value) {
        if (StringUtils.isBlank(value)) {
            throw new ConfigurationException("Storage adapter kind must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "sqlite":
            case "sqlite3":
                return SQLITE;
            case "postgresql":
            case "postgres":
            case "pg":
                return POSTGRESQL;
            default:
                throw new ConfigurationException("Unsupported storage adapter: " + value);
        }
    }
}
