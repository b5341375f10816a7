package com.inboundlogger.infrastructure.repository.log;

import com.inboundlogger.domain.config.service.ConfigurationScope;
import com.inboundlogger.domain.log.service.RequestLogAssembler;
import com.inboundlogger.infrastructure.connection.RequestLogConnection;
import com.inboundlogger.infrastructure.util.JsonCodec;
import com.inboundlogger.types.enums.StorageAdapterKind;

import java.util.Collection;
import java.util.Map;

/**
 * SQLite 存储适配器。JSON 列以文本存储，键值查询通过 json_extract 完成。
 */
public class SqliteRequestLogStorageAdapter extends AbstractRequestLogStorageAdapter {

    public SqliteRequestLogStorageAdapter(RequestLogConnection connection,
                                          RequestLogAssembler requestLogAssembler,
                                          ConfigurationScope configurationScope,
                                          JsonCodec jsonCodec) {
        super(StorageAdapterKind.SQLITE, connection, requestLogAssembler, configurationScope, jsonCodec);
    }

    @Override
    protected String normalizeIpAddress(String ipAddress) {
        return ipAddress;
    }

    @Override
    protected String jsonPath(String key) {
        return "$.\"" + key.replace("\"", "\\\"") + "\"";
    }

    /**
     * json_extract 对 true/false 返回 1/0，对象与数组返回 JSON 文本。
     */
    @Override
    protected Object jsonValue(Object value) {
        if (value instanceof Boolean bool) {
            return bool ? 1 : 0;
        }
        if (value instanceof Map || value instanceof Collection) {
            return jsonCodec.writeValue(value);
        }
        return value;
    }
}
