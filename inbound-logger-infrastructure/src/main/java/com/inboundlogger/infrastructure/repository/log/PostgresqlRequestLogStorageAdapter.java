package com.inboundlogger.infrastructure.repository.log;

import com.google.common.net.InetAddresses;
import com.inboundlogger.domain.config.service.ConfigurationScope;
import com.inboundlogger.domain.log.service.RequestLogAssembler;
import com.inboundlogger.infrastructure.connection.RequestLogConnection;
import com.inboundlogger.infrastructure.util.JsonCodec;
import com.inboundlogger.types.enums.StorageAdapterKind;

import java.util.Collections;

/**
 * PostgreSQL 存储适配器。body 为 JSONB，键值查询使用 {@code @>} 包含运算。
 */
public class PostgresqlRequestLogStorageAdapter extends AbstractRequestLogStorageAdapter {

    public PostgresqlRequestLogStorageAdapter(RequestLogConnection connection,
                                              RequestLogAssembler requestLogAssembler,
                                              ConfigurationScope configurationScope,
                                              JsonCodec jsonCodec) {
        super(StorageAdapterKind.POSTGRESQL, connection, requestLogAssembler, configurationScope, jsonCodec);
    }

    /**
     * inet 列拒绝非法地址，非法值不写入。
     */
    @Override
    protected String normalizeIpAddress(String ipAddress) {
        return InetAddresses.isInetAddress(ipAddress) ? ipAddress : null;
    }

    @Override
    protected String containment(String key, Object value) {
        return jsonCodec.writeValue(Collections.singletonMap(key, value));
    }
}
