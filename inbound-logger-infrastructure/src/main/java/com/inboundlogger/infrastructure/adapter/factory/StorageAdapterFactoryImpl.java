package com.inboundlogger.infrastructure.adapter.factory;

import com.inboundlogger.domain.config.service.ConfigurationScope;
import com.inboundlogger.domain.log.adapter.factory.IStorageAdapterFactory;
import com.inboundlogger.domain.log.adapter.repository.IRequestLogStorageAdapter;
import com.inboundlogger.domain.log.service.RequestLogAssembler;
import com.inboundlogger.infrastructure.connection.HostRequestLogConnection;
import com.inboundlogger.infrastructure.connection.NamedConnectionRegistry;
import com.inboundlogger.infrastructure.connection.NamedRequestLogConnection;
import com.inboundlogger.infrastructure.connection.RequestLogConnection;
import com.inboundlogger.infrastructure.connection.StorageLocation;
import com.inboundlogger.infrastructure.connection.StorageLocationParser;
import com.inboundlogger.infrastructure.dao.InboundRequestLogDao;
import com.inboundlogger.infrastructure.repository.log.PostgresqlRequestLogStorageAdapter;
import com.inboundlogger.infrastructure.repository.log.SqliteRequestLogStorageAdapter;
import com.inboundlogger.infrastructure.util.JsonCodec;
import com.inboundlogger.types.enums.StorageAdapterKind;
import com.inboundlogger.types.exception.ConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * 存储适配器工厂实现。
 * <p>
 * 主 sink 固定使用宿主连接，类型由 {@code inbound-http-logger.primary.adapter} 指定；
 * 辅助 sink 与测试 sink 按连接串创建命名连接。
 * </p>
 */
@Slf4j
@Component
public class StorageAdapterFactoryImpl implements IStorageAdapterFactory {

    private final NamedConnectionRegistry namedConnectionRegistry;
    private final RequestLogAssembler requestLogAssembler;
    private final ConfigurationScope configurationScope;
    private final JsonCodec jsonCodec;
    private final IRequestLogStorageAdapter primaryAdapter;

    public StorageAdapterFactoryImpl(InboundRequestLogDao hostDao,
                                     NamedConnectionRegistry namedConnectionRegistry,
                                     RequestLogAssembler requestLogAssembler,
                                     ConfigurationScope configurationScope,
                                     JsonCodec jsonCodec,
                                     @Value("${inbound-http-logger.primary.adapter:sqlite}") String primaryAdapter) {
        this.namedConnectionRegistry = namedConnectionRegistry;
        this.requestLogAssembler = requestLogAssembler;
        this.configurationScope = configurationScope;
        this.jsonCodec = jsonCodec;
        StorageAdapterKind primaryKind = StorageAdapterKind.fromValue(primaryAdapter);
        this.primaryAdapter = newAdapter(primaryKind, new HostRequestLogConnection(hostDao));
        log.info("INBOUND_LOGGER_PRIMARY_ADAPTER adapter={}", primaryKind.getValue());
    }

    @Override
    public IRequestLogStorageAdapter create(StorageAdapterKind kind, String location, String connectionName) {
        if (StringUtils.isBlank(connectionName)) {
            throw new ConfigurationException("Connection name must not be blank");
        }
        StorageLocation storageLocation = StorageLocationParser.parse(kind, location);
        return newAdapter(kind, new NamedRequestLogConnection(namedConnectionRegistry, connectionName, storageLocation));
    }

    @Override
    public void validateLocation(StorageAdapterKind kind, String location) {
        StorageLocationParser.parse(kind, location);
    }

    @Override
    public IRequestLogStorageAdapter primary() {
        return primaryAdapter;
    }

    @Override
    public void release(String connectionName) {
        namedConnectionRegistry.release(connectionName);
    }

    private IRequestLogStorageAdapter newAdapter(StorageAdapterKind kind, RequestLogConnection connection) {
        switch (kind) {
            case SQLITE:
                return new SqliteRequestLogStorageAdapter(connection, requestLogAssembler, configurationScope, jsonCodec);
            case POSTGRESQL:
                return new PostgresqlRequestLogStorageAdapter(connection, requestLogAssembler, configurationScope, jsonCodec);
            default:
                throw new ConfigurationException("Unsupported storage adapter: " + kind);
        }
    }
}
