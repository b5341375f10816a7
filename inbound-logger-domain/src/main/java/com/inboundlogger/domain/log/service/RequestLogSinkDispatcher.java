package com.inboundlogger.domain.log.service;

import com.google.common.cache.Cache;
import com.inboundlogger.domain.config.model.entity.LoggerConfiguration;
import com.inboundlogger.domain.config.model.valobj.SecondarySinkSettings;
import com.inboundlogger.domain.config.service.ConfigurationScope;
import com.inboundlogger.domain.log.adapter.factory.IStorageAdapterFactory;
import com.inboundlogger.domain.log.adapter.repository.IRequestLogStorageAdapter;
import com.inboundlogger.domain.log.model.valobj.CapturedExchange;
import com.inboundlogger.domain.log.model.valobj.LogRequestOptions;
import com.inboundlogger.types.enums.ErrorCode;
import com.inboundlogger.types.exception.InboundLoggerException;
import org.slf4j.Logger;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

/**
 * sink 分发：按 primary -> secondary -> test 的固定顺序写入。
 * <p>
 * 每个 sink 的写入相互独立，任何一个失败只通过配置的 logger 上报，不影响其他 sink，也不会抛给调用方。
 * </p>
 */
@Service
public class RequestLogSinkDispatcher {

    public static final String SINK_PRIMARY = "primary";
    public static final String SINK_SECONDARY = "secondary";
    public static final String SINK_TEST = "test";

    private final ConfigurationScope configurationScope;
    private final IStorageAdapterFactory storageAdapterFactory;
    private final TestRequestLogSink testRequestLogSink;

    /** 未配置缓存句柄时使用 */
    private final Map<String, IRequestLogStorageAdapter> localSecondaryCache = new ConcurrentHashMap<>();

    public RequestLogSinkDispatcher(ConfigurationScope configurationScope,
                                    IStorageAdapterFactory storageAdapterFactory,
                                    TestRequestLogSink testRequestLogSink) {
        this.configurationScope = configurationScope;
        this.storageAdapterFactory = storageAdapterFactory;
        this.testRequestLogSink = testRequestLogSink;
    }

    /**
     * 写入所有已启用的 sink，返回成功写入的 sink 数量。
     */
    public int dispatch(CapturedExchange exchange, LogRequestOptions options) {
        LoggerConfiguration configuration = configurationScope.current();
        int written = 0;
        if (write(SINK_PRIMARY, configuration, storageAdapterFactory::primary, exchange, options)) {
            written++;
        }
        if (configuration.isSecondarySinkEnabled()
                && write(SINK_SECONDARY, configuration, () -> resolveSecondary(configuration), exchange, options)) {
            written++;
        }
        if (testRequestLogSink.isEnabled()
                && write(SINK_TEST, configuration, testRequestLogSink::adapter, exchange, options)) {
            written++;
        }
        return written;
    }

    private boolean write(String sink,
                          LoggerConfiguration configuration,
                          AdapterSupplier adapterSupplier,
                          CapturedExchange exchange,
                          LogRequestOptions options) {
        try {
            IRequestLogStorageAdapter adapter = adapterSupplier.get();
            if (adapter == null || !adapter.available()) {
                return false;
            }
            return adapter.logRequest(exchange, options) != null;
        } catch (Exception ex) {
            report(configuration, sink, ex);
            return false;
        }
    }

    private IRequestLogStorageAdapter resolveSecondary(LoggerConfiguration configuration) {
        SecondarySinkSettings settings = configuration.getSecondarySink();
        if (settings == null) {
            return null;
        }
        Cache<String, Object> cache = configuration.getCacheAdapter();
        if (cache == null) {
            return localSecondaryCache.computeIfAbsent(settings.cacheKey(), key -> createSecondary(settings));
        }
        try {
            return (IRequestLogStorageAdapter) cache.get(settings.cacheKey(), () -> createSecondary(settings));
        } catch (ExecutionException ex) {
            throw new InboundLoggerException(ErrorCode.PERSISTENCE_ERROR.getCode(),
                    "Failed to resolve secondary sink adapter", ex.getCause());
        }
    }

    private IRequestLogStorageAdapter createSecondary(SecondarySinkSettings settings) {
        IRequestLogStorageAdapter adapter = storageAdapterFactory.create(
                settings.getAdapterKind(), settings.getLocation(), settings.connectionName());
        adapter.establishConnection();
        return adapter;
    }

    private static void report(LoggerConfiguration configuration, String sink, Exception ex) {
        Logger logger = configuration.logger();
        if (configuration.isDebugLogging()) {
            logger.error("SINK_WRITE_FAILED sink={}, errorType={}, errorMessage={}",
                    sink, ex.getClass().getSimpleName(), ex.getMessage(), ex);
        } else {
            logger.error("SINK_WRITE_FAILED sink={}, errorType={}, errorMessage={}",
                    sink, ex.getClass().getSimpleName(), ex.getMessage());
        }
    }

    @FunctionalInterface
    private interface AdapterSupplier {
        IRequestLogStorageAdapter get();
    }
}
