package com.inboundlogger.domain.log.service;

import com.inboundlogger.domain.log.adapter.factory.IStorageAdapterFactory;
import com.inboundlogger.domain.log.adapter.repository.IRequestLogStorageAdapter;
import com.inboundlogger.domain.log.model.entity.InboundRequestLogEntity;
import com.inboundlogger.domain.log.model.valobj.CapturedExchange;
import com.inboundlogger.domain.log.model.valobj.LogRequestOptions;
import com.inboundlogger.domain.log.model.valobj.RequestLogAnalysis;
import com.inboundlogger.domain.log.model.valobj.RequestLogSearchCriteria;
import com.inboundlogger.types.common.Constants;
import com.inboundlogger.types.enums.StorageAdapterKind;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 测试 sink：独立的临时存储，供测试断言请求日志。
 * <p>
 * 未启用时所有查询返回 0 或空集合。
 * </p>
 */
@Slf4j
@Service
public class TestRequestLogSink {

    public static final String DEFAULT_SQLITE_LOCATION = "tmp/test_inbound_request_logs.sqlite3";
    public static final String POSTGRES_LOCATION_ENV = "INBOUND_HTTP_LOGGER_TEST_DATABASE_URL";
    public static final String DEFAULT_POSTGRES_LOCATION = "postgresql://localhost/inbound_http_logger_test";

    private final IStorageAdapterFactory storageAdapterFactory;

    private volatile IRequestLogStorageAdapter adapter;
    private volatile boolean enabled;

    public TestRequestLogSink(IStorageAdapterFactory storageAdapterFactory) {
        this.storageAdapterFactory = storageAdapterFactory;
    }

    /**
     * 配置测试存储。location 为空时按类型使用默认位置。
     */
    public synchronized void configure(String location, StorageAdapterKind kind) {
        StorageAdapterKind effectiveKind = kind == null ? StorageAdapterKind.SQLITE : kind;
        String effectiveLocation = StringUtils.isNotBlank(location) ? location : defaultLocation(effectiveKind);
        IRequestLogStorageAdapter configured = storageAdapterFactory.create(
                effectiveKind, effectiveLocation, Constants.TEST_CONNECTION_NAME);
        configured.establishConnection();
        this.adapter = configured;
        log.info("TEST_SINK_CONFIGURED adapter={}, location={}", effectiveKind.getValue(), effectiveLocation);
    }

    public synchronized void enable() {
        if (adapter == null) {
            configure(null, StorageAdapterKind.SQLITE);
        }
        this.enabled = true;
    }

    public void disable() {
        this.enabled = false;
    }

    public boolean isEnabled() {
        IRequestLogStorageAdapter current = adapter;
        return enabled && current != null && current.available();
    }

    public IRequestLogStorageAdapter adapter() {
        return adapter;
    }

    public InboundRequestLogEntity logRequest(CapturedExchange exchange, LogRequestOptions options) {
        if (!isEnabled()) {
            return null;
        }
        return adapter.logRequest(exchange, options);
    }

    public long logsCount() {
        return isEnabled() ? adapter.count() : 0L;
    }

    public long logsWithStatus(int statusCode) {
        return isEnabled() ? adapter.countWithStatus(statusCode) : 0L;
    }

    public long logsForPath(String path) {
        return isEnabled() ? adapter.countForPath(path) : 0L;
    }

    public List<InboundRequestLogEntity> allLogs() {
        return isEnabled() ? adapter.findAll() : Collections.emptyList();
    }

    /**
     * 所有记录的 "METHOD url" 形式
     */
    public List<String> allCalls() {
        return allLogs().stream()
                .map(InboundRequestLogEntity::formattedCall)
                .collect(Collectors.toList());
    }

    public List<InboundRequestLogEntity> logsMatching(RequestLogSearchCriteria criteria) {
        return isEnabled() ? adapter.findMatching(criteria) : Collections.emptyList();
    }

    public RequestLogAnalysis analyze() {
        if (!isEnabled()) {
            return RequestLogAnalysis.empty();
        }
        return adapter.analyze();
    }

    public void clearLogs() {
        if (isEnabled()) {
            adapter.clear();
        }
    }

    public void reset() {
        clearLogs();
        this.enabled = false;
    }

    static String defaultLocation(StorageAdapterKind kind) {
        if (kind == StorageAdapterKind.POSTGRESQL) {
            return StringUtils.defaultIfBlank(System.getenv(POSTGRES_LOCATION_ENV), DEFAULT_POSTGRES_LOCATION);
        }
        return DEFAULT_SQLITE_LOCATION;
    }
}
