package com.inboundlogger.domain.log.service;

import com.inboundlogger.domain.config.model.entity.LoggerConfiguration;
import com.inboundlogger.domain.config.model.valobj.ConfigurationOverrides;
import com.inboundlogger.domain.config.model.valobj.SecondarySinkSettings;
import com.inboundlogger.domain.config.service.ConfigurationScope;
import com.inboundlogger.domain.context.model.valobj.Loggable;
import com.inboundlogger.domain.context.model.valobj.LoggableReference;
import com.inboundlogger.domain.context.service.RequestLogContextHolder;
import com.inboundlogger.domain.log.adapter.factory.IStorageAdapterFactory;
import com.inboundlogger.domain.log.model.entity.InboundRequestLogEntity;
import com.inboundlogger.domain.log.model.valobj.RequestLogAnalysis;
import com.inboundlogger.domain.log.model.valobj.RequestLogSearchCriteria;
import com.inboundlogger.types.common.Constants;
import com.inboundlogger.types.enums.ErrorCode;
import com.inboundlogger.types.enums.StorageAdapterKind;
import com.inboundlogger.types.exception.InboundLoggerException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * 请求日志管理入口。
 * <p>
 * 提供启停、配置、当前请求上下文读写、辅助 sink 管理以及主 sink 上的检索、统计与清理。
 * </p>
 *
 * @since 2026-10-17
 */
@Slf4j
@Service
public class InboundHttpLogger {

    private final ConfigurationScope configurationScope;
    private final IStorageAdapterFactory storageAdapterFactory;

    public InboundHttpLogger(ConfigurationScope configurationScope, IStorageAdapterFactory storageAdapterFactory) {
        this.configurationScope = configurationScope;
        this.storageAdapterFactory = storageAdapterFactory;
    }

    public void enable() {
        configurationScope.configure(configuration -> configuration.setEnabled(true));
        log.info("INBOUND_LOGGER_ENABLED scoped={}", configurationScope.hasOverride());
    }

    public void disable() {
        configurationScope.configure(configuration -> configuration.setEnabled(false));
        log.info("INBOUND_LOGGER_DISABLED scoped={}", configurationScope.hasOverride());
    }

    public boolean isEnabled() {
        return configurationScope.current().isEnabled();
    }

    public boolean enabledFor(String controllerName, String actionName) {
        LoggerConfiguration configuration = configurationScope.current();
        return configuration.isEnabled() && configuration.enabledForController(controllerName, actionName);
    }

    public LoggerConfiguration configuration() {
        return configurationScope.current();
    }

    public void configure(Consumer<LoggerConfiguration> customizer) {
        configurationScope.configure(customizer);
    }

    public <T> T withConfiguration(ConfigurationOverrides overrides, Supplier<T> block) {
        return configurationScope.withConfiguration(overrides, block);
    }

    public void setMetadata(Map<String, Object> metadata) {
        RequestLogContextHolder.setMetadata(metadata);
    }

    public void addMetadata(Map<String, Object> metadata) {
        RequestLogContextHolder.addMetadata(metadata);
    }

    public Map<String, Object> getMetadata() {
        return RequestLogContextHolder.getMetadata();
    }

    public void logEvent(String eventName, Map<String, Object> data) {
        RequestLogContextHolder.logEvent(eventName, data);
    }

    public void setLoggable(LoggableReference loggable) {
        RequestLogContextHolder.setLoggable(loggable);
    }

    public void setLoggable(Loggable loggable) {
        RequestLogContextHolder.setLoggable(loggable);
    }

    public LoggableReference getLoggable() {
        return RequestLogContextHolder.getLoggable();
    }

    public void clearContext() {
        RequestLogContextHolder.clear();
    }

    /**
     * 启用辅助 sink。连接串非法时立即抛出 ConfigurationException。
     */
    public void enableSecondarySink(String location, StorageAdapterKind kind) {
        SecondarySinkSettings settings = SecondarySinkSettings.of(location, kind);
        storageAdapterFactory.validateLocation(kind, settings.getLocation());
        configurationScope.configure(configuration -> configuration.configureSecondarySink(settings));
        log.info("SECONDARY_SINK_ENABLED adapter={}", kind.getValue());
    }

    public void disableSecondarySink() {
        configurationScope.configure(LoggerConfiguration::disableSecondarySink);
        log.info("SECONDARY_SINK_DISABLED");
    }

    public boolean isSecondarySinkEnabled() {
        return configurationScope.current().isSecondarySinkEnabled();
    }

    public int cleanup() {
        return cleanup(Constants.DEFAULT_RETENTION_DAYS);
    }

    /**
     * 删除主 sink 中早于 olderThanDays 天的记录。
     */
    public int cleanup(int olderThanDays) {
        if (olderThanDays < 0) {
            throw new InboundLoggerException(ErrorCode.ILLEGAL_PARAMETER.getCode(), "olderThanDays must not be negative");
        }
        int deleted = storageAdapterFactory.primary().cleanup(olderThanDays);
        log.info("INBOUND_LOG_CLEANUP olderThanDays={}, deleted={}", olderThanDays, deleted);
        return deleted;
    }

    public List<InboundRequestLogEntity> search(RequestLogSearchCriteria criteria) {
        return storageAdapterFactory.primary().search(criteria == null ? RequestLogSearchCriteria.all() : criteria);
    }

    public RequestLogAnalysis analyze() {
        return storageAdapterFactory.primary().analyze();
    }
}
