package com.inboundlogger.infrastructure.repository.log;

import com.inboundlogger.domain.config.model.entity.LoggerConfiguration;
import com.inboundlogger.domain.config.service.ConfigurationScope;
import com.inboundlogger.domain.log.adapter.repository.IRequestLogStorageAdapter;
import com.inboundlogger.domain.log.model.entity.InboundRequestLogEntity;
import com.inboundlogger.domain.log.model.valobj.CapturedExchange;
import com.inboundlogger.domain.log.model.valobj.LogRequestOptions;
import com.inboundlogger.domain.log.model.valobj.RequestLogAnalysis;
import com.inboundlogger.domain.log.model.valobj.RequestLogSearchCriteria;
import com.inboundlogger.domain.log.service.RequestLogAssembler;
import com.inboundlogger.infrastructure.connection.RequestLogConnection;
import com.inboundlogger.infrastructure.dao.InboundRequestLogDao;
import com.inboundlogger.infrastructure.dao.po.InboundRequestLogPO;
import com.inboundlogger.infrastructure.dao.po.RequestLogQueryPO;
import com.inboundlogger.infrastructure.util.JsonCodec;
import com.inboundlogger.types.enums.StorageAdapterKind;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.springframework.util.ClassUtils;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * 存储适配器公共实现。
 * <p>
 * 负责：
 * <ul>
 *   <li>驱动可用性探测（缺失时每种适配器类型只告警一次）</li>
 *   <li>日志组装后的持久化，失败上报配置的 logger 并返回 null</li>
 *   <li>Entity 与 PO 之间的转换，JSON 列统一以 JSON 文本读写</li>
 *   <li>检索条件到 LIKE 模式的转换</li>
 * </ul>
 * 方言差异（IP 列、JSON 键值查询）由子类提供。
 * </p>
 *
 * @since 2026-10-17
 */
@Slf4j
public abstract class AbstractRequestLogStorageAdapter implements IRequestLogStorageAdapter {

    /** 每种适配器类型只告警一次 */
    private static final Set<StorageAdapterKind> MISSING_DRIVER_WARNED = ConcurrentHashMap.newKeySet();

    private final StorageAdapterKind kind;
    private final RequestLogConnection connection;
    private final RequestLogAssembler requestLogAssembler;
    private final ConfigurationScope configurationScope;
    protected final JsonCodec jsonCodec;

    protected AbstractRequestLogStorageAdapter(StorageAdapterKind kind,
                                               RequestLogConnection connection,
                                               RequestLogAssembler requestLogAssembler,
                                               ConfigurationScope configurationScope,
                                               JsonCodec jsonCodec) {
        this.kind = kind;
        this.connection = connection;
        this.requestLogAssembler = requestLogAssembler;
        this.configurationScope = configurationScope;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public StorageAdapterKind kind() {
        return kind;
    }

    @Override
    public String connectionName() {
        return connection.name();
    }

    @Override
    public boolean available() {
        if (driverPresent()) {
            return true;
        }
        if (MISSING_DRIVER_WARNED.add(kind)) {
            configurationScope.current().logger().warn("STORAGE_DRIVER_MISSING adapter={}, driver={}",
                    kind.getValue(), kind.getDriverClassName());
        }
        return false;
    }

    protected boolean driverPresent() {
        return ClassUtils.isPresent(kind.getDriverClassName(), getClass().getClassLoader());
    }

    @Override
    public void establishConnection() {
        connection.establish();
    }

    @Override
    public InboundRequestLogEntity logRequest(CapturedExchange exchange, LogRequestOptions options) {
        try {
            InboundRequestLogEntity entity = requestLogAssembler.assemble(exchange, options);
            if (entity == null) {
                return null;
            }
            entity.validate();
            InboundRequestLogPO po = toPO(entity);
            dao().insert(po);
            entity.setId(po.getId());
            return entity;
        } catch (Exception ex) {
            reportError(ex);
            return null;
        }
    }

    @Override
    public List<InboundRequestLogEntity> search(RequestLogSearchCriteria criteria) {
        RequestLogSearchCriteria effective = criteria == null ? RequestLogSearchCriteria.all() : criteria;
        RequestLogQueryPO query = toQuery(effective);
        if (query == null) {
            return Collections.emptyList();
        }
        query.setLimit(effective.effectiveLimit());
        return toEntities(dao().search(query));
    }

    @Override
    public int cleanup(int olderThanDays) {
        LocalDateTime cutoff = LocalDateTime.now().minusDays(olderThanDays);
        int deleted = dao().deleteCreatedBefore(cutoff);
        log.info("HTTP_LOG_CLEANUP adapter={}, olderThanDays={}, deleted={}", kind.getValue(), olderThanDays, deleted);
        return deleted;
    }

    @Override
    public RequestLogAnalysis analyze() {
        long total = count();
        if (total == 0) {
            return RequestLogAnalysis.empty();
        }
        return RequestLogAnalysis.of(total,
                countWithStatusBetween(200, 299),
                countWithStatusBetween(400, 499),
                countWithStatusBetween(500, 599));
    }

    @Override
    public long count() {
        return dao().countAll();
    }

    @Override
    public long countWithStatus(int statusCode) {
        return dao().countByStatus(statusCode);
    }

    @Override
    public long countWithStatusBetween(int fromInclusive, int toInclusive) {
        return dao().countByStatusBetween(fromInclusive, toInclusive);
    }

    @Override
    public long countForPath(String path) {
        if (path == null) {
            return 0L;
        }
        return dao().countByUrlPattern(containsPattern(path));
    }

    @Override
    public List<InboundRequestLogEntity> findAll() {
        return toEntities(dao().selectAll());
    }

    /**
     * 与 search 相同的条件，但不截断结果。
     */
    @Override
    public List<InboundRequestLogEntity> findMatching(RequestLogSearchCriteria criteria) {
        RequestLogQueryPO query = toQuery(criteria == null ? RequestLogSearchCriteria.all() : criteria);
        if (query == null) {
            return Collections.emptyList();
        }
        query.setLimit(Integer.MAX_VALUE);
        return toEntities(dao().search(query));
    }

    @Override
    public int clear() {
        return dao().deleteAll();
    }

    @Override
    public List<InboundRequestLogEntity> findWithResponseContaining(String key, Object value) {
        if (StringUtils.isBlank(key)) {
            return Collections.emptyList();
        }
        return toEntities(dao().selectByResponseContaining(jsonPath(key), jsonValue(value), containment(key, value)));
    }

    @Override
    public List<InboundRequestLogEntity> findWithRequestContaining(String key, Object value) {
        if (StringUtils.isBlank(key)) {
            return Collections.emptyList();
        }
        return toEntities(dao().selectByRequestContaining(jsonPath(key), jsonValue(value), containment(key, value)));
    }

    /**
     * 写入前规范化 IP，返回 null 表示不写入该列。
     */
    protected abstract String normalizeIpAddress(String ipAddress);

    /**
     * SQLite 的 json_extract 路径
     */
    protected String jsonPath(String key) {
        return null;
    }

    /**
     * SQLite 的比较值
     */
    protected Object jsonValue(Object value) {
        return null;
    }

    /**
     * PostgreSQL 的 @> 片段
     */
    protected String containment(String key, Object value) {
        return null;
    }

    protected InboundRequestLogDao dao() {
        return connection.dao();
    }

    protected RequestLogConnection connection() {
        return connection;
    }

    private void reportError(Exception ex) {
        LoggerConfiguration configuration = configurationScope.current();
        Logger logger = configuration.logger();
        if (configuration.isDebugLogging()) {
            logger.error("HTTP_LOG_ERROR adapter={}, connection={}, errorType={}, errorMessage={}",
                    kind.getValue(), connection.name(), ex.getClass().getSimpleName(), ex.getMessage(), ex);
        } else {
            logger.error("HTTP_LOG_ERROR adapter={}, connection={}, errorType={}, errorMessage={}",
                    kind.getValue(), connection.name(), ex.getClass().getSimpleName(), ex.getMessage());
        }
    }

    /**
     * IP 条件无效时返回 null，调用方直接返回空结果。
     */
    private RequestLogQueryPO toQuery(RequestLogSearchCriteria criteria) {
        RequestLogQueryPO query = new RequestLogQueryPO();
        if (StringUtils.isNotBlank(criteria.getQ())) {
            String pattern = containsPattern(criteria.getQ().trim());
            query.setTextPattern(pattern);
            query.setTextPatternLower(pattern.toLowerCase(Locale.ROOT));
        }
        query.setStatuses(criteria.normalizedStatuses());
        query.setMethods(criteria.normalizedMethods());
        if (StringUtils.isNotBlank(criteria.getIpAddress())) {
            String ip = normalizeIpAddress(criteria.getIpAddress().trim());
            if (ip == null) {
                return null;
            }
            query.setIpAddress(ip);
        }
        if (criteria.hasLoggable()) {
            query.setLoggableType(criteria.getLoggableType());
            query.setLoggableId(criteria.getLoggableId());
        }
        query.setStartTime(criteria.startTime());
        query.setEndTime(criteria.endTime());
        if (StringUtils.isNotBlank(criteria.getUrlContains())) {
            query.setUrlPattern(containsPattern(criteria.getUrlContains()));
        }
        return query;
    }

    protected static String containsPattern(String value) {
        return "%" + escapeLike(value) + "%";
    }

    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private List<InboundRequestLogEntity> toEntities(List<InboundRequestLogPO> pos) {
        if (pos == null || pos.isEmpty()) {
            return Collections.emptyList();
        }
        return pos.stream().map(this::toEntity).collect(Collectors.toList());
    }

    private InboundRequestLogPO toPO(InboundRequestLogEntity entity) {
        return InboundRequestLogPO.builder()
                .id(entity.getId())
                .requestId(entity.getRequestId())
                .httpMethod(entity.getHttpMethod())
                .url(entity.getUrl())
                .ipAddress(entity.getIpAddress() == null ? null : normalizeIpAddress(entity.getIpAddress()))
                .userAgent(entity.getUserAgent())
                .referrer(entity.getReferrer())
                .requestHeaders(jsonCodec.writeValue(entity.getRequestHeaders()))
                .requestBody(jsonCodec.writeValue(entity.getRequestBody()))
                .statusCode(entity.getStatusCode())
                .responseHeaders(jsonCodec.writeValue(entity.getResponseHeaders()))
                .responseBody(jsonCodec.writeValue(entity.getResponseBody()))
                .durationMs(entity.getDurationMs())
                .loggableType(entity.getLoggableType())
                .loggableId(entity.getLoggableId())
                .metadata(jsonCodec.writeValue(entity.getMetadata()))
                .createdAt(entity.getCreatedAt())
                .build();
    }

    private InboundRequestLogEntity toEntity(InboundRequestLogPO po) {
        InboundRequestLogEntity entity = new InboundRequestLogEntity();
        entity.setId(po.getId());
        entity.setRequestId(po.getRequestId());
        entity.setHttpMethod(po.getHttpMethod());
        entity.setUrl(po.getUrl());
        entity.setIpAddress(po.getIpAddress());
        entity.setUserAgent(po.getUserAgent());
        entity.setReferrer(po.getReferrer());
        entity.setRequestHeaders(jsonCodec.readStringMap(po.getRequestHeaders()));
        entity.setRequestBody(jsonCodec.readAny(po.getRequestBody()));
        entity.setStatusCode(po.getStatusCode());
        entity.setResponseHeaders(jsonCodec.readStringMap(po.getResponseHeaders()));
        entity.setResponseBody(jsonCodec.readAny(po.getResponseBody()));
        entity.setDurationMs(po.getDurationMs());
        entity.setLoggableType(po.getLoggableType());
        entity.setLoggableId(po.getLoggableId());
        Map<String, Object> metadata = jsonCodec.readMap(po.getMetadata());
        entity.setMetadata(metadata);
        entity.setCreatedAt(po.getCreatedAt());
        return entity;
    }
}
