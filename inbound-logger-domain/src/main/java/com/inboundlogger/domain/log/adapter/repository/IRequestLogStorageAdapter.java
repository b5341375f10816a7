package com.inboundlogger.domain.log.adapter.repository;

import com.inboundlogger.domain.log.model.entity.InboundRequestLogEntity;
import com.inboundlogger.domain.log.model.valobj.CapturedExchange;
import com.inboundlogger.domain.log.model.valobj.LogRequestOptions;
import com.inboundlogger.domain.log.model.valobj.RequestLogAnalysis;
import com.inboundlogger.domain.log.model.valobj.RequestLogSearchCriteria;
import com.inboundlogger.types.enums.StorageAdapterKind;

import java.util.List;

/**
 * 请求日志存储适配器
 * <p>
 * 每个 sink 对应一个实例。适配器要么复用宿主应用的默认连接，要么使用按名称注册、独立连接池的连接。
 * </p>
 *
 * @since 2026-10-17
 */
public interface IRequestLogStorageAdapter {

    StorageAdapterKind kind();

    /**
     * 命名连接名称；复用宿主连接时为 null
     */
    String connectionName();

    /**
     * 运行时驱动是否可用。不可用时只告警一次，不抛异常。
     */
    boolean available();

    /**
     * 宿主连接模式下为空操作；命名连接模式下注册独立连接池并建表。
     */
    void establishConnection();

    /**
     * 组装并持久化一条日志。被过滤或持久化失败时返回 null（失败已上报 logger）。
     */
    InboundRequestLogEntity logRequest(CapturedExchange exchange, LogRequestOptions options);

    List<InboundRequestLogEntity> search(RequestLogSearchCriteria criteria);

    /**
     * 删除早于 olderThanDays 天的记录，返回删除条数
     */
    int cleanup(int olderThanDays);

    RequestLogAnalysis analyze();

    long count();

    long countWithStatus(int statusCode);

    long countWithStatusBetween(int fromInclusive, int toInclusive);

    long countForPath(String path);

    List<InboundRequestLogEntity> findAll();

    List<InboundRequestLogEntity> findMatching(RequestLogSearchCriteria criteria);

    /**
     * 删除全部记录，仅测试 sink 使用
     */
    int clear();

    List<InboundRequestLogEntity> findWithResponseContaining(String key, Object value);

    List<InboundRequestLogEntity> findWithRequestContaining(String key, Object value);
}
