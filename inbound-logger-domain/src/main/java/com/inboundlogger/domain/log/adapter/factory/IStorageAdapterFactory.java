package com.inboundlogger.domain.log.adapter.factory;

import com.inboundlogger.domain.log.adapter.repository.IRequestLogStorageAdapter;
import com.inboundlogger.types.enums.StorageAdapterKind;

/**
 * 存储适配器工厂
 */
public interface IStorageAdapterFactory {

    /**
     * 创建使用命名连接的适配器。
     *
     * @param kind 适配器类型
     * @param location 连接串
     * @param connectionName 连接名称
     */
    IRequestLogStorageAdapter create(StorageAdapterKind kind, String location, String connectionName);

    /**
     * 校验连接串格式，非法时抛出 ConfigurationException。
     */
    void validateLocation(StorageAdapterKind kind, String location);

    /**
     * 宿主连接上的主 sink 适配器。
     */
    IRequestLogStorageAdapter primary();

    /**
     * 释放命名连接。
     */
    void release(String connectionName);
}
