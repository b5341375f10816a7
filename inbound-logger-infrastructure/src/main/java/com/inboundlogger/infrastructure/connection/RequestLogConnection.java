package com.inboundlogger.infrastructure.connection;

import com.inboundlogger.infrastructure.dao.InboundRequestLogDao;

/**
 * 适配器使用的数据库连接句柄。
 */
public interface RequestLogConnection {

    /**
     * 命名连接名称；宿主连接返回 null
     */
    String name();

    /**
     * 建立连接（命名连接注册连接池并建表，宿主连接为空操作）
     */
    void establish();

    /**
     * 获取 DAO。命名连接未注册时抛出 ConnectionUnavailableException，不回退到宿主连接。
     */
    InboundRequestLogDao dao();
}
