package com.inboundlogger.infrastructure.connection;

import com.inboundlogger.infrastructure.dao.InboundRequestLogDao;

/**
 * 复用宿主应用 DataSource 的连接，DAO 由 mybatis-spring 注入。
 */
public class HostRequestLogConnection implements RequestLogConnection {

    private final InboundRequestLogDao inboundRequestLogDao;

    public HostRequestLogConnection(InboundRequestLogDao inboundRequestLogDao) {
        this.inboundRequestLogDao = inboundRequestLogDao;
    }

    @Override
    public String name() {
        return null;
    }

    @Override
    public void establish() {
    }

    @Override
    public InboundRequestLogDao dao() {
        return inboundRequestLogDao;
    }
}
