package com.inboundlogger.infrastructure.connection;

import com.inboundlogger.infrastructure.dao.InboundRequestLogDao;

/**
 * 按名称注册的独立连接。每次 I/O 都到注册表中解析，连接被释放或名称被改指到其他位置后调用方得到
 * ConnectionUnavailableException。
 */
public class NamedRequestLogConnection implements RequestLogConnection {

    private final NamedConnectionRegistry registry;
    private final String name;
    private final StorageLocation location;

    public NamedRequestLogConnection(NamedConnectionRegistry registry, String name, StorageLocation location) {
        this.registry = registry;
        this.name = name;
        this.location = location;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void establish() {
        registry.register(name, location);
    }

    @Override
    public InboundRequestLogDao dao() {
        return registry.dao(name, location);
    }

    public StorageLocation getLocation() {
        return location;
    }
}
