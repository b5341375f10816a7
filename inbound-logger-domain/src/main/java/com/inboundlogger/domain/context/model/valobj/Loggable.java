package com.inboundlogger.domain.context.model.valobj;

/**
 * 可与请求日志关联的领域对象。
 */
public interface Loggable {

    Long getLoggableId();

    default String getLoggableType() {
        return getClass().getSimpleName();
    }
}
