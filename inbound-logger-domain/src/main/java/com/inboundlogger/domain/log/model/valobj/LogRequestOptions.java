package com.inboundlogger.domain.log.model.valobj;

import com.inboundlogger.domain.context.model.valobj.LoggableReference;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * 显式传入的元数据与关联对象，仅在线程上下文缺失时使用。
 */
@Value
@Builder
public class LogRequestOptions {

    private static final LogRequestOptions NONE = LogRequestOptions.builder().build();

    Map<String, Object> metadata;
    LoggableReference loggable;

    public static LogRequestOptions none() {
        return NONE;
    }
}
