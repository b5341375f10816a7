package com.inboundlogger.domain.context.model.entity;

import com.inboundlogger.domain.context.model.valobj.Loggable;
import com.inboundlogger.domain.context.model.valobj.LoggableReference;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 交给控制器上下文回调的可变日志上下文。
 */
@Data
public class LogContext {

    private LoggableReference loggable;

    private Map<String, Object> metadata = new LinkedHashMap<>();

    public void setLoggable(LoggableReference loggable) {
        this.loggable = loggable;
    }

    public void setLoggable(Loggable loggable) {
        this.loggable = LoggableReference.from(loggable);
    }

    public LogContext put(String key, Object value) {
        metadata.put(key, value);
        return this;
    }
}
