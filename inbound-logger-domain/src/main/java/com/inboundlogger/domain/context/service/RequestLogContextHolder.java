package com.inboundlogger.domain.context.service;

import com.inboundlogger.domain.context.model.valobj.Loggable;
import com.inboundlogger.domain.context.model.valobj.LoggableReference;

import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 请求级上下文存储：当前线程的日志元数据与关联对象。
 * <p>
 * 每个工作线程独立持有；采集过滤器在请求结束时无条件调用 {@link #clear()}，
 * 避免上下文泄露到复用线程上的下一个请求。
 * </p>
 */
public final class RequestLogContextHolder {

    public static final String EVENTS_KEY = "events";

    private static final ThreadLocal<Map<String, Object>> METADATA = new ThreadLocal<>();
    private static final ThreadLocal<LoggableReference> LOGGABLE = new ThreadLocal<>();

    private RequestLogContextHolder() {
    }

    /**
     * 覆盖当前元数据（顶层不合并）。
     */
    public static void setMetadata(Map<String, Object> metadata) {
        if (metadata == null) {
            METADATA.remove();
            return;
        }
        METADATA.set(new LinkedHashMap<>(metadata));
    }

    /**
     * 当前元数据的只读视图，未设置时为空 Map。
     */
    public static Map<String, Object> getMetadata() {
        Map<String, Object> metadata = METADATA.get();
        return metadata == null ? Collections.emptyMap() : Collections.unmodifiableMap(metadata);
    }

    public static boolean hasMetadata() {
        Map<String, Object> metadata = METADATA.get();
        return metadata != null && !metadata.isEmpty();
    }

    /**
     * 读取-合并-写回。
     */
    public static void addMetadata(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return;
        }
        Map<String, Object> merged = new LinkedHashMap<>(getMetadata());
        merged.putAll(metadata);
        METADATA.set(merged);
    }

    /**
     * 在元数据的 events 列表中追加一条事件。
     */
    public static void logEvent(String eventName, Map<String, Object> data) {
        List<Object> events = new ArrayList<>();
        Object existing = getMetadata().get(EVENTS_KEY);
        if (existing instanceof List<?> list) {
            events.addAll(list);
        }
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("event", eventName);
        event.put("data", data == null ? Collections.emptyMap() : new LinkedHashMap<>(data));
        event.put("timestamp", OffsetDateTime.now().format(DateTimeFormatter.ISO_OFFSET_DATE_TIME));
        events.add(event);
        addMetadata(Collections.singletonMap(EVENTS_KEY, events));
    }

    public static void setLoggable(LoggableReference loggable) {
        if (loggable == null) {
            LOGGABLE.remove();
            return;
        }
        LOGGABLE.set(loggable);
    }

    public static void setLoggable(Loggable loggable) {
        setLoggable(LoggableReference.from(loggable));
    }

    public static LoggableReference getLoggable() {
        return LOGGABLE.get();
    }

    public static void clear() {
        METADATA.remove();
        LOGGABLE.remove();
    }
}
