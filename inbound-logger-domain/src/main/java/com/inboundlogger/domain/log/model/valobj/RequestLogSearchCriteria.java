package com.inboundlogger.domain.log.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.commons.lang3.StringUtils;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 日志检索条件。
 * <p>
 * q 对 URL 与请求/响应体做大小写不敏感的子串匹配；日期范围两端均包含（起始日零点至结束日末尾）。
 * 结果按创建时间倒序。
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RequestLogSearchCriteria {

    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 1000;

    /** 自由文本 */
    private String q;

    private List<Integer> statuses;

    private List<String> methods;

    private String ipAddress;

    private String loggableType;

    private Long loggableId;

    private LocalDate startDate;

    private LocalDate endDate;

    /** URL 子串（区分大小写） */
    private String urlContains;

    private Integer limit;

    public static RequestLogSearchCriteria all() {
        return new RequestLogSearchCriteria();
    }

    public List<String> normalizedMethods() {
        if (methods == null) {
            return Collections.emptyList();
        }
        return methods.stream()
                .filter(StringUtils::isNotBlank)
                .map(method -> method.trim().toUpperCase(Locale.ROOT))
                .collect(Collectors.toList());
    }

    public List<Integer> normalizedStatuses() {
        if (statuses == null) {
            return Collections.emptyList();
        }
        return statuses.stream().filter(Objects::nonNull).collect(Collectors.toList());
    }

    /**
     * 仅在类型与 ID 同时给出时按关联对象过滤。
     */
    public boolean hasLoggable() {
        return StringUtils.isNotBlank(loggableType) && loggableId != null;
    }

    public LocalDateTime startTime() {
        return startDate == null ? null : startDate.atStartOfDay();
    }

    public LocalDateTime endTime() {
        return endDate == null ? null : endDate.atTime(LocalTime.MAX);
    }

    public int effectiveLimit() {
        if (limit == null || limit <= 0) {
            return DEFAULT_LIMIT;
        }
        return Math.min(limit, MAX_LIMIT);
    }
}
