package com.inboundlogger.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 日志检索参数。LIKE 模式已转义并带通配符。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RequestLogQueryPO {

    /** 小写的自由文本模式 */
    private String textPatternLower;

    /** 原样的自由文本模式 */
    private String textPattern;

    private List<Integer> statuses;

    private List<String> methods;

    private String ipAddress;

    private String loggableType;

    private Long loggableId;

    private LocalDateTime startTime;

    private LocalDateTime endTime;

    private String urlPattern;

    private Integer limit;
}
