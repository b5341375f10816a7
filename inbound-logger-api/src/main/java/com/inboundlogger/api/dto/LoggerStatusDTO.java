package com.inboundlogger.api.dto;

import lombok.Data;

/**
 * 日志组件当前状态。
 */
@Data
public class LoggerStatusDTO {

    private Boolean enabled;
    private Boolean debugLogging;
    private Integer maxBodySize;
    private Boolean secondarySinkEnabled;
    private String secondarySinkAdapter;
}
