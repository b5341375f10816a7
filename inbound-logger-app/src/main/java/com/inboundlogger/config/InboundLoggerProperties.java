package com.inboundlogger.config;

import com.inboundlogger.domain.config.model.entity.LoggerConfiguration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 入站请求日志配置。
 * <p>
 * 列表类配置在默认值之上追加；excluded-paths 可通过 clear-default-excluded-paths 先清空默认值。
 * </p>
 */
@Data
@Component
@ConfigurationProperties(prefix = "inbound-http-logger", ignoreInvalidFields = true)
public class InboundLoggerProperties {

    /** 是否启用请求日志。 */
    private boolean enabled = false;

    /** 是否在错误日志中附带堆栈。 */
    private boolean debugLogging = false;

    /** 采集 body 的最大字节数。 */
    private int maxBodySize = 10_000;

    /** 日志级别（仅记录）。 */
    private String logLevel = "info";

    /** 是否清空默认的排除路径。 */
    private boolean clearDefaultExcludedPaths = false;

    /** 追加的排除路径正则。 */
    private List<String> excludedPaths = new ArrayList<>();

    /** 追加的排除内容类型。 */
    private List<String> excludedContentTypes = new ArrayList<>();

    /** 追加的敏感请求头片段。 */
    private List<String> sensitiveHeaders = new ArrayList<>();

    /** 追加的敏感 body 键片段。 */
    private List<String> sensitiveBodyKeys = new ArrayList<>();

    /** 追加的排除控制器。 */
    private List<String> excludedControllers = new ArrayList<>();

    /** 控制器 -> 排除的动作。 */
    private Map<String, List<String>> excludedActions = new LinkedHashMap<>();

    private Primary primary = new Primary();

    private Secondary secondary = new Secondary();

    private TestSink testSink = new TestSink();

    private Admin admin = new Admin();

    /**
     * 把属性写入配置实例。辅助 sink 与测试 sink 需要连接校验，由启动初始化器单独处理。
     */
    public void applyTo(LoggerConfiguration configuration) {
        configuration.setEnabled(enabled);
        configuration.setDebugLogging(debugLogging);
        configuration.setMaxBodySize(maxBodySize);
        configuration.setLogLevel(logLevel);
        if (clearDefaultExcludedPaths) {
            configuration.clearExcludedPaths();
        }
        excludedPaths.forEach(configuration::excludePath);
        excludedContentTypes.forEach(configuration::excludeContentType);
        sensitiveHeaders.forEach(configuration::addSensitiveHeader);
        sensitiveBodyKeys.forEach(configuration::addSensitiveBodyKey);
        excludedControllers.forEach(configuration::excludeController);
        excludedActions.forEach((controller, actions) ->
                actions.forEach(action -> configuration.excludeAction(controller, action)));
    }

    @Data
    public static class Primary {

        /** 宿主数据源类型：sqlite / postgresql。 */
        private String adapter = "sqlite";
    }

    @Data
    public static class Secondary {

        /** 辅助 sink 连接串，为空表示不启用。 */
        private String location;

        private String adapter = "sqlite";
    }

    @Data
    public static class TestSink {

        private boolean enabled = false;

        /** 为空时使用默认位置。 */
        private String location;

        private String adapter = "sqlite";
    }

    @Data
    public static class Admin {

        /** 管理接口 Bearer token，为空时管理接口全部拒绝。 */
        private String token;
    }
}
