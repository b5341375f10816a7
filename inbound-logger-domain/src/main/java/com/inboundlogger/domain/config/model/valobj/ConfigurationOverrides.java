package com.inboundlogger.domain.config.model.valobj;

import com.google.common.cache.Cache;
import com.inboundlogger.domain.config.model.entity.LoggerConfiguration;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.slf4j.Logger;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * 作用域覆盖项，由
 * {@link com.inboundlogger.domain.config.service.ConfigurationScope#withConfiguration} 应用到当前生效配置的副本上。
 * <p>
 * 只应用显式设置过的选项；集合类选项追加到副本中；设置了对应的 {@code reset*} 标记时先清空再追加。
 * </p>
 */
@Value
@Builder
public class ConfigurationOverrides {

    Boolean enabled;
    Boolean debugLogging;
    Integer maxBodySize;
    String logLevel;
    boolean resetExcludedPaths;
    @Singular
    List<String> excludedPaths;
    boolean resetExcludedContentTypes;
    @Singular
    List<String> excludedContentTypes;
    @Singular
    List<String> sensitiveHeaders;
    @Singular
    List<String> sensitiveBodyKeys;
    @Singular
    List<String> excludedControllers;
    /** 控制器 -> 排除的动作 */
    @Singular
    Map<String, List<String>> excludedActions;
    Supplier<Logger> loggerFactory;
    Cache<String, Object> cacheAdapter;
    SecondarySinkSettings secondarySink;
    boolean disableSecondarySink;

    public static ConfigurationOverrides none() {
        return ConfigurationOverrides.builder().build();
    }

    public static ConfigurationOverrides enabled(boolean enabled) {
        return ConfigurationOverrides.builder().enabled(enabled).build();
    }

    public void applyTo(LoggerConfiguration configuration) {
        if (enabled != null) {
            configuration.setEnabled(enabled);
        }
        if (debugLogging != null) {
            configuration.setDebugLogging(debugLogging);
        }
        if (maxBodySize != null) {
            configuration.setMaxBodySize(maxBodySize);
        }
        if (logLevel != null) {
            configuration.setLogLevel(logLevel);
        }
        if (resetExcludedPaths) {
            configuration.clearExcludedPaths();
        }
        excludedPaths.forEach(configuration::excludePath);
        if (resetExcludedContentTypes) {
            configuration.clearExcludedContentTypes();
        }
        excludedContentTypes.forEach(configuration::excludeContentType);
        sensitiveHeaders.forEach(configuration::addSensitiveHeader);
        sensitiveBodyKeys.forEach(configuration::addSensitiveBodyKey);
        excludedControllers.forEach(configuration::excludeController);
        excludedActions.forEach((controller, actions) ->
                actions.forEach(action -> configuration.excludeAction(controller, action)));
        if (loggerFactory != null) {
            configuration.setLoggerFactory(loggerFactory);
        }
        if (cacheAdapter != null) {
            configuration.setCacheAdapter(cacheAdapter);
        }
        if (disableSecondarySink) {
            configuration.disableSecondarySink();
        } else if (secondarySink != null) {
            configuration.configureSecondarySink(secondarySink);
        }
    }
}
