package com.inboundlogger.domain.config.model.valobj;

import com.google.common.cache.Cache;
import lombok.Builder;
import lombok.Value;
import org.slf4j.Logger;

import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * {@link com.inboundlogger.domain.config.model.entity.LoggerConfiguration} 的时间点快照。
 * <p>
 * 所有集合均为独立的不可变副本，配置后续的修改不会反映到快照中。
 * </p>
 */
@Value
@Builder
public class ConfigurationSnapshot {

    boolean enabled;
    boolean debugLogging;
    int maxBodySize;
    String logLevel;
    SecondarySinkSettings secondarySink;
    Supplier<Logger> loggerFactory;
    Cache<String, Object> cacheAdapter;
    Set<String> excludedPaths;
    Set<String> excludedContentTypes;
    Set<String> sensitiveHeaders;
    Set<String> sensitiveBodyKeys;
    Set<String> excludedControllers;
    Map<String, Set<String>> excludedActions;
}
