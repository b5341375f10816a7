package com.inboundlogger.domain.config.model.entity;

import com.google.common.cache.Cache;
import com.inboundlogger.domain.config.model.valobj.ConfigurationSnapshot;
import com.inboundlogger.domain.config.model.valobj.LoggerDefaults;
import com.inboundlogger.domain.config.model.valobj.SecondarySinkSettings;
import com.inboundlogger.domain.config.service.FilterRules;
import com.inboundlogger.types.common.Constants;
import com.inboundlogger.types.enums.StorageAdapterKind;
import com.inboundlogger.types.exception.ConfigurationException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 请求日志配置：过滤规则、大小上限与 sink 设置。
 * <p>
 * 集合采用写时复制：每次修改都替换为新的不可变副本，请求线程读取配置时不会看到修改了一半的状态，
 * {@link FilterRules} 中的判定对传入的集合保持纯函数语义。
 * </p>
 *
 * @since 2026-10-17
 */
public class LoggerConfiguration {

    private static final Logger DEFAULT_LOGGER = LoggerFactory.getLogger(Constants.LOGGER_NAME);

    private volatile boolean enabled;
    private volatile boolean debugLogging;
    private volatile int maxBodySize;
    private volatile String logLevel;
    private volatile SecondarySinkSettings secondarySink;
    private volatile Supplier<Logger> loggerFactory;
    private volatile Cache<String, Object> cacheAdapter;

    /** 正则源串 -> 编译后的 Pattern，保持插入顺序 */
    private volatile Map<String, Pattern> excludedPaths;
    private volatile Set<String> excludedContentTypes;
    private volatile Set<String> sensitiveHeaders;
    private volatile Set<String> sensitiveBodyKeys;
    private volatile Set<String> excludedControllers;
    private volatile Map<String, Set<String>> excludedActions;

    public LoggerConfiguration() {
        this.enabled = false;
        this.debugLogging = false;
        this.maxBodySize = Constants.DEFAULT_MAX_BODY_SIZE;
        this.logLevel = "info";
        this.excludedPaths = compile(LoggerDefaults.EXCLUDED_PATHS);
        this.excludedContentTypes = immutableLowerCase(LoggerDefaults.EXCLUDED_CONTENT_TYPES);
        this.sensitiveHeaders = immutableLowerCase(LoggerDefaults.SENSITIVE_HEADERS);
        this.sensitiveBodyKeys = immutableLowerCase(LoggerDefaults.SENSITIVE_BODY_KEYS);
        this.excludedControllers = Collections.unmodifiableSet(new LinkedHashSet<>(LoggerDefaults.EXCLUDED_CONTROLLERS));
        this.excludedActions = Collections.emptyMap();
    }

    /**
     * 创建独立副本。集合只以不可变值的形式共享，修改副本不会影响原配置。
     */
    public LoggerConfiguration copy() {
        LoggerConfiguration copy = new LoggerConfiguration();
        copy.restore(backup());
        return copy;
    }

    public ConfigurationSnapshot backup() {
        Map<String, Set<String>> actions = new LinkedHashMap<>();
        excludedActions.forEach((controller, names) -> actions.put(controller, Set.copyOf(names)));
        return ConfigurationSnapshot.builder()
                .enabled(enabled)
                .debugLogging(debugLogging)
                .maxBodySize(maxBodySize)
                .logLevel(logLevel)
                .secondarySink(secondarySink)
                .loggerFactory(loggerFactory)
                .cacheAdapter(cacheAdapter)
                .excludedPaths(Collections.unmodifiableSet(new LinkedHashSet<>(excludedPaths.keySet())))
                .excludedContentTypes(Collections.unmodifiableSet(new LinkedHashSet<>(excludedContentTypes)))
                .sensitiveHeaders(Collections.unmodifiableSet(new LinkedHashSet<>(sensitiveHeaders)))
                .sensitiveBodyKeys(Collections.unmodifiableSet(new LinkedHashSet<>(sensitiveBodyKeys)))
                .excludedControllers(Collections.unmodifiableSet(new LinkedHashSet<>(excludedControllers)))
                .excludedActions(Collections.unmodifiableMap(actions))
                .build();
    }

    /**
     * 用快照整体替换所有属性，不做合并。
     */
    public synchronized void restore(ConfigurationSnapshot snapshot) {
        if (snapshot == null) {
            throw new ConfigurationException("Configuration snapshot must not be null");
        }
        this.enabled = snapshot.isEnabled();
        this.debugLogging = snapshot.isDebugLogging();
        this.maxBodySize = snapshot.getMaxBodySize();
        this.logLevel = snapshot.getLogLevel();
        this.secondarySink = snapshot.getSecondarySink();
        this.loggerFactory = snapshot.getLoggerFactory();
        this.cacheAdapter = snapshot.getCacheAdapter();
        this.excludedPaths = compile(snapshot.getExcludedPaths());
        this.excludedContentTypes = Collections.unmodifiableSet(new LinkedHashSet<>(snapshot.getExcludedContentTypes()));
        this.sensitiveHeaders = Collections.unmodifiableSet(new LinkedHashSet<>(snapshot.getSensitiveHeaders()));
        this.sensitiveBodyKeys = Collections.unmodifiableSet(new LinkedHashSet<>(snapshot.getSensitiveBodyKeys()));
        this.excludedControllers = Collections.unmodifiableSet(new LinkedHashSet<>(snapshot.getExcludedControllers()));
        Map<String, Set<String>> actions = new LinkedHashMap<>();
        snapshot.getExcludedActions().forEach((controller, names) -> actions.put(controller, Set.copyOf(names)));
        this.excludedActions = Collections.unmodifiableMap(actions);
    }

    public FilterRules filterRules() {
        return FilterRules.of(this);
    }

    public boolean shouldLogPath(String path) {
        return filterRules().shouldLogPath(path);
    }

    public boolean shouldLogContentType(String contentType) {
        return filterRules().shouldLogContentType(contentType);
    }

    public boolean enabledForController(String controllerName, String actionName) {
        return filterRules().enabledForController(controllerName, actionName);
    }

    public Map<String, String> filterHeaders(Object headers) {
        return filterRules().filterHeaders(headers);
    }

    public String filterBody(String body) {
        return filterRules().filterBody(body);
    }

    public Object filterSensitiveData(Object data) {
        return filterRules().filterSensitiveData(data);
    }

    public synchronized void excludePath(String regex) {
        if (StringUtils.isBlank(regex) || excludedPaths.containsKey(regex)) {
            return;
        }
        Map<String, Pattern> next = new LinkedHashMap<>(excludedPaths);
        next.put(regex, compilePattern(regex));
        this.excludedPaths = Collections.unmodifiableMap(next);
    }

    public synchronized void removeExcludedPath(String regex) {
        if (!excludedPaths.containsKey(regex)) {
            return;
        }
        Map<String, Pattern> next = new LinkedHashMap<>(excludedPaths);
        next.remove(regex);
        this.excludedPaths = Collections.unmodifiableMap(next);
    }

    public synchronized void clearExcludedPaths() {
        this.excludedPaths = Collections.emptyMap();
    }

    public synchronized void excludeContentType(String contentType) {
        this.excludedContentTypes = addLowerCase(excludedContentTypes, contentType);
    }

    public synchronized void clearExcludedContentTypes() {
        this.excludedContentTypes = Collections.emptySet();
    }

    public synchronized void addSensitiveHeader(String fragment) {
        this.sensitiveHeaders = addLowerCase(sensitiveHeaders, fragment);
    }

    public synchronized void addSensitiveBodyKey(String fragment) {
        this.sensitiveBodyKeys = addLowerCase(sensitiveBodyKeys, fragment);
    }

    public synchronized void excludeController(String controllerName) {
        if (controllerName == null) {
            return;
        }
        Set<String> next = new LinkedHashSet<>(excludedControllers);
        next.add(controllerName);
        this.excludedControllers = Collections.unmodifiableSet(next);
    }

    public synchronized void excludeAction(String controllerName, String actionName) {
        if (controllerName == null || actionName == null) {
            return;
        }
        Map<String, Set<String>> next = new LinkedHashMap<>(excludedActions);
        Set<String> actions = new LinkedHashSet<>(next.getOrDefault(controllerName, Collections.emptySet()));
        actions.add(actionName);
        next.put(controllerName, Collections.unmodifiableSet(actions));
        this.excludedActions = Collections.unmodifiableMap(next);
    }

    public void configureSecondarySink(String location, StorageAdapterKind adapterKind) {
        configureSecondarySink(SecondarySinkSettings.of(location, adapterKind));
    }

    public void configureSecondarySink(SecondarySinkSettings settings) {
        this.secondarySink = settings;
    }

    public void disableSecondarySink() {
        this.secondarySink = null;
    }

    public boolean isSecondarySinkEnabled() {
        return secondarySink != null;
    }

    /**
     * 上报日志组件自身故障所用的 logger。
     */
    public Logger logger() {
        Supplier<Logger> factory = loggerFactory;
        if (factory == null) {
            return DEFAULT_LOGGER;
        }
        Logger logger = factory.get();
        return logger == null ? DEFAULT_LOGGER : logger;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isDebugLogging() {
        return debugLogging;
    }

    public void setDebugLogging(boolean debugLogging) {
        this.debugLogging = debugLogging;
    }

    public int getMaxBodySize() {
        return maxBodySize;
    }

    public void setMaxBodySize(int maxBodySize) {
        if (maxBodySize < 0) {
            throw new ConfigurationException("max_body_size must not be negative: " + maxBodySize);
        }
        this.maxBodySize = maxBodySize;
    }

    public String getLogLevel() {
        return logLevel;
    }

    public void setLogLevel(String logLevel) {
        this.logLevel = StringUtils.defaultIfBlank(logLevel, "info").trim().toLowerCase(Locale.ROOT);
    }

    public SecondarySinkSettings getSecondarySink() {
        return secondarySink;
    }

    public Supplier<Logger> getLoggerFactory() {
        return loggerFactory;
    }

    public void setLoggerFactory(Supplier<Logger> loggerFactory) {
        this.loggerFactory = loggerFactory;
    }

    public Cache<String, Object> getCacheAdapter() {
        return cacheAdapter;
    }

    public void setCacheAdapter(Cache<String, Object> cacheAdapter) {
        this.cacheAdapter = cacheAdapter;
    }

    public Set<String> getExcludedPaths() {
        return excludedPaths.keySet();
    }

    public java.util.Collection<Pattern> getExcludedPathPatterns() {
        return excludedPaths.values();
    }

    public Set<String> getExcludedContentTypes() {
        return excludedContentTypes;
    }

    public Set<String> getSensitiveHeaders() {
        return sensitiveHeaders;
    }

    public Set<String> getSensitiveBodyKeys() {
        return sensitiveBodyKeys;
    }

    public Set<String> getExcludedControllers() {
        return excludedControllers;
    }

    public Map<String, Set<String>> getExcludedActions() {
        return excludedActions;
    }

    private static Map<String, Pattern> compile(Iterable<String> regexes) {
        Map<String, Pattern> compiled = new LinkedHashMap<>();
        for (String regex : regexes) {
            if (StringUtils.isNotBlank(regex)) {
                compiled.put(regex, compilePattern(regex));
            }
        }
        return Collections.unmodifiableMap(compiled);
    }

    private static Pattern compilePattern(String regex) {
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException ex) {
            throw new ConfigurationException("Invalid excluded path pattern: " + regex, ex);
        }
    }

    private static Set<String> immutableLowerCase(Iterable<String> values) {
        Set<String> result = new LinkedHashSet<>();
        for (String value : values) {
            if (StringUtils.isNotBlank(value)) {
                result.add(value.trim().toLowerCase(Locale.ROOT));
            }
        }
        return Collections.unmodifiableSet(result);
    }

    private static Set<String> addLowerCase(Set<String> current, String value) {
        if (StringUtils.isBlank(value)) {
            return current;
        }
        Set<String> next = new LinkedHashSet<>(current);
        next.add(value.trim().toLowerCase(Locale.ROOT));
        return Collections.unmodifiableSet(next);
    }
}
