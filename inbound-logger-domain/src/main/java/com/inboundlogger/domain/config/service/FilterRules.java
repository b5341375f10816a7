package com.inboundlogger.domain.config.service;

import com.inboundlogger.domain.config.model.entity.LoggerConfiguration;
import com.inboundlogger.domain.config.model.valobj.BodyParseResult;
import com.inboundlogger.types.common.Constants;
import org.apache.commons.lang3.StringUtils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 过滤规则：路径排除、Content-Type 排除、控制器/动作排除以及敏感字段脱敏。
 * <p>
 * 所有判定都是对创建时拿到的配置快照的纯函数。敏感字段按小写子串匹配，宁可多脱敏也不泄露。
 * </p>
 */
public final class FilterRules {

    /** 结构化 body 脱敏的最大递归深度 */
    public static final int MAX_DEPTH = 64;

    private final Collection<Pattern> excludedPaths;
    private final Set<String> excludedContentTypes;
    private final Set<String> sensitiveHeaders;
    private final Set<String> sensitiveBodyKeys;
    private final Set<String> excludedControllers;
    private final Map<String, Set<String>> excludedActions;
    private final int maxBodySize;

    private FilterRules(LoggerConfiguration configuration) {
        this.excludedPaths = configuration.getExcludedPathPatterns();
        this.excludedContentTypes = configuration.getExcludedContentTypes();
        this.sensitiveHeaders = configuration.getSensitiveHeaders();
        this.sensitiveBodyKeys = configuration.getSensitiveBodyKeys();
        this.excludedControllers = configuration.getExcludedControllers();
        this.excludedActions = configuration.getExcludedActions();
        this.maxBodySize = configuration.getMaxBodySize();
    }

    public static FilterRules of(LoggerConfiguration configuration) {
        return new FilterRules(configuration);
    }

    /**
     * 路径为空或命中任一排除正则（非锚定查找）时返回 false。
     */
    public boolean shouldLogPath(String path) {
        if (path == null) {
            return false;
        }
        for (Pattern pattern : excludedPaths) {
            if (pattern.matcher(path).find()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Content-Type 缺失时放行；否则去掉参数、转小写后判断基础类型是否被排除。
     */
    public boolean shouldLogContentType(String contentType) {
        if (StringUtils.isBlank(contentType)) {
            return true;
        }
        String baseType = contentType.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
        return !excludedContentTypes.contains(baseType);
    }

    public boolean enabledForController(String controllerName, String actionName) {
        if (controllerName == null) {
            return true;
        }
        if (excludedControllers.contains(controllerName)) {
            return false;
        }
        if (actionName != null) {
            Set<String> actions = excludedActions.get(controllerName);
            return actions == null || !actions.contains(actionName);
        }
        return true;
    }

    /**
     * 名称（小写）包含任一敏感片段的请求头替换为脱敏占位符。非 Map 输入返回空 Map。
     */
    public Map<String, String> filterHeaders(Object headers) {
        if (!(headers instanceof Map<?, ?> source)) {
            return new LinkedHashMap<>();
        }
        Map<String, String> filtered = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            String name = String.valueOf(entry.getKey());
            if (isSensitiveHeader(name)) {
                filtered.put(name, Constants.REDACTION_MARKER);
            } else {
                filtered.put(name, headerValue(entry.getValue()));
            }
        }
        return filtered;
    }

    public boolean isSensitiveHeader(String name) {
        return containsAnyFragment(name, sensitiveHeaders);
    }

    public boolean isSensitiveBodyKey(String key) {
        return containsAnyFragment(key, sensitiveBodyKeys);
    }

    /**
     * 文本 body 脱敏：超过最大长度原样返回；可解析为 JSON 时递归脱敏后重新序列化；否则原样返回。
     */
    public String filterBody(String body) {
        if (StringUtils.isEmpty(body)) {
            return body;
        }
        if (exceedsMaxBodySize(body)) {
            return body;
        }
        BodyParseResult result = JsonBodyParser.parse(body);
        if (!result.isParsed()) {
            return body;
        }
        String filtered = JsonBodyParser.write(filterSensitiveData(result.getValue()));
        return filtered == null ? body : filtered;
    }

    /**
     * 已解析数据的脱敏：Map 按 key 判断，List 逐元素递归，其他值原样返回。
     * 超过最大深度或遇到循环引用时，该位置替换为脱敏占位符。
     */
    public Object filterSensitiveData(Object data) {
        return filter(data, 0, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    public boolean exceedsMaxBodySize(String body) {
        return body != null && body.getBytes(StandardCharsets.UTF_8).length > maxBodySize;
    }

    public int getMaxBodySize() {
        return maxBodySize;
    }

    private Object filter(Object data, int depth, Set<Object> visiting) {
        if (!(data instanceof Map) && !(data instanceof Collection)) {
            return data;
        }
        if (depth >= MAX_DEPTH || !visiting.add(data)) {
            return Constants.REDACTION_MARKER;
        }
        try {
            if (data instanceof Map<?, ?> map) {
                Map<Object, Object> filtered = new LinkedHashMap<>();
                for (Map.Entry<?, ?> entry : map.entrySet()) {
                    if (isSensitiveBodyKey(String.valueOf(entry.getKey()))) {
                        filtered.put(entry.getKey(), Constants.REDACTION_MARKER);
                    } else {
                        filtered.put(entry.getKey(), filter(entry.getValue(), depth + 1, visiting));
                    }
                }
                return filtered;
            }
            List<Object> filtered = new ArrayList<>();
            for (Object item : (Collection<?>) data) {
                filtered.add(filter(item, depth + 1, visiting));
            }
            return filtered;
        } finally {
            visiting.remove(data);
        }
    }

    private static boolean containsAnyFragment(String name, Set<String> fragments) {
        if (name == null) {
            return false;
        }
        String normalized = name.toLowerCase(Locale.ROOT);
        for (String fragment : fragments) {
            if (normalized.contains(fragment)) {
                return true;
            }
        }
        return false;
    }

    private static String headerValue(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Collection<?> values) {
            return values.stream().map(String::valueOf).collect(Collectors.joining(", "));
        }
        return String.valueOf(value);
    }
}
