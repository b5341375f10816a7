package com.inboundlogger.domain.context.service;

import com.inboundlogger.domain.config.model.entity.LoggerConfiguration;
import com.inboundlogger.domain.context.model.entity.LogContext;
import com.inboundlogger.domain.context.model.valobj.ContextCallback;
import com.inboundlogger.domain.context.model.valobj.ControllerLoggingPolicy;
import com.inboundlogger.types.exception.ConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.apache.commons.lang3.StringUtils;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiConsumer;

/**
 * 控制器日志策略注册表。
 * <p>
 * 回调查找规则：自身声明的回调优先，否则沿显式声明的父控制器链向上查找，找不到则为空。
 * </p>
 */
@Slf4j
@Service
public class ControllerLoggingRegistry {

    private final Map<String, ControllerLoggingPolicy> policies = new ConcurrentHashMap<>();
    private final Map<String, BiConsumer<Object, LogContext>> namedCallbacks = new ConcurrentHashMap<>();

    /**
     * 注册控制器策略。only 与 except 同时声明时抛出 {@link ConfigurationException}。
     */
    public void register(ControllerLoggingPolicy policy) {
        if (policy == null || StringUtils.isBlank(policy.getControllerName())) {
            throw new ConfigurationException("Controller name must not be blank");
        }
        if (!policy.getOnlyActions().isEmpty() && !policy.getExceptActions().isEmpty()) {
            throw new ConfigurationException("Cannot specify both 'only' and 'except' options for controller "
                    + policy.getControllerName());
        }
        policies.merge(policy.getControllerName(), policy, ControllerLoggingRegistry::mergePolicy);
        log.debug("CONTROLLER_LOGGING_REGISTERED controller={}, parent={}, only={}, except={}",
                policy.getControllerName(), policy.getParentName(), policy.getOnlyActions(), policy.getExceptActions());
    }

    /**
     * 跳过指定动作的元数据采集。
     */
    public void skipLogging(String controllerName, String... actions) {
        ControllerLoggingPolicy skip = ControllerLoggingPolicy.builder()
                .controllerName(requireName(controllerName))
                .skippedActions(Arrays.asList(actions))
                .build();
        policies.merge(controllerName, skip, ControllerLoggingRegistry::mergePolicy);
    }

    /**
     * 为控制器的全部动作设置上下文回调。
     */
    public void loggingContext(String controllerName, ContextCallback callback) {
        ControllerLoggingPolicy withCallback = ControllerLoggingPolicy.builder()
                .controllerName(requireName(controllerName))
                .callback(callback)
                .build();
        policies.merge(controllerName, withCallback, ControllerLoggingRegistry::mergePolicy);
    }

    public void registerNamedCallback(String name, BiConsumer<Object, LogContext> callback) {
        if (StringUtils.isBlank(name) || callback == null) {
            throw new ConfigurationException("Named callback requires a name and a function");
        }
        namedCallbacks.put(name, callback);
    }

    public Optional<ControllerLoggingPolicy> findPolicy(String controllerName) {
        return controllerName == null ? Optional.empty() : Optional.ofNullable(policies.get(controllerName));
    }

    /**
     * 全局开关、全局控制器/动作排除与控制器自身的 only/except/skip 同时放行时返回 true。
     */
    public boolean shouldLog(LoggerConfiguration configuration, String controllerName, String actionName) {
        if (!configuration.isEnabled() || !configuration.enabledForController(controllerName, actionName)) {
            return false;
        }
        return actionAllowed(controllerName, actionName);
    }

    public Optional<ContextCallback> resolveCallback(String controllerName) {
        Set<String> visited = new HashSet<>();
        String current = controllerName;
        while (current != null && visited.add(current)) {
            ControllerLoggingPolicy policy = policies.get(current);
            if (policy == null) {
                return Optional.empty();
            }
            if (policy.getCallback() != null) {
                return Optional.of(policy.getCallback());
            }
            current = policy.getParentName();
        }
        return Optional.empty();
    }

    /**
     * 执行控制器（或继承得到）的上下文回调。没有回调时返回 false。
     */
    public boolean runCallback(String controllerName, Object handler, LogContext context) {
        Optional<ContextCallback> resolved = resolveCallback(controllerName);
        if (resolved.isEmpty()) {
            return false;
        }
        ContextCallback callback = resolved.get();
        if (callback instanceof ContextCallback.Function function) {
            function.getFunction().accept(handler, context);
            return true;
        }
        if (callback instanceof ContextCallback.Named named) {
            BiConsumer<Object, LogContext> target = namedCallbacks.get(named.getName());
            if (target == null) {
                log.debug("CONTROLLER_CALLBACK_MISSING controller={}, callback={}", controllerName, named.getName());
                return false;
            }
            target.accept(handler, context);
            return true;
        }
        return false;
    }

    public void clear() {
        policies.clear();
        namedCallbacks.clear();
    }

    private boolean actionAllowed(String controllerName, String actionName) {
        Set<String> visited = new HashSet<>();
        String current = controllerName;
        boolean filterResolved = false;
        while (current != null && visited.add(current)) {
            ControllerLoggingPolicy policy = policies.get(current);
            if (policy == null) {
                break;
            }
            if (actionName != null && policy.getSkippedActions().contains(actionName)) {
                return false;
            }
            if (!filterResolved && policy.declaresActionFilter()) {
                filterResolved = true;
                if (!policy.getOnlyActions().isEmpty() && (actionName == null || !policy.getOnlyActions().contains(actionName))) {
                    return false;
                }
                if (actionName != null && policy.getExceptActions().contains(actionName)) {
                    return false;
                }
            }
            current = policy.getParentName();
        }
        return true;
    }

    private static ControllerLoggingPolicy mergePolicy(ControllerLoggingPolicy existing, ControllerLoggingPolicy update) {
        ControllerLoggingPolicy.ControllerLoggingPolicyBuilder builder = existing.toBuilder();
        if (update.getParentName() != null) {
            builder.parentName(update.getParentName());
        }
        if (update.declaresActionFilter()) {
            builder.clearOnlyActions().clearExceptActions();
            builder.onlyActions(update.getOnlyActions()).exceptActions(update.getExceptActions());
        }
        builder.skippedActions(update.getSkippedActions());
        if (update.getCallback() != null) {
            builder.callback(update.getCallback());
        }
        return builder.build();
    }

    private static String requireName(String controllerName) {
        if (StringUtils.isBlank(controllerName)) {
            throw new ConfigurationException("Controller name must not be blank");
        }
        return controllerName;
    }
}
