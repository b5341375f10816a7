package com.inboundlogger.domain.context.model.valobj;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

/**
 * 单个控制器的日志策略。
 * <p>
 * only 与 except 互斥；parentName 为显式声明的父控制器，用于查找继承的上下文回调与动作过滤。
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class ControllerLoggingPolicy {

    String controllerName;
    String parentName;
    @Singular
    Set<String> onlyActions;
    @Singular
    Set<String> exceptActions;
    @Singular
    Set<String> skippedActions;
    ContextCallback callback;

    public boolean declaresActionFilter() {
        return !onlyActions.isEmpty() || !exceptActions.isEmpty();
    }
}
