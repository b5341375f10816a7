package com.inboundlogger.domain.context.model.valobj;

import com.inboundlogger.domain.context.model.entity.LogContext;
import lombok.Value;

import java.util.function.BiConsumer;

/**
 * 控制器上下文回调：按名称引用（经注册表解析）或直接持有函数。
 * 两种形式都接收可变的 {@link LogContext}，无返回值。
 */
public interface ContextCallback {

    static ContextCallback named(String name) {
        return new Named(name);
    }

    static ContextCallback of(BiConsumer<Object, LogContext> function) {
        return new Function(function);
    }

    /**
     * 按名称引用的回调。
     */
    @Value
    class Named implements ContextCallback {
        String name;
    }

    /**
     * 函数回调，第一个参数为控制器实例。
     */
    @Value
    class Function implements ContextCallback {
        BiConsumer<Object, LogContext> function;
    }
}
