package com.inboundlogger.domain.config.service;

import com.inboundlogger.domain.config.model.entity.LoggerConfiguration;
import com.inboundlogger.domain.config.model.valobj.ConfigurationOverrides;
import com.inboundlogger.types.exception.ConfigurationException;

import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * 配置作用域。
 * <p>
 * 持有进程级全局配置，并为每个线程维护一个可嵌套的覆盖配置。
 * {@link #withConfiguration} 在当前生效配置的独立副本上应用覆盖项，执行结束后在 finally 中恢复进入前的覆盖（或无覆盖）。
 * 覆盖从不修改共享实例，并发线程之间互不可见。
 * </p>
 */
public class ConfigurationScope {

    private final LoggerConfiguration globalConfiguration;

    private final ThreadLocal<LoggerConfiguration> override = new ThreadLocal<>();

    public ConfigurationScope() {
        this(new LoggerConfiguration());
    }

    public ConfigurationScope(LoggerConfiguration globalConfiguration) {
        if (globalConfiguration == null) {
            throw new ConfigurationException("Global configuration must not be null");
        }
        this.globalConfiguration = globalConfiguration;
    }

    /**
     * 当前线程生效的配置：存在覆盖时返回覆盖，否则返回全局配置。
     */
    public LoggerConfiguration current() {
        LoggerConfiguration scoped = override.get();
        return scoped != null ? scoped : globalConfiguration;
    }

    /**
     * 全局配置，忽略任何覆盖。仅用于自省与测试。
     */
    public LoggerConfiguration global() {
        return globalConfiguration;
    }

    public boolean hasOverride() {
        return override.get() != null;
    }

    /**
     * 管理入口：修改当前生效的配置。
     */
    public void configure(Consumer<LoggerConfiguration> customizer) {
        if (customizer != null) {
            customizer.accept(current());
        }
    }

    public <T> T withConfiguration(ConfigurationOverrides overrides, Supplier<T> block) {
        LoggerConfiguration previous = override.get();
        LoggerConfiguration scoped = current().copy();
        if (overrides != null) {
            overrides.applyTo(scoped);
        }
        override.set(scoped);
        try {
            return block.get();
        } finally {
            if (previous == null) {
                override.remove();
            } else {
                override.set(previous);
            }
        }
    }

    public void runWithConfiguration(ConfigurationOverrides overrides, Runnable block) {
        withConfiguration(overrides, () -> {
            block.run();
            return null;
        });
    }
}
