package com.inboundlogger.config;

import com.google.common.cache.Cache;
import com.inboundlogger.domain.config.service.ConfigurationScope;
import com.inboundlogger.domain.context.service.ControllerLoggingRegistry;
import com.inboundlogger.domain.log.service.RequestLogAssembler;
import com.inboundlogger.domain.log.service.RequestLogSinkDispatcher;
import com.inboundlogger.trigger.capture.ControllerLoggingRegistrar;
import com.inboundlogger.trigger.capture.InboundRequestLoggingFilter;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

/**
 * 请求日志组件装配。
 */
@Configuration
public class InboundLoggerConfig {

    /**
     * 进程级配置，启动时应用一次属性。
     */
    @Bean
    public ConfigurationScope configurationScope(InboundLoggerProperties properties,
                                                 @Qualifier("cache") Cache<String, Object> cache) {
        ConfigurationScope scope = new ConfigurationScope();
        scope.configure(configuration -> {
            properties.applyTo(configuration);
            configuration.setCacheAdapter(cache);
        });
        return scope;
    }

    @Bean
    public RequestLogAssembler requestLogAssembler(ConfigurationScope configurationScope) {
        return new RequestLogAssembler(configurationScope);
    }

    @Bean
    public FilterRegistrationBean<InboundRequestLoggingFilter> inboundRequestLoggingFilter(
            ConfigurationScope configurationScope,
            RequestLogSinkDispatcher requestLogSinkDispatcher) {
        FilterRegistrationBean<InboundRequestLoggingFilter> registration = new FilterRegistrationBean<>(
                new InboundRequestLoggingFilter(configurationScope, requestLogSinkDispatcher));
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 10);
        registration.addUrlPatterns("/*");
        return registration;
    }

    /**
     * 后置处理器需要静态声明，注册表延迟获取。
     */
    @Bean
    public static ControllerLoggingRegistrar controllerLoggingRegistrar(ObjectProvider<ControllerLoggingRegistry> registry) {
        return new ControllerLoggingRegistrar(registry.getObject());
    }
}
