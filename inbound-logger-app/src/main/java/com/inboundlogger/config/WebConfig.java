package com.inboundlogger.config;

import com.inboundlogger.domain.config.service.ConfigurationScope;
import com.inboundlogger.domain.context.service.ControllerLoggingRegistry;
import com.inboundlogger.trigger.capture.ControllerLoggingInterceptor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * MVC 拦截器注册。
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final ConfigurationScope configurationScope;
    private final ControllerLoggingRegistry controllerLoggingRegistry;

    public WebConfig(ConfigurationScope configurationScope, ControllerLoggingRegistry controllerLoggingRegistry) {
        this.configurationScope = configurationScope;
        this.controllerLoggingRegistry = controllerLoggingRegistry;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new ControllerLoggingInterceptor(configurationScope, controllerLoggingRegistry));
    }
}
