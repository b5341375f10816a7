package com.inboundlogger.trigger.capture;

import com.inboundlogger.domain.context.model.entity.LogContext;
import com.inboundlogger.domain.context.model.valobj.ContextCallback;
import com.inboundlogger.domain.context.model.valobj.ControllerLoggingPolicy;
import com.inboundlogger.domain.context.service.ControllerLoggingRegistry;
import com.inboundlogger.types.exception.ConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.support.AopUtils;
import org.springframework.beans.factory.config.BeanPostProcessor;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.util.ReflectionUtils;

import java.lang.reflect.Method;
import java.util.Arrays;

/**
 * 启动时读取控制器上的 {@link LogRequests} 与 {@link SkipInboundLogging}，注册到 {@link ControllerLoggingRegistry}。
 * only 与 except 同时声明时启动失败。
 */
@Slf4j
public class ControllerLoggingRegistrar implements BeanPostProcessor {

    private final ControllerLoggingRegistry controllerLoggingRegistry;

    public ControllerLoggingRegistrar(ControllerLoggingRegistry controllerLoggingRegistry) {
        this.controllerLoggingRegistry = controllerLoggingRegistry;
    }

    @Override
    public Object postProcessAfterInitialization(Object bean, String beanName) {
        register(AopUtils.getTargetClass(bean));
        return bean;
    }

    /**
     * 注册单个控制器类型，无相关注解时为空操作。
     */
    public void register(Class<?> controllerType) {
        String controllerName = HandlerNames.controllerName(controllerType);
        LogRequests logRequests = AnnotatedElementUtils.findMergedAnnotation(controllerType, LogRequests.class);
        if (logRequests != null) {
            registerPolicy(controllerType, controllerName, logRequests);
        }
        SkipInboundLogging typeSkip = AnnotatedElementUtils.findMergedAnnotation(controllerType, SkipInboundLogging.class);
        if (typeSkip != null && typeSkip.value().length > 0) {
            controllerLoggingRegistry.skipLogging(controllerName, typeSkip.value());
        }
        ReflectionUtils.doWithMethods(controllerType,
                method -> controllerLoggingRegistry.skipLogging(controllerName, method.getName()),
                method -> AnnotatedElementUtils.hasAnnotation(method, SkipInboundLogging.class));
    }

    private void registerPolicy(Class<?> controllerType, String controllerName, LogRequests logRequests) {
        ControllerLoggingPolicy.ControllerLoggingPolicyBuilder builder = ControllerLoggingPolicy.builder()
                .controllerName(controllerName)
                .onlyActions(Arrays.asList(logRequests.only()))
                .exceptActions(Arrays.asList(logRequests.except()));
        if (logRequests.parent() != Void.class) {
            builder.parentName(HandlerNames.controllerName(logRequests.parent()));
        }
        if (!logRequests.context().isBlank()) {
            builder.callback(namedCallback(controllerType, controllerName, logRequests.context()));
        }
        controllerLoggingRegistry.register(builder.build());
        log.info("CONTROLLER_LOGGING_DECLARED controller={}, type={}", controllerName, controllerType.getName());
    }

    private ContextCallback namedCallback(Class<?> controllerType, String controllerName, String methodName) {
        Method method = ReflectionUtils.findMethod(controllerType, methodName, LogContext.class);
        if (method == null) {
            throw new ConfigurationException("Context callback method " + methodName + "(LogContext) not found on "
                    + controllerType.getName());
        }
        ReflectionUtils.makeAccessible(method);
        String callbackName = controllerName + "#" + methodName;
        controllerLoggingRegistry.registerNamedCallback(callbackName,
                (handler, context) -> ReflectionUtils.invokeMethod(method, handler, context));
        return ContextCallback.named(callbackName);
    }
}
