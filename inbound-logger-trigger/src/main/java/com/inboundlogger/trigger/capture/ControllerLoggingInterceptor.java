package com.inboundlogger.trigger.capture;

import com.inboundlogger.domain.config.model.entity.LoggerConfiguration;
import com.inboundlogger.domain.config.service.ConfigurationScope;
import com.inboundlogger.domain.context.model.entity.LogContext;
import com.inboundlogger.domain.context.model.valobj.HandlerDescriptor;
import com.inboundlogger.domain.context.service.ControllerLoggingRegistry;
import com.inboundlogger.domain.context.service.RequestLogContextHolder;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.servlet.http.HttpSession;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.springframework.http.MediaType;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.ModelAndView;

import java.security.Principal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Spring MVC 控制器集成。
 * <p>
 * preHandle 记录命中的控制器与动作，供采集过滤器判断控制器级排除；
 * postHandle 在动作执行后写入基础元数据（控制器、动作、格式、会话、用户），再执行控制器的上下文回调。
 * </p>
 */
public class ControllerLoggingInterceptor implements HandlerInterceptor {

    private final ConfigurationScope configurationScope;
    private final ControllerLoggingRegistry controllerLoggingRegistry;

    public ControllerLoggingInterceptor(ConfigurationScope configurationScope,
                                        ControllerLoggingRegistry controllerLoggingRegistry) {
        this.configurationScope = configurationScope;
        this.controllerLoggingRegistry = controllerLoggingRegistry;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (handler instanceof HandlerMethod handlerMethod) {
            request.setAttribute(HandlerDescriptor.REQUEST_ATTRIBUTE, new HandlerDescriptor(
                    HandlerNames.controllerName(handlerMethod.getBeanType()),
                    handlerMethod.getMethod().getName(),
                    resolveFormat(request)));
        }
        return true;
    }

    @Override
    public void postHandle(HttpServletRequest request, HttpServletResponse response, Object handler,
                           ModelAndView modelAndView) {
        if (!(handler instanceof HandlerMethod handlerMethod)) {
            return;
        }
        Object attribute = request.getAttribute(HandlerDescriptor.REQUEST_ATTRIBUTE);
        if (!(attribute instanceof HandlerDescriptor descriptor)) {
            return;
        }
        LoggerConfiguration configuration = configurationScope.current();
        try {
            if (!controllerLoggingRegistry.shouldLog(configuration, descriptor.getControllerName(), descriptor.getActionName())) {
                return;
            }
            RequestLogContextHolder.addMetadata(basicMetadata(request, descriptor));

            LogContext context = new LogContext();
            if (controllerLoggingRegistry.runCallback(descriptor.getControllerName(), handlerMethod.getBean(), context)) {
                if (context.getLoggable() != null) {
                    RequestLogContextHolder.setLoggable(context.getLoggable());
                }
                if (!context.getMetadata().isEmpty()) {
                    RequestLogContextHolder.addMetadata(context.getMetadata());
                }
            }
        } catch (RuntimeException ex) {
            Logger logger = configuration.logger();
            if (configuration.isDebugLogging()) {
                logger.error("HTTP_CONTEXT_ERROR controller={}, action={}, errorType={}, errorMessage={}",
                        descriptor.getControllerName(), descriptor.getActionName(),
                        ex.getClass().getSimpleName(), ex.getMessage(), ex);
            } else {
                logger.error("HTTP_CONTEXT_ERROR controller={}, action={}, errorType={}, errorMessage={}",
                        descriptor.getControllerName(), descriptor.getActionName(),
                        ex.getClass().getSimpleName(), ex.getMessage());
            }
        }
    }

    private Map<String, Object> basicMetadata(HttpServletRequest request, HandlerDescriptor descriptor) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("controller", descriptor.getControllerName());
        metadata.put("action", descriptor.getActionName());
        metadata.put("format", descriptor.getFormat());
        Principal principal = request.getUserPrincipal();
        if (principal != null) {
            metadata.put("user_id", principal.getName());
            metadata.put("user_type", principal.getClass().getSimpleName());
        }
        HttpSession session = request.getSession(false);
        if (session != null) {
            metadata.put("session_id", session.getId());
        }
        Object requestId = request.getAttribute(InboundRequestLoggingFilter.REQUEST_ID_ATTRIBUTE);
        if (requestId != null) {
            metadata.put("request_id", requestId);
        }
        return metadata;
    }

    private String resolveFormat(HttpServletRequest request) {
        String accept = request.getHeader("Accept");
        if (StringUtils.isBlank(accept) || accept.contains("*/*")) {
            return MediaType.APPLICATION_JSON_VALUE;
        }
        return accept.split(",")[0].split(";")[0].trim();
    }
}
