package com.inboundlogger.domain.context.model.valobj;

import lombok.Value;

/**
 * 当前请求命中的控制器与动作。
 */
@Value
public class HandlerDescriptor {

    /** 请求属性名，由 MVC 拦截器写入 */
    public static final String REQUEST_ATTRIBUTE = HandlerDescriptor.class.getName();

    String controllerName;
    String actionName;
    String format;
}
