package com.inboundlogger.trigger.capture;

import org.apache.commons.lang3.StringUtils;

/**
 * 控制器名称约定：类名去掉 Controller 后缀并首字母小写，如 UsersController -> users。
 */
public final class HandlerNames {

    private static final String SUFFIX = "Controller";

    private HandlerNames() {
    }

    public static String controllerName(Class<?> controllerType) {
        String simpleName = controllerType.getSimpleName();
        if (simpleName.endsWith(SUFFIX) && simpleName.length() > SUFFIX.length()) {
            simpleName = simpleName.substring(0, simpleName.length() - SUFFIX.length());
        }
        return StringUtils.uncapitalize(simpleName);
    }
}
