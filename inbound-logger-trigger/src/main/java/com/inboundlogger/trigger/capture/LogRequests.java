package com.inboundlogger.trigger.capture;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 控制器级请求日志声明。
 * <p>
 * only 与 except 互斥；context 为控制器上接收 {@code LogContext} 的方法名；
 * parent 显式声明父控制器，未声明 context 时沿用父控制器的回调。
 * </p>
 */
@Documented
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface LogRequests {

    String[] only() default {};

    String[] except() default {};

    String context() default "";

    Class<?> parent() default Void.class;
}
