package com.inboundlogger.trigger.capture;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 跳过指定动作的日志元数据采集。标注在方法上时跳过该方法。
 */
@Documented
@Target({ElementType.TYPE, ElementType.METHOD})
@Retention(RetentionPolicy.RUNTIME)
public @interface SkipInboundLogging {

    /** 动作名，类级别使用 */
    String[] value() default {};
}
