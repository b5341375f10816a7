package com.inboundlogger.domain.context.model.valobj;

import com.inboundlogger.types.enums.ErrorCode;
import com.inboundlogger.types.exception.InboundLoggerException;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;

/**
 * 多态关联引用：类型标记 + ID。
 */
@Value
public class LoggableReference {

    String type;
    Long id;

    public static LoggableReference of(String type, Long id) {
        if (StringUtils.isBlank(type) || id == null) {
            throw new InboundLoggerException(ErrorCode.ILLEGAL_PARAMETER.getCode(), "Loggable type and id are required");
        }
        return new LoggableReference(type.trim(), id);
    }

    public static LoggableReference from(Loggable loggable) {
        if (loggable == null) {
            return null;
        }
        return of(loggable.getLoggableType(), loggable.getLoggableId());
    }
}
