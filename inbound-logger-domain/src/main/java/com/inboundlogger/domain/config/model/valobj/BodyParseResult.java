package com.inboundlogger.domain.config.model.valobj;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * body 解析结果。
 * <p>
 * 解析失败不抛异常，而是返回 {@link Status#UNPARSED} 并保留原始文本，回退路径在调用方显式分支。
 * </p>
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BodyParseResult {

    public enum Status {
        /** 解析为结构化数据 */
        PARSED,
        /** 无法解析，保留原文 */
        UNPARSED,
        /** 没有 body */
        ABSENT
    }

    Status status;
    Object value;
    String raw;

    public static BodyParseResult parsed(Object value, String raw) {
        return new BodyParseResult(Status.PARSED, value, raw);
    }

    public static BodyParseResult unparsed(String raw) {
        return new BodyParseResult(Status.UNPARSED, null, raw);
    }

    public static BodyParseResult absent() {
        return new BodyParseResult(Status.ABSENT, null, null);
    }

    public boolean isParsed() {
        return status == Status.PARSED;
    }

    public boolean isAbsent() {
        return status == Status.ABSENT;
    }

    /**
     * 解析成功返回结构化值，否则返回原文。
     */
    public Object valueOrRaw() {
        return isParsed() ? value : raw;
    }
}
