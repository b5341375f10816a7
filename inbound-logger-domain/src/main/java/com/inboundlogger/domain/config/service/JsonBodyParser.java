package com.inboundlogger.domain.config.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.inboundlogger.domain.config.model.valobj.BodyParseResult;

/**
 * 请求/响应 body 的 JSON 解析与序列化。
 */
public final class JsonBodyParser {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final TypeReference<Object> ANY_REF = new TypeReference<Object>() {};

    private JsonBodyParser() {
    }

    public static BodyParseResult parse(String body) {
        if (body == null || body.isEmpty()) {
            return BodyParseResult.absent();
        }
        try {
            return BodyParseResult.parsed(OBJECT_MAPPER.readValue(body, ANY_REF), body);
        } catch (JsonProcessingException ex) {
            return BodyParseResult.unparsed(body);
        }
    }

    /**
     * 序列化为 JSON 文本；无法序列化时返回 null。
     */
    public static String write(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return OBJECT_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            return null;
        }
    }
}
