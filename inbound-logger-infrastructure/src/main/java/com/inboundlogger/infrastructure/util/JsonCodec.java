package com.inboundlogger.infrastructure.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.inboundlogger.types.enums.ErrorCode;
import com.inboundlogger.types.exception.InboundLoggerException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON 编解码工具。
 */
@Component
public class JsonCodec {

    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<Map<String, Object>>() {};
    private static final TypeReference<Map<String, String>> STRING_MAP_REF = new TypeReference<Map<String, String>>() {};
    private static final TypeReference<Object> ANY_REF = new TypeReference<Object>() {};

    private final ObjectMapper objectMapper;

    /**
     * 创建 JsonCodec。
     */
    public JsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * 读取 JSON 为 Map。
     */
    public Map<String, Object> readMap(String json) {
        Map<String, Object> value = readValue(json, MAP_REF);
        return value == null ? new LinkedHashMap<>() : value;
    }

    /**
     * 读取 JSON 为 String Map。
     */
    public Map<String, String> readStringMap(String json) {
        Map<String, String> value = readValue(json, STRING_MAP_REF);
        return value == null ? new LinkedHashMap<>() : value;
    }

    /**
     * 读取任意 JSON 值（对象、数组、字符串、数字等）。
     */
    public Object readAny(String json) {
        return readValue(json, ANY_REF);
    }

    /**
     * 读取 JSON 为指定类型。
     */
    public <T> T readValue(String json, TypeReference<T> type) {
        if (StringUtils.isBlank(json)) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (IOException ex) {
            throw new InboundLoggerException(ErrorCode.UN_ERROR.getCode(), "Failed to parse json", ex);
        }
    }

    /**
     * 写出为 JSON 字符串。
     */
    public String writeValue(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new InboundLoggerException(ErrorCode.UN_ERROR.getCode(), "Failed to write json", ex);
        }
    }

    /**
     * 获取 ObjectMapper。
     */
    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
