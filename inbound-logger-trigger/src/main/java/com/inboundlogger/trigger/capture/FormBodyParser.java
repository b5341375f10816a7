package com.inboundlogger.trigger.capture;

import com.inboundlogger.domain.config.model.valobj.BodyParseResult;
import org.apache.commons.lang3.StringUtils;

import java.net.URLDecoder;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * application/x-www-form-urlencoded 解析。
 */
public final class FormBodyParser {

    private FormBodyParser() {
    }

    /**
     * 解析为日志用的键值对：单值为字符串，重复键为列表。非法编码返回 UNPARSED。
     */
    public static BodyParseResult parse(String body, Charset charset) {
        if (StringUtils.isEmpty(body)) {
            return BodyParseResult.absent();
        }
        try {
            Map<String, List<String>> values = parseMultiValue(body, charset);
            Map<String, Object> result = new LinkedHashMap<>();
            values.forEach((key, list) -> result.put(key, list.size() == 1 ? list.get(0) : list));
            return BodyParseResult.parsed(result, body);
        } catch (IllegalArgumentException ex) {
            return BodyParseResult.unparsed(body);
        }
    }

    /**
     * 按出现顺序解析全部键值。
     *
     * @throws IllegalArgumentException 百分号编码非法
     */
    public static Map<String, List<String>> parseMultiValue(String text, Charset charset) {
        Map<String, List<String>> values = new LinkedHashMap<>();
        if (StringUtils.isEmpty(text)) {
            return values;
        }
        for (String pair : text.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String key = URLDecoder.decode(eq < 0 ? pair : pair.substring(0, eq), charset);
            String value = eq < 0 ? "" : URLDecoder.decode(pair.substring(eq + 1), charset);
            values.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
        }
        return values;
    }
}
