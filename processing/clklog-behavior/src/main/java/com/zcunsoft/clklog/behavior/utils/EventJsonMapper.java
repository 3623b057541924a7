package com.zcunsoft.clklog.behavior.utils;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;

/**
 * 埋点 JSON 解析用 ObjectMapper
 * 容忍未加引号的字段名、单引号与未知字段，JSON 行文件与 ClickHouse 的 JSON 列共用
 */
public class EventJsonMapper extends ObjectMapper {
    private static final long serialVersionUID = 1L;

    public EventJsonMapper() {
        super();
        configure(JsonParser.Feature.ALLOW_UNQUOTED_FIELD_NAMES, true);
        configure(JsonParser.Feature.ALLOW_SINGLE_QUOTES, true);
        configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * 解析 JSON 对象
     *
     * @param json JSON 文本
     * @return 对象节点，空串或不是对象时返回 null
     * @throws JsonProcessingException JSON 格式错误
     */
    public JsonNode readObject(String json) throws JsonProcessingException {
        if (StringUtils.isBlank(json)) {
            return null;
        }
        JsonNode node = readTree(json);
        return node != null && node.isObject() ? node : null;
    }
}
