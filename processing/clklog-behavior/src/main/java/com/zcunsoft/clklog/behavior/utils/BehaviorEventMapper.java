package com.zcunsoft.clklog.behavior.utils;

import com.fasterxml.jackson.databind.JsonNode;
import com.zcunsoft.clklog.behavior.bean.BehaviorEvent;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 埋点数据映射工具类
 * 将埋点 JSON 映射到 BehaviorEvent
 */
public class BehaviorEventMapper {

    private static final Logger logger = LoggerFactory.getLogger(BehaviorEventMapper.class);

    /**
     * 将埋点 JSON 映射到 BehaviorEvent
     * <p>
     * ts 无法解析时时间戳置空，由会话流构建时剔除。
     *
     * @param jsonNode 埋点 JSON
     * @return BehaviorEvent，jsonNode 不是对象时返回 null
     */
    public static BehaviorEvent mapToBehaviorEvent(JsonNode jsonNode) {
        if (jsonNode == null || !jsonNode.isObject()) {
            return null;
        }

        BehaviorEvent.BehaviorEventBuilder builder = BehaviorEvent.builder();

        // ========== 基本事件信息 ==========
        builder.eventId(text(jsonNode, "event_id"));
        builder.eventName(text(jsonNode, "event"));
        builder.timestamp(parseTimestamp(jsonNode.get("ts")));
        builder.sessionId(text(jsonNode, "session_id"));

        // ========== 用户身份信息 ==========
        builder.actorId(text(jsonNode, "user_id"));
        builder.anonymousId(text(jsonNode, "anonymous_id"));

        // ========== 环境信息 ==========
        builder.platform(text(jsonNode, "platform"));
        builder.environment(text(jsonNode, "env"));
        builder.userAgentSummary(text(jsonNode, "user_agent_summary"));

        // ========== 上下文与属性 ==========
        builder.context(toStringMap(jsonNode.get("context")));
        builder.properties(toStringMap(jsonNode.get("properties")));

        return builder.build();
    }

    /**
     * 验证事件是否有效
     *
     * @param event 待验证的事件
     * @return true=有效, false=无效
     */
    public static boolean isValid(BehaviorEvent event) {
        if (event == null) {
            return false;
        }

        if (StringUtils.isBlank(event.getEventName())) {
            logger.debug("Missing event name, event_id={}", event.getEventId());
            return false;
        }

        if (event.getTimestamp() == null) {
            logger.debug("Invalid ts, event_id={}", event.getEventId());
            return false;
        }

        return true;
    }

    /**
     * 解析时间戳，支持 ISO-8601 字符串与毫秒数
     */
    static Instant parseTimestamp(JsonNode tsNode) {
        if (tsNode == null || tsNode.isNull()) {
            return null;
        }
        if (tsNode.isNumber()) {
            return Instant.ofEpochMilli(tsNode.asLong());
        }
        String value = tsNode.asText();
        if (StringUtils.isBlank(value)) {
            return null;
        }
        try {
            return Instant.parse(value.trim());
        } catch (DateTimeParseException e) {
            logger.debug("Unparsable ts: {}", value);
            return null;
        }
    }

    private static String text(JsonNode jsonNode, String field) {
        JsonNode value = jsonNode.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.asText();
    }

    /**
     * 对象展开为一层字符串 Map，非文本值保留 JSON 文本
     *
     * @param node JSON 对象
     * @return 只读 Map，node 不是对象时返回空 Map
     */
    public static Map<String, String> toStringMap(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Collections.emptyMap();
        }
        Map<String, String> map = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value == null || value.isNull()) {
                continue;
            }
            map.put(field.getKey(), value.isValueNode() ? value.asText() : value.toString());
        }
        return Collections.unmodifiableMap(map);
    }
}
