package com.zcunsoft.clklog.behavior.utils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.zcunsoft.clklog.behavior.bean.BehaviorEvent;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 埋点数据提取工具类
 * 从 JSON 行解析并生成 BehaviorEvent
 */
public class BehaviorExtractUtil {

    private static final Logger logger = LoggerFactory.getLogger(BehaviorExtractUtil.class);

    private static final EventJsonMapper objectMapper = new EventJsonMapper();

    /**
     * 从一行 JSON 提取事件列表
     * 每行为单个事件对象或事件数组
     *
     * @param line JSON 行
     * @return 有效事件列表，解析失败返回空列表
     */
    public static List<BehaviorEvent> extractToEventList(String line) {
        List<BehaviorEvent> eventList = new ArrayList<>();
        if (StringUtils.isBlank(line)) {
            return eventList;
        }
        try {
            JsonNode json = objectMapper.readTree(line);

            // 处理数组或单个对象
            if (json instanceof ArrayNode) {
                for (JsonNode item : json) {
                    addIfValid(eventList, BehaviorEventMapper.mapToBehaviorEvent(item));
                }
            } else {
                addIfValid(eventList, BehaviorEventMapper.mapToBehaviorEvent(json));
            }
        } catch (Exception e) {
            logger.error("Error parsing event line: {}", line, e);
        }

        return eventList;
    }

    private static void addIfValid(List<BehaviorEvent> eventList, BehaviorEvent event) {
        if (BehaviorEventMapper.isValid(event)) {
            eventList.add(event);
        }
    }
}
