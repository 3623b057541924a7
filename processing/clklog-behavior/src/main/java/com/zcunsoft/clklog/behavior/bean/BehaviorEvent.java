package com.zcunsoft.clklog.behavior.bean;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;

/**
 * 埋点事件模型，对应 behavior_events 表
 * <p>
 * 事件只读，由事件日志提供，引擎不做任何修改。
 */
@Value
@Builder(toBuilder = true)
public class BehaviorEvent {

    // ========== 基本事件信息 ==========
    String eventId;
    Instant timestamp;
    String eventName;
    String sessionId;

    // ========== 用户身份信息 ==========
    /**
     * 登录用户 ID，未登录为 null
     */
    String actorId;
    /**
     * 匿名 ID
     */
    String anonymousId;

    // ========== 环境信息 ==========
    String platform;
    String environment;
    String userAgentSummary;

    // ========== 上下文与属性 ==========
    @Builder.Default
    Map<String, String> context = Collections.emptyMap();

    @Builder.Default
    Map<String, String> properties = Collections.emptyMap();

    public boolean isScreenView() {
        return BehaviorConsts.SCREEN_VIEW.equals(eventName);
    }

    public String contextValue(String key) {
        return context == null ? null : context.get(key);
    }

    public String propertyValue(String key) {
        return properties == null ? null : properties.get(key);
    }

    /**
     * 用户标识：优先登录 ID，否则匿名 ID
     */
    public String actorKey() {
        return actorId != null ? actorId : anonymousId;
    }
}
