package com.zcunsoft.clklog.behavior.bean;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 会话标签流：sessionId -> 按时间排序的标签序列
 * <p>
 * 会话按 sessionId 升序排列，遍历顺序固定。
 */
public final class SessionStreams {

    private static final SessionStreams EMPTY = new SessionStreams(Collections.emptyMap());

    private final Map<String, List<String>> streams;

    public SessionStreams(Map<String, List<String>> streams) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : streams.entrySet()) {
            copy.put(entry.getKey(), List.copyOf(entry.getValue()));
        }
        this.streams = Collections.unmodifiableMap(copy);
    }

    public static SessionStreams empty() {
        return EMPTY;
    }

    public Map<String, List<String>> getStreams() {
        return streams;
    }

    public List<String> stream(String sessionId) {
        return streams.get(sessionId);
    }

    public int sessionCount() {
        return streams.size();
    }

    public boolean isEmpty() {
        return streams.isEmpty();
    }

    /**
     * 标签在所有会话中出现的次数，每次出现对应一条原始事件
     */
    public long labelOccurrences(String label) {
        long count = 0;
        for (List<String> stream : streams.values()) {
            for (String item : stream) {
                if (item.equals(label)) {
                    count++;
                }
            }
        }
        return count;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SessionStreams)) {
            return false;
        }
        // 会话顺序也参与比较
        return new ArrayList<>(streams.entrySet()).equals(new ArrayList<>(((SessionStreams) o).streams.entrySet()));
    }

    @Override
    public int hashCode() {
        return streams.hashCode();
    }

    @Override
    public String toString() {
        return "SessionStreams" + streams;
    }
}
