package com.zcunsoft.clklog.behavior.path;

import com.zcunsoft.clklog.behavior.bean.LabelCount;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 标签计数器，单次查询内使用
 * <p>
 * top(n) 按计数降序，计数相同时保持首次出现顺序（或标签字典序）。
 */
public class LabelTally {

    private final Map<String, Long> counts;

    private LabelTally(Map<String, Long> counts) {
        this.counts = counts;
    }

    /**
     * 计数相同时按首次出现顺序
     */
    public static LabelTally firstSeenOrder() {
        return new LabelTally(new LinkedHashMap<>());
    }

    /**
     * 计数相同时按标签字典序
     */
    public static LabelTally labelOrder() {
        return new LabelTally(new TreeMap<>());
    }

    public void increment(String label) {
        counts.merge(label, 1L, Long::sum);
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    /**
     * 计数最多的标签，计数相同取排在前面的
     *
     * @return 标签，计数为空时返回 null
     */
    public String mostFrequent() {
        String best = null;
        long bestCount = 0;
        for (Map.Entry<String, Long> entry : counts.entrySet()) {
            if (best == null || entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }

    public List<LabelCount> top(int limit) {
        List<LabelCount> items = new ArrayList<>(counts.size());
        for (Map.Entry<String, Long> entry : counts.entrySet()) {
            items.add(new LabelCount(entry.getKey(), entry.getValue()));
        }
        // List.sort 为稳定排序
        items.sort(Comparator.comparingLong(LabelCount::getCount).reversed());
        return items.size() > limit ? new ArrayList<>(items.subList(0, limit)) : items;
    }
}
