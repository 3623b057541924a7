package com.zcunsoft.clklog.behavior.path;

import com.zcunsoft.clklog.behavior.bean.BehaviorConsts;
import com.zcunsoft.clklog.behavior.bean.LabelCount;
import com.zcunsoft.clklog.behavior.bean.PathQuery;
import com.zcunsoft.clklog.behavior.bean.PathStep;
import com.zcunsoft.clklog.behavior.bean.PathTree;
import com.zcunsoft.clklog.behavior.bean.SessionStreams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 用户路径探索
 * <p>
 * 从起始标签出发逐步统计"下一步"：
 * 1. 第 0 步为起始标签，计数为该标签的原始事件数
 * 2. 每一步在活跃会话中定位 frontier 最后到达的位置，取其后第一个不在 frontier 中的标签，每个会话只计一次
 * 3. 取计数最多的 nodesPerStep 个标签作为本步节点，并整体替换 frontier
 * 4. 活跃会话收缩为包含新 frontier 任一标签的会话
 * <p>
 * 达到 maxSteps、活跃会话为空或本步没有任何下一步标签时结束。
 */
public class JourneyPathExplorer {

    private final Logger logger = LoggerFactory.getLogger(this.getClass());

    private final int parallelThreshold;

    public JourneyPathExplorer() {
        this(0);
    }

    /**
     * @param parallelThreshold 活跃会话数达到该值时并行扫描，<= 0 表示不并行
     */
    public JourneyPathExplorer(int parallelThreshold) {
        this.parallelThreshold = parallelThreshold;
    }

    public PathTree explore(SessionStreams sessionStreams, PathQuery query) {
        String start = query.getStartingLabel() != null ? query.getStartingLabel() : topEntranceLabel(sessionStreams);

        List<PathStep> steps = new ArrayList<>();
        steps.add(new PathStep(0, Collections.singletonList(new LabelCount(start, sessionStreams.labelOccurrences(start)))));

        Map<String, List<String>> activeSessions = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : sessionStreams.getStreams().entrySet()) {
            if (entry.getValue().contains(start)) {
                activeSessions.put(entry.getKey(), entry.getValue());
            }
        }

        List<String> frontier = Collections.singletonList(start);

        for (int k = 1; k <= query.getMaxSteps() && !activeSessions.isEmpty(); k++) {
            final List<String> currentFrontier = frontier;
            List<String> nextLabels = sessions(activeSessions.values())
                    .map(stream -> nextLabel(stream, currentFrontier))
                    .collect(Collectors.toList());

            LabelTally tally = LabelTally.firstSeenOrder();
            for (String label : nextLabels) {
                if (label != null) {
                    tally.increment(label);
                }
            }
            if (tally.isEmpty()) {
                break;
            }

            List<LabelCount> nodes = tally.top(query.getNodesPerStep());
            steps.add(new PathStep(k, nodes));

            // frontier 整体替换为本步节点
            frontier = nodes.stream().map(LabelCount::getLabel).collect(Collectors.toList());
            activeSessions = retainReaching(activeSessions, frontier);
        }

        logger.debug("Path exploration from '{}' over {} sessions produced {} steps",
                start, sessionStreams.sessionCount(), steps.size());
        return new PathTree(start, steps);
    }

    /**
     * 会话入口标签中出现最多的标签，无会话时返回 "Unknown"
     */
    public static String topEntranceLabel(SessionStreams sessionStreams) {
        LabelTally entrances = LabelTally.firstSeenOrder();
        for (List<String> stream : sessionStreams.getStreams().values()) {
            if (!stream.isEmpty()) {
                entrances.increment(stream.get(0));
            }
        }
        String label = entrances.mostFrequent();
        return label != null ? label : BehaviorConsts.UNKNOWN_LABEL;
    }

    /**
     * 会话在本步的下一个标签
     * <p>
     * 按 frontier 顺序依次查找，每个标签从上一次到达位置之后找第一次出现，
     * 结果与 frontier 的顺序相关。
     *
     * @param stream   会话标签流
     * @param frontier 当前 frontier
     * @return 下一个标签，未到达 frontier 或之后没有新标签时返回 null
     */
    static String nextLabel(List<String> stream, List<String> frontier) {
        int lastReachedIdx = -1;
        for (String label : frontier) {
            int found = indexOf(stream, label, lastReachedIdx + 1);
            if (found > lastReachedIdx) {
                lastReachedIdx = found;
            }
        }
        if (lastReachedIdx < 0) {
            return null;
        }

        Set<String> seen = new HashSet<>(frontier);
        for (int i = lastReachedIdx + 1; i < stream.size(); i++) {
            String label = stream.get(i);
            if (!seen.contains(label)) {
                return label;
            }
        }
        return null;
    }

    private static int indexOf(List<String> stream, String label, int from) {
        for (int i = from; i < stream.size(); i++) {
            if (stream.get(i).equals(label)) {
                return i;
            }
        }
        return -1;
    }

    private static Map<String, List<String>> retainReaching(Map<String, List<String>> activeSessions, List<String> frontier) {
        Map<String, List<String>> retained = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : activeSessions.entrySet()) {
            for (String label : frontier) {
                if (entry.getValue().contains(label)) {
                    retained.put(entry.getKey(), entry.getValue());
                    break;
                }
            }
        }
        return retained;
    }

    private Stream<List<String>> sessions(Collection<List<String>> streams) {
        if (parallelThreshold > 0 && streams.size() >= parallelThreshold) {
            return streams.parallelStream();
        }
        return streams.stream();
    }
}
