package com.zcunsoft.clklog.behavior.stream;

import com.zcunsoft.clklog.behavior.bean.BehaviorEvent;
import com.zcunsoft.clklog.behavior.bean.SessionStreams;
import com.zcunsoft.clklog.behavior.utils.LabelResolver;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 会话标签流构建器
 * <p>
 * 将已过滤的事件按 (sessionId, timestamp) 升序排列，每条事件产出一个标签。
 * 同一时刻的事件依次按 eventId、标签排序，输入顺序不影响结果。
 * 缺少 sessionId 或时间戳的事件直接剔除。
 */
public class SessionStreamBuilder {

    private final Logger logger = LoggerFactory.getLogger(this.getClass());

    private static final Comparator<LabeledEvent> STREAM_ORDER = Comparator
            .comparing((LabeledEvent e) -> e.event.getSessionId())
            .thenComparing(e -> e.event.getTimestamp())
            .thenComparing(e -> e.event.getEventId(), Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(e -> e.label);

    public SessionStreams build(Iterable<BehaviorEvent> events) {
        List<LabeledEvent> qualified = new ArrayList<>();
        int excluded = 0;
        for (BehaviorEvent event : events) {
            if (event == null || StringUtils.isBlank(event.getSessionId()) || event.getTimestamp() == null) {
                excluded++;
                continue;
            }
            qualified.add(new LabeledEvent(event, LabelResolver.label(event)));
        }

        qualified.sort(STREAM_ORDER);

        Map<String, List<String>> streams = new LinkedHashMap<>();
        for (LabeledEvent item : qualified) {
            streams.computeIfAbsent(item.event.getSessionId(), k -> new ArrayList<>()).add(item.label);
        }

        if (excluded > 0) {
            logger.debug("Excluded {} events without session id or timestamp", excluded);
        }
        logger.debug("Built {} session streams from {} events", streams.size(), qualified.size());
        return new SessionStreams(streams);
    }

    private static final class LabeledEvent {
        private final BehaviorEvent event;
        private final String label;

        private LabeledEvent(BehaviorEvent event, String label) {
            this.event = event;
            this.label = label;
        }
    }
}
