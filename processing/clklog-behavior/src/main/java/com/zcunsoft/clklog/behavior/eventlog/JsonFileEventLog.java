package com.zcunsoft.clklog.behavior.eventlog;

import com.zcunsoft.clklog.behavior.bean.BehaviorEvent;
import com.zcunsoft.clklog.behavior.bean.EventQuery;
import com.zcunsoft.clklog.behavior.exception.EventLogException;
import com.zcunsoft.clklog.behavior.utils.BehaviorExtractUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * JSON 行文件事件日志
 * <p>
 * 构造时一次性加载文件，每行一个事件对象或事件数组，查询时在内存中过滤。
 */
public class JsonFileEventLog implements EventLog {

    private final Logger logger = LoggerFactory.getLogger(this.getClass());

    private final List<BehaviorEvent> events;

    public JsonFileEventLog(Path file) {
        this.events = Collections.unmodifiableList(load(file));
        logger.info("Loaded {} events from {}", events.size(), file);
    }

    public JsonFileEventLog(List<BehaviorEvent> events) {
        this.events = List.copyOf(events);
    }

    @Override
    public List<BehaviorEvent> fetch(EventQuery query) {
        return events.stream().filter(query::matches).collect(Collectors.toList());
    }

    public int size() {
        return events.size();
    }

    private List<BehaviorEvent> load(Path file) {
        List<BehaviorEvent> loaded = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                loaded.addAll(BehaviorExtractUtil.extractToEventList(line));
            }
        } catch (IOException e) {
            logger.error("Failed to read event file: {}", file, e);
            throw new EventLogException("Failed to read event file: " + file, e);
        }
        return loaded;
    }
}
