package com.zcunsoft.clklog.report.dao;

import com.zcunsoft.clklog.behavior.bean.BehaviorConsts;
import com.zcunsoft.clklog.behavior.bean.BehaviorEvent;
import com.zcunsoft.clklog.behavior.bean.EventQuery;
import com.zcunsoft.clklog.behavior.bean.PlatformFilter;
import com.zcunsoft.clklog.behavior.eventlog.EventLog;
import com.zcunsoft.clklog.behavior.exception.EventLogException;
import com.zcunsoft.clklog.behavior.utils.BehaviorEventMapper;
import com.zcunsoft.clklog.behavior.utils.EventJsonMapper;
import com.zcunsoft.clklog.report.cfg.ReportSetting;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * ClickHouse 事件日志，读取 behavior_events 表
 */
@Repository
@ConditionalOnProperty(prefix = "report", name = "event-source", havingValue = ReportSetting.SOURCE_CLICKHOUSE, matchIfMissing = true)
public class ClickHouseEventLog implements EventLog {

    private static final String SELECT_SQL = "select event_id,event,ts,session_id,user_id,anonymous_id,platform,env,"
            + "context,properties,user_agent_summary from behavior_events where ts>=? and ts<=? and env=?";

    private final Logger logger = LogManager.getLogger(this.getClass());

    private final EventJsonMapper objectMapper = new EventJsonMapper();

    private final JdbcTemplate clickHouseJdbcTemplate;

    public ClickHouseEventLog(JdbcTemplate clickHouseJdbcTemplate) {
        this.clickHouseJdbcTemplate = clickHouseJdbcTemplate;
    }

    @Override
    public List<BehaviorEvent> fetch(EventQuery query) {
        String sql = buildSql(query.getPlatformFilter());
        List<Object> params = new ArrayList<>();
        params.add(Timestamp.from(query.getTimeRange().getStart()));
        params.add(Timestamp.from(query.getTimeRange().getEnd()));
        params.add(query.getEnvironment());

        long start = System.currentTimeMillis();
        try {
            List<BehaviorEvent> events = clickHouseJdbcTemplate.query(sql, (rs, rowNum) -> mapRow(rs), params.toArray());
            logger.debug("Loaded {} events in {}ms, platform filter {}", events.size(), System.currentTimeMillis() - start, query.getPlatformFilter());
            return events;
        } catch (DataAccessException ex) {
            logger.error("Failed to query behavior_events", ex);
            throw new EventLogException("Failed to query behavior_events: " + ex.getMostSpecificCause().getMessage(), ex);
        }
    }

    static String buildSql(PlatformFilter platformFilter) {
        switch (platformFilter) {
            case WEB:
                return SELECT_SQL + " and platform='" + BehaviorConsts.PLATFORM_WEB + "'";
            case MOBILE:
                return SELECT_SQL + " and platform in ('" + BehaviorConsts.PLATFORM_IOS + "','" + BehaviorConsts.PLATFORM_ANDROID + "')";
            default:
                return SELECT_SQL;
        }
    }

    private BehaviorEvent mapRow(ResultSet rs) throws SQLException {
        Timestamp ts = rs.getTimestamp("ts");
        return BehaviorEvent.builder()
                .eventId(rs.getString("event_id"))
                .eventName(rs.getString("event"))
                .timestamp(ts == null ? null : ts.toInstant())
                .sessionId(rs.getString("session_id"))
                .actorId(StringUtils.defaultIfEmpty(rs.getString("user_id"), null))
                .anonymousId(rs.getString("anonymous_id"))
                .platform(rs.getString("platform"))
                .environment(rs.getString("env"))
                .context(parseJson(rs.getString("context")))
                .properties(parseJson(rs.getString("properties")))
                .userAgentSummary(rs.getString("user_agent_summary"))
                .build();
    }

    /**
     * context/properties 列为 JSON 字符串，无法解析时按空处理
     */
    private Map<String, String> parseJson(String json) {
        try {
            return BehaviorEventMapper.toStringMap(objectMapper.readObject(json));
        } catch (Exception ex) {
            logger.warn("Failed to parse JSON column: {}", json, ex);
            return Collections.emptyMap();
        }
    }
}
