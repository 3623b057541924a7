package com.zcunsoft.clklog.behavior.funnel;

import com.zcunsoft.clklog.behavior.bean.FunnelDefinition;
import com.zcunsoft.clklog.behavior.bean.FunnelReport;
import com.zcunsoft.clklog.behavior.bean.FunnelStep;
import com.zcunsoft.clklog.behavior.bean.SessionStreams;
import com.zcunsoft.clklog.behavior.utils.RateUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Stream;

/**
 * 封闭漏斗分析
 * <p>
 * 每个会话单向扫描一次，游标 expected 指向下一个待匹配的步骤，
 * 标签等于 steps[expected] 时该步完成并前进，不回溯。
 * 所有步骤完成后停止扫描该会话。
 */
public class FunnelAnalyzer {

    private final Logger logger = LoggerFactory.getLogger(this.getClass());

    private final int parallelThreshold;

    public FunnelAnalyzer() {
        this(0);
    }

    /**
     * @param parallelThreshold 会话数达到该值时并行匹配，<= 0 表示不并行
     */
    public FunnelAnalyzer(int parallelThreshold) {
        this.parallelThreshold = parallelThreshold;
    }

    public FunnelReport analyze(SessionStreams sessionStreams, FunnelDefinition definition) {
        List<String> steps = definition.getSteps();
        if (steps.isEmpty()) {
            return FunnelReport.empty();
        }

        // 每个会话完成的步骤数
        int[] depths = sessions(sessionStreams.getStreams().values())
                .mapToInt(stream -> matchDepth(stream, steps))
                .toArray();

        long[] completed = new long[steps.size()];
        for (int depth : depths) {
            for (int i = 0; i < depth; i++) {
                completed[i]++;
            }
        }

        List<FunnelStep> funnelSteps = new ArrayList<>(steps.size());
        for (int i = 0; i < steps.size(); i++) {
            double conversionRate = i == 0 ? 100D : RateUtil.percent(completed[i], completed[0]);
            long dropOff = i == 0 ? 0 : completed[i - 1] - completed[i];
            funnelSteps.add(new FunnelStep(i + 1, steps.get(i), completed[i], conversionRate, dropOff));
        }

        long totalEntered = completed[0];
        long totalConverted = completed[steps.size() - 1];
        logger.debug("Funnel {} over {} sessions: entered {}, converted {}",
                steps, sessionStreams.sessionCount(), totalEntered, totalConverted);
        return new FunnelReport(funnelSteps, totalEntered, totalConverted, RateUtil.percent(totalConverted, totalEntered));
    }

    /**
     * 单个会话按顺序匹配的步骤数
     *
     * @param stream 会话标签流
     * @param steps  漏斗步骤
     * @return 0..steps.size()
     */
    static int matchDepth(List<String> stream, List<String> steps) {
        int expected = 0;
        for (String label : stream) {
            if (label.equals(steps.get(expected))) {
                expected++;
                if (expected == steps.size()) {
                    break;
                }
            }
        }
        return expected;
    }

    private Stream<List<String>> sessions(Collection<List<String>> streams) {
        if (parallelThreshold > 0 && streams.size() >= parallelThreshold) {
            return streams.parallelStream();
        }
        return streams.stream();
    }
}
