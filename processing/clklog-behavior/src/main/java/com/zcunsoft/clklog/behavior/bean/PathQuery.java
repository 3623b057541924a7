package com.zcunsoft.clklog.behavior.bean;

import com.zcunsoft.clklog.behavior.exception.BehaviorQueryException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;

/**
 * 路径探索查询参数
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PathQuery {

    public static final int DEFAULT_MAX_STEPS = 3;

    public static final int DEFAULT_NODES_PER_STEP = 5;

    /**
     * 起始标签，null 表示取会话入口最多的标签
     */
    String startingLabel;
    int maxSteps;
    int nodesPerStep;

    /**
     * 校验并创建查询参数
     *
     * @param startingLabel 起始标签，可为空
     * @param maxSteps      最大步数，>= 1
     * @param nodesPerStep  每步节点数，>= 1
     * @return 查询参数
     * @throws BehaviorQueryException 参数非法
     */
    public static PathQuery of(String startingLabel, int maxSteps, int nodesPerStep) {
        if (maxSteps < 1) {
            throw new BehaviorQueryException("maxSteps must be >= 1, got " + maxSteps);
        }
        if (nodesPerStep < 1) {
            throw new BehaviorQueryException("nodesPerStep must be >= 1, got " + nodesPerStep);
        }
        String label = StringUtils.isBlank(startingLabel) ? null : startingLabel.trim();
        return new PathQuery(label, maxSteps, nodesPerStep);
    }

    public static PathQuery defaults() {
        return of(null, DEFAULT_MAX_STEPS, DEFAULT_NODES_PER_STEP);
    }
}
