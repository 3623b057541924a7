package com.zcunsoft.clklog.report.model;

import com.zcunsoft.clklog.behavior.bean.PathStep;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 用户路径接口返回：起始点与各步节点
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UserJourney {

    private String startingPoint;

    private Path path;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Path {
        private List<PathStep> steps;
    }
}
