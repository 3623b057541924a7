package com.zcunsoft.clklog.report.controller;

import com.zcunsoft.clklog.behavior.bean.DashboardSnapshot;
import com.zcunsoft.clklog.behavior.bean.FunnelReport;
import com.zcunsoft.clklog.behavior.bean.RealtimeMetrics;
import com.zcunsoft.clklog.behavior.bean.StartingPoints;
import com.zcunsoft.clklog.report.model.ApiResponse;
import com.zcunsoft.clklog.report.model.UserJourney;
import com.zcunsoft.clklog.report.services.IBehaviorReportService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import javax.annotation.Resource;

@RestController
@RequestMapping("dashboard")
public class DashboardController {

    @Resource
    private IBehaviorReportService behaviorReportService;

    @GetMapping("funnel")
    public ApiResponse<FunnelReport> funnel(@RequestParam(value = "timeRange", required = false) String timeRange,
                                            @RequestParam(value = "platform", required = false) String platform,
                                            @RequestParam(value = "steps", required = false) String steps) {
        return ApiResponse.ok(behaviorReportService.funnel(timeRange, platform, steps));
    }

    @GetMapping("user-journey")
    public ApiResponse<UserJourney> userJourney(@RequestParam(value = "timeRange", required = false) String timeRange,
                                                @RequestParam(value = "platform", required = false) String platform,
                                                @RequestParam(value = "startingPoint", required = false) String startingPoint,
                                                @RequestParam(value = "maxSteps", required = false) Integer maxSteps,
                                                @RequestParam(value = "nodesPerStep", required = false) Integer nodesPerStep) {
        return ApiResponse.ok(behaviorReportService.userJourney(timeRange, platform, startingPoint, maxSteps, nodesPerStep));
    }

    @GetMapping("path-starting-points")
    public ApiResponse<StartingPoints> pathStartingPoints(@RequestParam(value = "timeRange", required = false) String timeRange,
                                                          @RequestParam(value = "platform", required = false) String platform) {
        return ApiResponse.ok(behaviorReportService.startingPoints(timeRange, platform));
    }

    @GetMapping("all")
    public ApiResponse<DashboardSnapshot> all(@RequestParam(value = "timeRange", required = false) String timeRange,
                                              @RequestParam(value = "platform", required = false) String platform) {
        return ApiResponse.ok(behaviorReportService.dashboard(timeRange, platform));
    }

    @GetMapping("realtime")
    public ApiResponse<RealtimeMetrics> realtime(@RequestParam(value = "platform", required = false) String platform) {
        return ApiResponse.ok(behaviorReportService.realtime(platform));
    }
}
