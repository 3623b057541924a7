package com.zcunsoft.clklog.report;

import com.zcunsoft.clklog.report.cfg.ReportSetting;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ReportSetting.class)
public class BehaviorReportApplication {

    public static void main(String[] args) {
        SpringApplication.run(BehaviorReportApplication.class, args);
    }
}
