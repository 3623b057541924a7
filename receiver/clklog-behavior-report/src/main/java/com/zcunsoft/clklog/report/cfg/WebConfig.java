package com.zcunsoft.clklog.report.cfg;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final ReportSetting reportSetting;

    public WebConfig(ReportSetting reportSetting) {
        this.reportSetting = reportSetting;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        String[] patterns = reportSetting.getAccessControlAllowOriginPatterns();
        if (patterns != null && patterns.length > 0) {
            registry.addMapping("/dashboard/**")
                    .allowedOriginPatterns(patterns)
                    .allowedMethods("GET");
        }
    }
}
