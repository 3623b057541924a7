package com.zcunsoft.clklog.behavior.bean;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 设备与平台分布，count 为去重用户数
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DevicesAndPlatforms {
    private List<LabelCount> platforms;
    private List<LabelCount> devices;
    private List<LabelCount> os;
    private List<LabelCount> browsers;
    private List<LabelCount> deviceTypes;
}
