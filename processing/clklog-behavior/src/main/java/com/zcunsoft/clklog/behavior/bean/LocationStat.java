package com.zcunsoft.clklog.behavior.bean;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LocationStat {
    private String country;
    private String region;
    private String city;
    private long users;
}
