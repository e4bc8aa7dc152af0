package com.lynkvertx.batteryopt.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Time-of-use period: one value applied over one or more daily time ranges.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TouPeriodDTO {

    /** Free-form label, e.g. "peak", "off-peak" */
    private String periodType;

    private List<TimeRangeEntry> timeRanges;

    private Double value;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TimeRangeEntry {
        private String start; // HH:mm
        private String end;   // HH:mm, exclusive; end before start wraps past midnight
    }
}
