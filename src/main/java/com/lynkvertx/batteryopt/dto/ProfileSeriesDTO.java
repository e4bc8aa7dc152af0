package com.lynkvertx.batteryopt.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One per-timestep input series, given in exactly one of three forms:
 * explicit values, a flat value, or time-of-use periods.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProfileSeriesDTO {

    /** Explicit value per timestep */
    private List<Double> values;

    /** Same value at every timestep */
    private Double flatValue;

    /** Values by time of day */
    private List<TouPeriodDTO> touPeriods;

    public static ProfileSeriesDTO ofValues(List<Double> values) {
        return ProfileSeriesDTO.builder().values(values).build();
    }

    public static ProfileSeriesDTO flat(double value) {
        return ProfileSeriesDTO.builder().flatValue(value).build();
    }
}
