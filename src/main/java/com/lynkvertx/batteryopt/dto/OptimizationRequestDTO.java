package com.lynkvertx.batteryopt.dto;

import com.lynkvertx.batteryopt.model.OptimizationMode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.Valid;
import javax.validation.constraints.Max;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Pattern;
import javax.validation.constraints.Positive;

/**
 * Request DTO for a schedule optimization (also used by the greedy planner).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OptimizationRequestDTO {

    /** null = cost */
    @Builder.Default
    private OptimizationMode mode = OptimizationMode.COST;

    /** Timestep duration in hours; null = configured default */
    @Positive
    private Double timestepHours;

    /** Horizon length N; null = length of the first series given as explicit values */
    @Positive
    @Max(288)
    private Integer timesteps;

    /** Time of day of the first timestep (HH:mm), used to place time-of-use periods */
    @Pattern(regexp = "^([01]\\d|2[0-3]):[0-5]\\d$")
    @Builder.Default
    private String startTime = "00:00";

    /** Import tariff (currency/kWh) */
    @NotNull
    @Valid
    private ProfileSeriesDTO importTariff;

    /** Export tariff (currency/kWh); null = no export revenue */
    @Valid
    private ProfileSeriesDTO exportTariff;

    /** Home power demand (kW) */
    @NotNull
    @Valid
    private ProfileSeriesDTO demand;

    /** Grid carbon intensity (gCO2/kWh); required in carbon mode */
    @Valid
    private ProfileSeriesDTO carbonIntensity;

    @NotNull
    @Valid
    private BatteryParametersDTO battery;
}
