package com.lynkvertx.batteryopt.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.Valid;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Positive;
import java.util.List;

/**
 * Request DTO for replaying a net power plan against a battery.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SimulationRequestDTO {

    /** Net battery power per timestep (kW): + charge, - discharge */
    @NotEmpty
    private List<Double> plan;

    /** Timestep duration in hours; null = configured default */
    @Positive
    private Double timestepHours;

    @NotNull
    @Valid
    private BatteryParametersDTO battery;
}
