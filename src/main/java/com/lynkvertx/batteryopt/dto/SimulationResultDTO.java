package com.lynkvertx.batteryopt.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Result DTO for a plan replay.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SimulationResultDTO {

    private double timestepHours;

    /** Power actually applied per timestep (kW) */
    private List<Double> actualPowerKw;

    /** Stored energy at the start of each timestep plus the end (N + 1 values) */
    private List<Double> energyKwh;
}
