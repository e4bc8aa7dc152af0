package com.lynkvertx.batteryopt.dto;

import com.lynkvertx.batteryopt.model.OptimizationMode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Result DTO for the greedy planner: planned net power and its simulated outcome.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GreedyScheduleResultDTO {

    private OptimizationMode mode;

    private double timestepHours;

    private List<PowerStep> steps;

    /** Energy left at the end of the horizon */
    private double finalEnergyKwh;

    private List<String> calculationSteps;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PowerStep {
        private int timestep;
        private String timeSlot;          // HH:mm
        private double plannedPowerKw;    // + charge, - discharge
        private double actualPowerKw;     // after rate and energy clipping
        private double energyStartKwh;
    }
}
