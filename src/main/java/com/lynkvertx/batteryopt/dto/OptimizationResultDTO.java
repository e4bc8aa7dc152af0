package com.lynkvertx.batteryopt.dto;

import com.lynkvertx.batteryopt.model.OptimizationMode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Result DTO for a schedule optimization. Values are not rounded.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OptimizationResultDTO {

    private OptimizationMode mode;

    /** Always OPTIMAL; failed runs return an error response instead */
    private String status;

    private double timestepHours;

    /** Objective value reported by the solver */
    private double objectiveValue;

    /** One entry per timestep */
    private List<SchedulePoint> schedule;

    /** Stored energy at the start of each timestep plus the end of the horizon (N + 1 values) */
    private List<Double> energyKwh;

    private SavingsSummary savings;

    /** Step-by-step calculation debug info */
    private List<String> calculationSteps;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SchedulePoint {
        private int timestep;
        private String timeSlot;            // HH:mm
        private double chargeKw;            // grid to battery
        private double dischargeHomeKw;     // battery to home
        private double dischargeGridKw;     // battery to grid
        private double gridHomeKw;          // grid to home
        private double energyStartKwh;
        private double energyEndKwh;
        private double demandKw;
        private double importTariff;
        private double exportTariff;
        private double carbonIntensity;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SavingsSummary {
        private double costSavings;
        private double carbonSavings;
        private double baselineCost;
        private double optimizedCost;
        private double baselineCarbon;
        private double optimizedCarbon;
    }
}
