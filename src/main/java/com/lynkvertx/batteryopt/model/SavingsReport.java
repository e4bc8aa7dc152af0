package com.lynkvertx.batteryopt.model;

import lombok.Builder;
import lombok.Value;

/**
 * Savings of an optimized schedule against the no-battery baseline.
 * Positive means the schedule beats the baseline; negative values are kept as-is.
 */
@Value
@Builder
public class SavingsReport {

    /** Mode the schedule was optimized for; only this metric is the optimization target */
    OptimizationMode mode;

    double baselineCost;
    double optimizedCost;
    double costSavings;

    double baselineCarbon;
    double optimizedCarbon;
    double carbonSavings;

    /** Savings in the metric that was optimized */
    public double targetSavings() {
        return mode == OptimizationMode.CARBON ? carbonSavings : costSavings;
    }
}
