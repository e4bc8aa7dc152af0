package com.lynkvertx.batteryopt.model;

import lombok.Builder;
import lombok.Value;

/**
 * Fixed battery parameters for one optimization run.
 *
 * Round-trip efficiency is applied on the charging leg only, so every energy
 * figure here is usable (dischargeable) energy.
 */
@Value
@Builder(toBuilder = true)
public class BatterySpec {

    /** Usable capacity (kWh), must be > 0 */
    double capacityKwh;

    /** Maximum grid-to-battery power (kW) */
    double maxChargeKw;

    /** Maximum total battery output, home plus export (kW) */
    double maxDischargeKw;

    /** Round-trip efficiency in (0, 1] */
    double efficiency;

    /** Energy stored at the start of the horizon (kWh) */
    double initialEnergyKwh;

    /** Reserve that must never be used; null means 0 */
    Double minEnergyKwh;

    /** Upper energy limit; null means the full capacity */
    Double maxEnergyKwh;

    /** Lower bound on energy at the end of the horizon; null means unconstrained */
    Double minFinalEnergyKwh;

    /** Upper bound on energy at the end of the horizon; null means unconstrained */
    Double maxFinalEnergyKwh;

    @Builder.Default
    OptimizationMode mode = OptimizationMode.COST;

    public double effectiveMinEnergyKwh() {
        return minEnergyKwh != null ? minEnergyKwh : 0.0;
    }

    public double effectiveMaxEnergyKwh() {
        return maxEnergyKwh != null ? maxEnergyKwh : capacityKwh;
    }
}
