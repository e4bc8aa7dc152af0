package com.lynkvertx.batteryopt.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Outcome of replaying a net power plan against a battery.
 * {@code actualPower} has length N, {@code energy} N + 1 (start of each step plus the end).
 */
@ToString
@EqualsAndHashCode
public final class SimulationResult {

    private final double[] actualPower;
    private final double[] energy;

    public SimulationResult(double[] actualPower, double[] energy) {
        this.actualPower = actualPower.clone();
        this.energy = energy.clone();
    }

    public int size() {
        return actualPower.length;
    }

    public double actualPower(int t) {
        return actualPower[t];
    }

    public double energy(int t) {
        return energy[t];
    }

    public double[] getActualPower() {
        return actualPower.clone();
    }

    public double[] getEnergy() {
        return energy.clone();
    }
}
