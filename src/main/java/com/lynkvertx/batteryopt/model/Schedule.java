package com.lynkvertx.batteryopt.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Arrays;

/**
 * Optimized power flows per timestep plus the derived energy series.
 *
 * Flow arrays have length N; {@code energy} has length N + 1 where
 * energy[t] is the stored energy at the start of timestep t and energy[N]
 * is the energy left at the end of the horizon. Values are not rounded.
 */
@ToString
@EqualsAndHashCode
public final class Schedule {

    private final double[] charge;
    private final double[] dischargeHome;
    private final double[] dischargeGrid;
    private final double[] gridHome;
    private final double[] energy;
    private final double timestepHours;

    public Schedule(double[] charge, double[] dischargeHome, double[] dischargeGrid,
                    double[] gridHome, double[] energy, double timestepHours) {
        int n = charge.length;
        if (dischargeHome.length != n || dischargeGrid.length != n || gridHome.length != n
            || energy.length != n + 1) {
            throw new IllegalArgumentException(String.format(
                "Schedule sequences must have length %d (energy %d)", n, n + 1));
        }
        this.charge = charge.clone();
        this.dischargeHome = dischargeHome.clone();
        this.dischargeGrid = dischargeGrid.clone();
        this.gridHome = gridHome.clone();
        this.energy = energy.clone();
        this.timestepHours = timestepHours;
    }

    /** Number of timesteps N */
    public int size() {
        return charge.length;
    }

    public double charge(int t) {
        return charge[t];
    }

    public double dischargeHome(int t) {
        return dischargeHome[t];
    }

    public double dischargeGrid(int t) {
        return dischargeGrid[t];
    }

    public double gridHome(int t) {
        return gridHome[t];
    }

    /** Stored energy at the start of timestep t, t = 0..N */
    public double energy(int t) {
        return energy[t];
    }

    public double getTimestepHours() {
        return timestepHours;
    }

    public double[] getCharge() {
        return Arrays.copyOf(charge, charge.length);
    }

    public double[] getDischargeHome() {
        return Arrays.copyOf(dischargeHome, dischargeHome.length);
    }

    public double[] getDischargeGrid() {
        return Arrays.copyOf(dischargeGrid, dischargeGrid.length);
    }

    public double[] getGridHome() {
        return Arrays.copyOf(gridHome, gridHome.length);
    }

    public double[] getEnergy() {
        return Arrays.copyOf(energy, energy.length);
    }
}
