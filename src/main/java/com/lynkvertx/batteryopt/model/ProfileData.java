package com.lynkvertx.batteryopt.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Arrays;

/**
 * Per-timestep input profiles, aligned by timestep index.
 *
 * Arrays are copied on the way in and on the way out so a profile can be
 * shared between runs without being mutated by any of them.
 */
@ToString
@EqualsAndHashCode
public final class ProfileData {

    /** Import tariff per timestep (currency/kWh) */
    private final double[] importTariff;

    /** Export tariff per timestep (currency/kWh) */
    private final double[] exportTariff;

    /** Home power demand per timestep (kW) */
    private final double[] demand;

    /** Grid carbon intensity per timestep (gCO2/kWh) */
    private final double[] carbonIntensity;

    /** Duration of one timestep in hours */
    private final double timestepHours;

    private ProfileData(double[] importTariff, double[] exportTariff, double[] demand,
                        double[] carbonIntensity, double timestepHours) {
        this.importTariff = copy(importTariff);
        this.exportTariff = copy(exportTariff);
        this.demand = copy(demand);
        this.carbonIntensity = copy(carbonIntensity);
        this.timestepHours = timestepHours;
    }

    public static ProfileData of(double[] importTariff, double[] exportTariff, double[] demand,
                                 double[] carbonIntensity, double timestepHours) {
        return new ProfileData(importTariff, exportTariff, demand, carbonIntensity, timestepHours);
    }

    /** Hourly profiles */
    public static ProfileData hourly(double[] importTariff, double[] exportTariff, double[] demand,
                                     double[] carbonIntensity) {
        return of(importTariff, exportTariff, demand, carbonIntensity, 1.0);
    }

    /** Horizon length N, taken from the import tariff. Validation checks the other three agree. */
    public int size() {
        return importTariff == null ? 0 : importTariff.length;
    }

    public double importTariff(int t) {
        return importTariff[t];
    }

    public double exportTariff(int t) {
        return exportTariff[t];
    }

    public double demand(int t) {
        return demand[t];
    }

    public double carbonIntensity(int t) {
        return carbonIntensity[t];
    }

    public double getTimestepHours() {
        return timestepHours;
    }

    public double[] getImportTariff() {
        return copy(importTariff);
    }

    public double[] getExportTariff() {
        return copy(exportTariff);
    }

    public double[] getDemand() {
        return copy(demand);
    }

    public double[] getCarbonIntensity() {
        return copy(carbonIntensity);
    }

    private static double[] copy(double[] values) {
        return values == null ? null : Arrays.copyOf(values, values.length);
    }
}
