package com.lynkvertx.batteryopt.optimizer;

import com.lynkvertx.batteryopt.model.BatterySpec;
import com.lynkvertx.batteryopt.model.OptimizationMode;
import com.lynkvertx.batteryopt.model.ProfileData;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Heuristic schedule without an LP, used as a quick comparison plan.
 *
 * Algorithm:
 * 1. Score every timestep by import tariff (cost) or carbon intensity (carbon).
 * 2. Charge pass: walk timesteps cheapest first and charge as much as the rate
 *    limit and the headroom at that point allow.
 * 3. Discharge pass: walk timesteps most expensive first and discharge up to
 *    the home demand of that step, limited by rate and stored energy.
 * 4. Repeat both passes until neither schedules anything new.
 *
 * A timestep is scheduled at most once. A candidate is rejected when the
 * projected energy would leave the state-of-charge window at any later step.
 *
 * Result is a net battery power per timestep in kW: positive charges,
 * negative discharges.
 */
@Slf4j
@Component
public class GreedyScheduler {

    private static final double EPSILON = 1.0e-9;

    public double[] plan(ProfileData profile, BatterySpec battery) {
        int n = profile.size();
        double dt = profile.getTimestepHours();
        double efficiency = battery.getEfficiency();
        double minEnergy = battery.effectiveMinEnergyKwh();
        double maxEnergy = battery.effectiveMaxEnergyKwh();

        List<SlotScore> slots = new ArrayList<>();
        for (int t = 0; t < n; t++) {
            double score = battery.getMode() == OptimizationMode.CARBON
                ? profile.carbonIntensity(t)
                : profile.importTariff(t);
            slots.add(new SlotScore(t, score));
        }
        List<SlotScore> cheapestFirst = new ArrayList<>(slots);
        cheapestFirst.sort(Comparator.comparingDouble((SlotScore s) -> s.score).thenComparingInt(s -> s.index));
        List<SlotScore> dearestFirst = new ArrayList<>(slots);
        dearestFirst.sort(Comparator.comparingDouble((SlotScore s) -> -s.score).thenComparingInt(s -> s.index));

        double[] power = new double[n];
        double[] remainingDemandKwh = new double[n];
        for (int t = 0; t < n; t++) {
            remainingDemandKwh[t] = Math.max(0.0, profile.demand(t)) * dt;
        }

        int passes = 0;
        boolean changed = true;
        while (changed) {
            changed = false;
            passes++;

            // Charge pass
            for (SlotScore slot : cheapestFirst) {
                int t = slot.index;
                if (power[t] != 0) continue;

                double energy = energyAt(power, t, battery.getInitialEnergyKwh(), efficiency, dt);
                double storable = Math.min(battery.getMaxChargeKw() * dt * efficiency, maxEnergy - energy);
                if (storable <= EPSILON) continue;

                double candidate = storable / (efficiency * dt);
                if (!wouldBreakWindow(power, t, candidate, battery.getInitialEnergyKwh(),
                        minEnergy, maxEnergy, efficiency, dt)) {
                    power[t] = candidate;
                    changed = true;
                }
            }

            // Discharge pass
            for (SlotScore slot : dearestFirst) {
                int t = slot.index;
                if (power[t] != 0) continue;

                double energy = energyAt(power, t, battery.getInitialEnergyKwh(), efficiency, dt);
                double deliverable = Math.min(Math.min(battery.getMaxDischargeKw() * dt, energy - minEnergy),
                    remainingDemandKwh[t]);
                if (deliverable <= EPSILON) continue;

                double candidate = -deliverable / dt;
                if (!wouldBreakWindow(power, t, candidate, battery.getInitialEnergyKwh(),
                        minEnergy, maxEnergy, efficiency, dt)) {
                    power[t] = candidate;
                    remainingDemandKwh[t] -= deliverable;
                    changed = true;
                }
            }
        }

        log.debug("Greedy {} plan for {} timesteps settled after {} passes", battery.getMode(), n, passes);
        return power;
    }

    /** Energy stored at the start of timestep t under the current plan */
    static double energyAt(double[] power, int t, double initialEnergy, double efficiency, double dt) {
        double energy = initialEnergy;
        for (int k = 0; k < t; k++) {
            energy += energyDelta(power[k], efficiency, dt);
        }
        return energy;
    }

    /** True if setting power[t] = candidate pushes the energy outside [min, max] at any step */
    static boolean wouldBreakWindow(double[] power, int t, double candidate, double initialEnergy,
                                    double minEnergy, double maxEnergy, double efficiency, double dt) {
        double energy = initialEnergy;
        for (int k = 0; k < power.length; k++) {
            double p = k == t ? candidate : power[k];
            energy += energyDelta(p, efficiency, dt);
            if (energy < minEnergy - EPSILON || energy > maxEnergy + EPSILON) {
                return true;
            }
        }
        return false;
    }

    private static double energyDelta(double power, double efficiency, double dt) {
        return power > 0 ? power * efficiency * dt : power * dt;
    }

    /** Timestep with its ranking score */
    static class SlotScore {
        final int index;
        final double score;

        SlotScore(int index, double score) {
            this.index = index;
            this.score = score;
        }
    }
}
