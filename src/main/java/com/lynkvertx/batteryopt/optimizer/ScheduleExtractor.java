package com.lynkvertx.batteryopt.optimizer;

import com.lynkvertx.batteryopt.config.OptimizerConfig;
import com.lynkvertx.batteryopt.model.BatterySpec;
import com.lynkvertx.batteryopt.model.Schedule;
import com.lynkvertx.batteryopt.solver.SolverResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reads the four flows per timestep out of an optimal solution and derives
 * energy(t) from them with the same recurrence the model uses. The solver's
 * own energy variables are only compared against, never copied.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScheduleExtractor {

    private final OptimizerConfig config;

    public Schedule extract(ScheduleModel model, SolverResult result, BatterySpec battery) {
        if (!result.isOptimal()) {
            throw new IllegalStateException("Cannot extract a schedule from a " + result.getStatus() + " solve");
        }

        int n = model.getTimesteps();
        double dt = model.getTimestepHours();
        double efficiency = battery.getEfficiency();

        double[] charge = new double[n];
        double[] dischargeHome = new double[n];
        double[] dischargeGrid = new double[n];
        double[] gridHome = new double[n];
        double[] energy = new double[n + 1];

        energy[0] = battery.getInitialEnergyKwh();
        double maxDrift = 0.0;
        for (int t = 0; t < n; t++) {
            charge[t] = result.value(model.getCharge()[t]);
            dischargeHome[t] = result.value(model.getDischargeHome()[t]);
            dischargeGrid[t] = result.value(model.getDischargeGrid()[t]);
            gridHome[t] = result.value(model.getGridHome()[t]);
            energy[t + 1] = nextEnergy(energy[t], charge[t], dischargeHome[t], dischargeGrid[t], efficiency, dt);
            maxDrift = Math.max(maxDrift, Math.abs(energy[t + 1] - result.value(model.getEnergy()[t + 1])));
        }

        if (maxDrift > config.getTolerance()) {
            log.warn("Recomputed energy differs from solver energy by up to {} kWh", maxDrift);
        } else {
            log.debug("Max energy drift between solver and recurrence: {} kWh", maxDrift);
        }

        return new Schedule(charge, dischargeHome, dischargeGrid, gridHome, energy, dt);
    }

    /** energy(t+1) = energy(t) + dt * (eff * charge - discharge_home - discharge_grid) */
    static double nextEnergy(double energy, double charge, double dischargeHome, double dischargeGrid,
                             double efficiency, double dt) {
        return energy + dt * (efficiency * charge - dischargeHome - dischargeGrid);
    }
}
