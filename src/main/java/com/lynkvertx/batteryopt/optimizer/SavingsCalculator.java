package com.lynkvertx.batteryopt.optimizer;

import com.lynkvertx.batteryopt.model.OptimizationMode;
import com.lynkvertx.batteryopt.model.ProfileData;
import com.lynkvertx.batteryopt.model.SavingsReport;
import com.lynkvertx.batteryopt.model.Schedule;
import org.springframework.stereotype.Component;

/**
 * Compares a schedule against the no-battery baseline, where every timestep's
 * demand is imported directly (grid_home = demand, all battery flows zero).
 *
 * Both metrics are always reported. Savings = baseline - optimized, so a
 * negative value means the schedule is worse than having no battery.
 */
@Component
public class SavingsCalculator {

    public SavingsReport calculate(ProfileData profile, Schedule schedule, OptimizationMode mode) {
        double optimizedCost = 0.0;
        double optimizedCarbon = 0.0;
        for (int t = 0; t < schedule.size(); t++) {
            optimizedCost += ObjectiveSelector.costIntegrand(profile, t,
                schedule.charge(t), schedule.gridHome(t), schedule.dischargeGrid(t));
            optimizedCarbon += ObjectiveSelector.carbonIntegrand(profile, t,
                schedule.charge(t), schedule.gridHome(t));
        }

        double baselineCost = baselineCost(profile);
        double baselineCarbon = baselineCarbon(profile);

        return SavingsReport.builder()
            .mode(mode)
            .baselineCost(baselineCost)
            .optimizedCost(optimizedCost)
            .costSavings(baselineCost - optimizedCost)
            .baselineCarbon(baselineCarbon)
            .optimizedCarbon(optimizedCarbon)
            .carbonSavings(baselineCarbon - optimizedCarbon)
            .build();
    }

    /** Cost with no battery: sum_t dt * demand(t) * import(t) */
    public double baselineCost(ProfileData profile) {
        double total = 0.0;
        for (int t = 0; t < profile.size(); t++) {
            total += ObjectiveSelector.costIntegrand(profile, t, 0.0, profile.demand(t), 0.0);
        }
        return total;
    }

    /** Emissions with no battery: sum_t dt * demand(t) * carbonIntensity(t) */
    public double baselineCarbon(ProfileData profile) {
        double total = 0.0;
        for (int t = 0; t < profile.size(); t++) {
            total += ObjectiveSelector.carbonIntegrand(profile, t, 0.0, profile.demand(t));
        }
        return total;
    }
}
