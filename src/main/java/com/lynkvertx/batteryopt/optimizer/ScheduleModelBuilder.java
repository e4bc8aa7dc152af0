package com.lynkvertx.batteryopt.optimizer;

import com.lynkvertx.batteryopt.model.BatterySpec;
import com.lynkvertx.batteryopt.model.ProfileData;
import com.lynkvertx.batteryopt.solver.LinearExpression;
import com.lynkvertx.batteryopt.solver.LinearModel;
import com.lynkvertx.batteryopt.solver.Relation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Builds the feasible region of the battery schedule LP.
 *
 * Per timestep t = 0..N-1 there are four non-negative power flows:
 * <ul>
 *   <li>charge(t) in [0, maxCharge]: grid to battery</li>
 *   <li>discharge_home(t) in [0, maxDischarge]: battery to home</li>
 *   <li>discharge_grid(t) in [0, maxDischarge]: battery to grid (export)</li>
 *   <li>grid_home(t) &gt;= 0: grid to home, no upper bound</li>
 * </ul>
 * and energy(t) for t = 0..N bounded by the state-of-charge window.
 *
 * Constraints:
 * <pre>
 *   energy(0)   = initialEnergy
 *   energy(t+1) = energy(t) + dt * (eff * charge(t) - discharge_home(t) - discharge_grid(t))
 *   grid_home(t) + discharge_home(t) = demand(t)
 *   discharge_home(t) + discharge_grid(t) &lt;= maxDischarge
 *   minFinal &lt;= energy(N) &lt;= maxFinal        (only when given)
 * </pre>
 * The objective is left empty; see {@link ObjectiveSelector}. Conflicts between
 * bounds are not resolved here, the solver reports them as infeasible.
 */
@Slf4j
@Component
public class ScheduleModelBuilder {

    public ScheduleModel build(ProfileData profile, BatterySpec battery) {
        int n = profile.size();
        double dt = profile.getTimestepHours();
        double efficiency = battery.getEfficiency();
        double maxCharge = battery.getMaxChargeKw();
        double maxDischarge = battery.getMaxDischargeKw();

        LinearModel lp = new LinearModel("battery-schedule");
        int[] charge = new int[n];
        int[] dischargeHome = new int[n];
        int[] dischargeGrid = new int[n];
        int[] gridHome = new int[n];
        int[] energy = new int[n + 1];

        for (int t = 0; t < n; t++) {
            charge[t] = lp.addVariable("charge_" + t, 0.0, maxCharge);
            dischargeHome[t] = lp.addVariable("discharge_home_" + t, 0.0, maxDischarge);
            dischargeGrid[t] = lp.addVariable("discharge_grid_" + t, 0.0, maxDischarge);
            gridHome[t] = lp.addVariable("grid_home_" + t, 0.0, Double.POSITIVE_INFINITY);
        }
        for (int t = 0; t <= n; t++) {
            energy[t] = lp.addVariable("energy_" + t,
                battery.effectiveMinEnergyKwh(), battery.effectiveMaxEnergyKwh());
        }

        lp.addConstraint("initial_energy", LinearExpression.of(energy[0], 1.0),
            Relation.EQ, battery.getInitialEnergyKwh());

        for (int t = 0; t < n; t++) {
            // energy(t+1) - energy(t) - dt*eff*charge(t) + dt*discharge_home(t) + dt*discharge_grid(t) = 0
            lp.addConstraint("energy_balance_" + t,
                LinearExpression.of(energy[t + 1], 1.0)
                    .minus(energy[t], 1.0)
                    .minus(charge[t], dt * efficiency)
                    .plus(dischargeHome[t], dt)
                    .plus(dischargeGrid[t], dt),
                Relation.EQ, 0.0);

            // Demand must be met exactly
            lp.addConstraint("demand_" + t,
                LinearExpression.of(gridHome[t], 1.0).plus(dischargeHome[t], 1.0),
                Relation.EQ, profile.demand(t));

            lp.addConstraint("discharge_limit_" + t,
                LinearExpression.of(dischargeHome[t], 1.0).plus(dischargeGrid[t], 1.0),
                Relation.LEQ, maxDischarge);
        }

        if (battery.getMinFinalEnergyKwh() != null) {
            lp.addConstraint("min_final_energy", LinearExpression.of(energy[n], 1.0),
                Relation.GEQ, battery.getMinFinalEnergyKwh());
        }
        if (battery.getMaxFinalEnergyKwh() != null) {
            lp.addConstraint("max_final_energy", LinearExpression.of(energy[n], 1.0),
                Relation.LEQ, battery.getMaxFinalEnergyKwh());
        }

        log.debug("Built schedule model: {} timesteps of {}h, {} variables, {} constraints",
            n, dt, lp.variableCount(), lp.constraintCount());

        return new ScheduleModel(lp, n, dt, charge, dischargeHome, dischargeGrid, gridHome, energy);
    }
}
