package com.lynkvertx.batteryopt.optimizer;

import com.lynkvertx.batteryopt.model.OptimizationMode;
import com.lynkvertx.batteryopt.model.ProfileData;
import com.lynkvertx.batteryopt.solver.LinearExpression;
import org.springframework.stereotype.Component;

/**
 * Builds the linear objective for the chosen optimization mode.
 *
 * Cost:   sum_t dt * [(grid_home + charge) * import - discharge_grid * export]
 * Carbon: sum_t dt * (grid_home + charge) * carbonIntensity
 *
 * Exports earn revenue in cost mode but no carbon credit in carbon mode.
 * The per-timestep integrands are exposed so savings are evaluated with
 * exactly the same formulas.
 */
@Component
public class ObjectiveSelector {

    /** Install the objective for {@code mode} on the model, replacing any previous one; returns the frozen installed copy */
    public LinearExpression apply(ScheduleModel model, ProfileData profile, OptimizationMode mode) {
        return model.getLinearModel().minimize(build(model, profile, mode));
    }

    LinearExpression build(ScheduleModel model, ProfileData profile, OptimizationMode mode) {
        double dt = model.getTimestepHours();
        LinearExpression objective = new LinearExpression();
        for (int t = 0; t < model.getTimesteps(); t++) {
            switch (mode) {
                case COST:
                    double importPrice = dt * profile.importTariff(t);
                    objective.plus(model.getGridHome()[t], importPrice)
                        .plus(model.getCharge()[t], importPrice)
                        .minus(model.getDischargeGrid()[t], dt * profile.exportTariff(t));
                    break;
                case CARBON:
                    double intensity = dt * profile.carbonIntensity(t);
                    objective.plus(model.getGridHome()[t], intensity)
                        .plus(model.getCharge()[t], intensity);
                    break;
                default:
                    throw new IllegalArgumentException("Unknown optimization mode: " + mode);
            }
        }
        return objective;
    }

    /** Cost of timestep t for the given flows */
    public static double costIntegrand(ProfileData profile, int t, double charge, double gridHome, double dischargeGrid) {
        return profile.getTimestepHours()
            * ((gridHome + charge) * profile.importTariff(t) - dischargeGrid * profile.exportTariff(t));
    }

    /** Emissions of timestep t for the given flows */
    public static double carbonIntegrand(ProfileData profile, int t, double charge, double gridHome) {
        return profile.getTimestepHours() * (gridHome + charge) * profile.carbonIntensity(t);
    }
}
