package com.lynkvertx.batteryopt.optimizer;

import com.lynkvertx.batteryopt.solver.LinearModel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * LP for one optimization run together with the variable index of every
 * flow and energy value, so solver output can be read back per timestep.
 */
@Getter
@AllArgsConstructor
public class ScheduleModel {

    private final LinearModel linearModel;

    /** Number of timesteps N */
    private final int timesteps;

    private final double timestepHours;

    /** Variable index of charge(t), length N */
    private final int[] charge;

    /** Variable index of discharge_home(t), length N */
    private final int[] dischargeHome;

    /** Variable index of discharge_grid(t), length N */
    private final int[] dischargeGrid;

    /** Variable index of grid_home(t), length N */
    private final int[] gridHome;

    /** Variable index of energy(t), length N + 1 */
    private final int[] energy;
}
