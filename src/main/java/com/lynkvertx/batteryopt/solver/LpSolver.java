package com.lynkvertx.batteryopt.solver;

/**
 * Linear programming capability used by the schedule optimizer.
 * Implementations must never throw for a model-related outcome; infeasible,
 * unbounded and internal failures are reported through {@link SolverResult}.
 */
public interface LpSolver {

    SolverResult solve(LinearModel model);
}
