package com.lynkvertx.batteryopt.solver;

/** Outcome of a solve. Only {@link #OPTIMAL} carries variable values. */
public enum SolverStatus {
    OPTIMAL,
    INFEASIBLE,
    UNBOUNDED,
    SOLVER_ERROR
}
