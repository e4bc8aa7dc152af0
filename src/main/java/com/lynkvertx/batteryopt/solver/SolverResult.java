package com.lynkvertx.batteryopt.solver;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Status plus, for an optimal solve, one value per model variable.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class SolverResult {

    private final SolverStatus status;

    /** Variable values indexed like {@link LinearModel#getVariables()}; null unless optimal */
    @Getter(AccessLevel.NONE)
    private final double[] values;

    /** Objective value; NaN unless optimal */
    private final double objectiveValue;

    /** Solver message for non-optimal outcomes */
    private final String message;

    /** Underlying solver exception, if any */
    private final Throwable cause;

    public static SolverResult optimal(double[] values, double objectiveValue) {
        return new SolverResult(SolverStatus.OPTIMAL, values.clone(), objectiveValue, null, null);
    }

    public static SolverResult failed(SolverStatus status, String message, Throwable cause) {
        if (status == SolverStatus.OPTIMAL) {
            throw new IllegalArgumentException("An optimal result needs variable values");
        }
        return new SolverResult(status, null, Double.NaN, message, cause);
    }

    /** Copy of all variable values; null unless optimal */
    public double[] getValues() {
        return values == null ? null : values.clone();
    }

    public boolean isOptimal() {
        return status == SolverStatus.OPTIMAL;
    }

    public double value(int variable) {
        if (values == null) {
            throw new IllegalStateException("No variable values for status " + status);
        }
        return values[variable];
    }
}
