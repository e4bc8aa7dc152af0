package com.lynkvertx.batteryopt.exception;

/**
 * Solver-internal failure unrelated to the model (iteration limit, numerical breakdown).
 */
public class SolverException extends BatteryOptimizationException {

    public SolverException(String message) {
        super(message);
    }

    public SolverException(String message, Throwable cause) {
        super(message, cause);
    }
}
