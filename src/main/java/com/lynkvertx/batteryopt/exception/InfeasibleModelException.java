package com.lynkvertx.batteryopt.exception;

/**
 * The solver proved that no schedule satisfies every constraint.
 */
public class InfeasibleModelException extends BatteryOptimizationException {

    public InfeasibleModelException(String message) {
        super(message);
    }

    public InfeasibleModelException(String message, Throwable cause) {
        super(message, cause);
    }
}
