package com.lynkvertx.batteryopt.exception;

/**
 * Base type for every failure of an optimization run.
 * All failures are terminal for the run: no partial schedule is produced.
 */
public class BatteryOptimizationException extends RuntimeException {

    public BatteryOptimizationException(String message) {
        super(message);
    }

    public BatteryOptimizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
