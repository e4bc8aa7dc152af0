package com.lynkvertx.batteryopt.exception;

/**
 * The solver reported an unbounded objective. Every decision variable of the
 * schedule model is bounded over a finite horizon, so this indicates a defect
 * in model construction rather than bad input.
 */
public class UnboundedModelException extends BatteryOptimizationException {

    public UnboundedModelException(String message, Throwable cause) {
        super(message, cause);
    }
}
