package com.lynkvertx.batteryopt.exception;

/**
 * Malformed or inconsistent profiles / battery parameters.
 * Raised before any model is built, so nothing reaches the solver.
 */
public class InvalidInputException extends BatteryOptimizationException {

    public InvalidInputException(String message) {
        super(message);
    }
}
