package com.lynkvertx.batteryopt.model;

/**
 * Quantity minimized by an optimization run. Only one is optimized per run;
 * the other is still reported post hoc.
 */
public enum OptimizationMode {
    /** Import cost minus export revenue */
    COST,
    /** Emissions of imported energy; exports earn no carbon credit */
    CARBON
}
