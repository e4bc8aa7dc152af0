package com.lynkvertx.batteryopt.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the schedule optimizer.
 * Solver tolerances and the default timestep are externalized here
 * so they can be tuned via application.yml without touching the model.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "battery-optimizer.optimizer")
public class OptimizerConfig {

    /** Timestep duration in hours when a request does not specify one */
    private double defaultTimestepHours = 1.0;

    /** Longest horizon N accepted; the dense simplex tableau grows with N squared */
    private int maxTimesteps = 288;

    /** Upper bound on simplex iterations before the solve is reported as a solver error */
    private int maxIterations = 100_000;

    /** Simplex optimality / feasibility tolerance */
    private double epsilon = 1.0e-6;

    /** ULP distance used by the simplex tableau when comparing doubles */
    private int maxUlps = 10;

    /** Pivot elements smaller than this are treated as zero */
    private double cutOff = 1.0e-10;

    /** Simplex pivot selection rule */
    private PivotRule pivotRule = PivotRule.BLAND;

    /** Tolerance for post-solve checks on the extracted schedule (kW / kWh) */
    private double tolerance = 1.0e-6;

    public enum PivotRule {
        DANTZIG,
        BLAND
    }
}
