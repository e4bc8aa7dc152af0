package com.lynkvertx.batteryopt.model;

import lombok.Value;

import java.util.List;

/**
 * Everything a successful optimization run produces. Failed runs produce no instance.
 */
@Value
public class OptimizationRun {
    ProfileData profile;
    BatterySpec battery;
    Schedule schedule;
    SavingsReport savings;
    double objectiveValue;
    List<String> calculationSteps;
}
