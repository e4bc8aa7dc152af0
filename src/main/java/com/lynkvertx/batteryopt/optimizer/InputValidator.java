package com.lynkvertx.batteryopt.optimizer;

import com.lynkvertx.batteryopt.config.OptimizerConfig;
import com.lynkvertx.batteryopt.exception.InvalidInputException;
import com.lynkvertx.batteryopt.model.BatterySpec;
import com.lynkvertx.batteryopt.model.ProfileData;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Rejects malformed or contradictory inputs before any model is built.
 * All violations are collected so the caller sees every problem at once.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InputValidator {

    private final OptimizerConfig config;

    /**
     * Validate profiles and battery parameters for an optimization run.
     *
     * @throws InvalidInputException naming every violated constraint
     */
    public void validate(ProfileData profile, BatterySpec battery) {
        List<String> violations = new ArrayList<>();
        if (profile == null) {
            violations.add("profile data is required");
        } else {
            checkProfile(profile, violations);
        }
        if (battery == null) {
            violations.add("battery spec is required");
        } else {
            checkBattery(battery, violations);
            if (battery.getMode() == null) {
                violations.add("optimization mode is required");
            }
        }
        throwIfAny(violations);
    }

    /**
     * Validate battery parameters alone (used when replaying a power plan).
     *
     * @throws InvalidInputException naming every violated constraint
     */
    public void validateBattery(BatterySpec battery) {
        List<String> violations = new ArrayList<>();
        if (battery == null) {
            violations.add("battery spec is required");
        } else {
            checkBattery(battery, violations);
        }
        throwIfAny(violations);
    }

    /**
     * Validate a timestep duration on its own (used when replaying a power plan).
     *
     * @throws InvalidInputException if the duration is not a positive finite number
     */
    public void validateTimestep(double timestepHours) {
        List<String> violations = new ArrayList<>();
        checkTimestep(timestepHours, violations);
        throwIfAny(violations);
    }

    /**
     * Reject a horizon longer than the configured cap before any per-timestep array is built.
     *
     * @throws InvalidInputException naming the limit
     */
    public void validateHorizon(int timesteps) {
        List<String> violations = new ArrayList<>();
        checkHorizon(timesteps, violations);
        throwIfAny(violations);
    }

    private void checkProfile(ProfileData profile, List<String> violations) {
        double[] importTariff = profile.getImportTariff();
        double[] exportTariff = profile.getExportTariff();
        double[] demand = profile.getDemand();
        double[] carbonIntensity = profile.getCarbonIntensity();

        if (importTariff == null || exportTariff == null || demand == null || carbonIntensity == null) {
            violations.add("importTariff, exportTariff, demand and carbonIntensity are all required");
            return;
        }

        int n = importTariff.length;
        checkHorizon(n, violations);
        if (exportTariff.length != n || demand.length != n || carbonIntensity.length != n) {
            violations.add(String.format(
                "profiles must have equal length (importTariff=%d, exportTariff=%d, demand=%d, carbonIntensity=%d)",
                n, exportTariff.length, demand.length, carbonIntensity.length));
        }

        checkFinite("importTariff", importTariff, violations);
        checkFinite("exportTariff", exportTariff, violations);
        checkFinite("demand", demand, violations);
        checkFinite("carbonIntensity", carbonIntensity, violations);
        for (int t = 0; t < carbonIntensity.length; t++) {
            if (carbonIntensity[t] < 0) {
                violations.add(String.format("carbonIntensity[%d] must be >= 0 (was %s)", t, carbonIntensity[t]));
                break;
            }
        }

        checkTimestep(profile.getTimestepHours(), violations);
    }

    private void checkHorizon(int n, List<String> violations) {
        if (n < 1) {
            violations.add("horizon must contain at least one timestep (N >= 1)");
        } else if (n > config.getMaxTimesteps()) {
            violations.add(String.format("horizon of %d timesteps exceeds maxTimesteps=%d", n, config.getMaxTimesteps()));
        }
    }

    private static void checkTimestep(double dt, List<String> violations) {
        if (!(dt > 0) || Double.isInfinite(dt)) {
            violations.add(String.format("timestepHours must be > 0 (was %s)", dt));
        }
    }

    private void checkBattery(BatterySpec battery, List<String> violations) {
        double capacity = battery.getCapacityKwh();
        if (!(capacity > 0) || Double.isInfinite(capacity)) {
            violations.add(String.format("capacityKwh must be > 0 (was %s)", capacity));
        }
        double efficiency = battery.getEfficiency();
        if (!(efficiency > 0 && efficiency <= 1)) {
            violations.add(String.format("efficiency must be in (0, 1] (was %s)", efficiency));
        }
        if (!(battery.getMaxChargeKw() >= 0) || Double.isInfinite(battery.getMaxChargeKw())) {
            violations.add(String.format("maxChargeKw must be >= 0 (was %s)", battery.getMaxChargeKw()));
        }
        if (!(battery.getMaxDischargeKw() >= 0) || Double.isInfinite(battery.getMaxDischargeKw())) {
            violations.add(String.format("maxDischargeKw must be >= 0 (was %s)", battery.getMaxDischargeKw()));
        }

        double initial = battery.getInitialEnergyKwh();
        if (!(initial >= 0 && initial <= capacity)) {
            violations.add(String.format("initialEnergyKwh must be in [0, capacityKwh=%s] (was %s)", capacity, initial));
        }

        double minEnergy = battery.effectiveMinEnergyKwh();
        double maxEnergy = battery.effectiveMaxEnergyKwh();
        if (!(minEnergy >= 0)) {
            violations.add(String.format("minEnergyKwh must be >= 0 (was %s)", minEnergy));
        }
        if (!(maxEnergy <= capacity)) {
            violations.add(String.format("maxEnergyKwh must be <= capacityKwh=%s (was %s)", capacity, maxEnergy));
        }
        if (!(minEnergy <= maxEnergy)) {
            violations.add(String.format("minEnergyKwh (%s) must not exceed maxEnergyKwh (%s)", minEnergy, maxEnergy));
        } else if (initial >= 0 && initial <= capacity && (initial < minEnergy || initial > maxEnergy)) {
            violations.add(String.format("initialEnergyKwh (%s) must lie within [minEnergyKwh=%s, maxEnergyKwh=%s]",
                initial, minEnergy, maxEnergy));
        }

        Double minFinal = battery.getMinFinalEnergyKwh();
        Double maxFinal = battery.getMaxFinalEnergyKwh();
        if (minFinal != null && !(minFinal >= 0 && minFinal <= capacity)) {
            violations.add(String.format("minFinalEnergyKwh must be in [0, capacityKwh=%s] (was %s)", capacity, minFinal));
        }
        if (maxFinal != null && !(maxFinal >= 0 && maxFinal <= capacity)) {
            violations.add(String.format("maxFinalEnergyKwh must be in [0, capacityKwh=%s] (was %s)", capacity, maxFinal));
        }
        if (minFinal != null && maxFinal != null && minFinal > maxFinal) {
            violations.add(String.format("minFinalEnergyKwh (%s) must not exceed maxFinalEnergyKwh (%s)", minFinal, maxFinal));
        }
    }

    private static void checkFinite(String name, double[] values, List<String> violations) {
        for (int t = 0; t < values.length; t++) {
            if (!Double.isFinite(values[t])) {
                violations.add(String.format("%s[%d] must be a finite number (was %s)", name, t, values[t]));
                return;
            }
        }
    }

    private static void throwIfAny(List<String> violations) {
        if (!violations.isEmpty()) {
            String message = "Invalid input: " + String.join("; ", violations);
            log.warn(message);
            throw new InvalidInputException(message);
        }
    }
}
