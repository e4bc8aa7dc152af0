package com.lynkvertx.batteryopt.optimizer;

import com.lynkvertx.batteryopt.model.BatterySpec;
import com.lynkvertx.batteryopt.model.SimulationResult;
import org.springframework.stereotype.Component;

/**
 * Replays a net power plan (+charge / -discharge, kW) against a battery.
 *
 * Each step is first clipped to the rate limits, then to the state-of-charge
 * window. When the window clips a step the power is recomputed from the energy
 * that actually moved: through the efficiency when charging, at face value
 * when discharging.
 */
@Component
public class BatterySimulator {

    public SimulationResult simulate(double[] plan, BatterySpec battery, double timestepHours) {
        int n = plan.length;
        double efficiency = battery.getEfficiency();
        double minEnergy = battery.effectiveMinEnergyKwh();
        double maxEnergy = battery.effectiveMaxEnergyKwh();

        double[] actualPower = new double[n];
        double[] energy = new double[n + 1];
        energy[0] = battery.getInitialEnergyKwh();

        for (int t = 0; t < n; t++) {
            double stored = energy[t];
            double power = plan[t];
            double change;
            if (power > 0) {
                power = Math.min(power, battery.getMaxChargeKw());
                change = power * timestepHours * efficiency;
            } else {
                power = Math.max(power, -battery.getMaxDischargeKw());
                change = power * timestepHours;
            }

            double next = stored + change;
            if (next > maxEnergy) {
                change = maxEnergy - stored;
                power = change / timestepHours / efficiency;
                next = maxEnergy;
            } else if (next < minEnergy) {
                change = minEnergy - stored;
                power = change / timestepHours;
                next = minEnergy;
            }

            actualPower[t] = power;
            energy[t + 1] = next;
        }
        return new SimulationResult(actualPower, energy);
    }
}
