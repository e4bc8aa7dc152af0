package com.lynkvertx.batteryopt.service;

import com.lynkvertx.batteryopt.config.OptimizerConfig;
import com.lynkvertx.batteryopt.dto.BatteryParametersDTO;
import com.lynkvertx.batteryopt.dto.OptimizationRequestDTO;
import com.lynkvertx.batteryopt.dto.ProfileSeriesDTO;
import com.lynkvertx.batteryopt.exception.InvalidInputException;
import com.lynkvertx.batteryopt.model.BatterySpec;
import com.lynkvertx.batteryopt.model.OptimizationMode;
import com.lynkvertx.batteryopt.model.ProfileData;
import com.lynkvertx.batteryopt.optimizer.InputValidator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Maps request DTOs onto the optimizer's immutable inputs.
 * Range checks are left to the optimizer's validator.
 */
@Component
@RequiredArgsConstructor
public class OptimizationInputAssembler {

    private final OptimizerConfig config;
    private final TariffProfileFactory tariffProfileFactory;
    private final InputValidator inputValidator;

    public ProfileData toProfile(OptimizationRequestDTO request) {
        double dt = timestepHours(request.getTimestepHours());
        int n = horizon(request);
        inputValidator.validateHorizon(n);
        int startMinutes = TariffProfileFactory.timeToMinutes(startTime(request));
        OptimizationMode mode = mode(request);

        double[] importTariff = tariffProfileFactory.resolve("importTariff", request.getImportTariff(), n, dt, startMinutes);
        double[] demand = tariffProfileFactory.resolve("demand", request.getDemand(), n, dt, startMinutes);
        double[] exportTariff = request.getExportTariff() != null
            ? tariffProfileFactory.resolve("exportTariff", request.getExportTariff(), n, dt, startMinutes)
            : new double[n];

        double[] carbonIntensity;
        if (request.getCarbonIntensity() != null) {
            carbonIntensity = tariffProfileFactory.resolve("carbonIntensity", request.getCarbonIntensity(), n, dt, startMinutes);
        } else if (mode == OptimizationMode.CARBON) {
            throw new InvalidInputException("carbonIntensity is required in CARBON mode");
        } else {
            carbonIntensity = new double[n];
        }

        return ProfileData.of(importTariff, exportTariff, demand, carbonIntensity, dt);
    }

    public BatterySpec toBatterySpec(BatteryParametersDTO dto, OptimizationMode mode) {
        if (dto == null) {
            throw new InvalidInputException("battery is required");
        }
        return BatterySpec.builder()
            .capacityKwh(required("capacityKwh", dto.getCapacityKwh()))
            .maxChargeKw(required("maxChargeKw", dto.getMaxChargeKw()))
            .maxDischargeKw(required("maxDischargeKw", dto.getMaxDischargeKw()))
            .efficiency(required("efficiency", dto.getEfficiency()))
            .initialEnergyKwh(required("initialEnergyKwh", dto.getInitialEnergyKwh()))
            .minEnergyKwh(dto.getMinEnergyKwh())
            .maxEnergyKwh(dto.getMaxEnergyKwh())
            .minFinalEnergyKwh(dto.getMinFinalEnergyKwh())
            .maxFinalEnergyKwh(dto.getMaxFinalEnergyKwh())
            .mode(mode)
            .build();
    }

    public OptimizationMode mode(OptimizationRequestDTO request) {
        return request.getMode() != null ? request.getMode() : OptimizationMode.COST;
    }

    public String startTime(OptimizationRequestDTO request) {
        return request.getStartTime() != null ? request.getStartTime() : "00:00";
    }

    public double timestepHours(Double requested) {
        return requested != null ? requested : config.getDefaultTimestepHours();
    }

    /** Explicit N, else the length of the first series given as explicit values */
    int horizon(OptimizationRequestDTO request) {
        if (request.getTimesteps() != null) {
            return request.getTimesteps();
        }
        return Arrays.asList(request.getImportTariff(), request.getExportTariff(),
                request.getDemand(), request.getCarbonIntensity())
            .stream()
            .filter(Objects::nonNull)
            .map(ProfileSeriesDTO::getValues)
            .filter(Objects::nonNull)
            .mapToInt(List::size)
            .findFirst()
            .orElseThrow(() -> new InvalidInputException(
                "timesteps is required when no series is given as explicit values"));
    }

    private static double required(String name, Double value) {
        if (value == null) {
            throw new InvalidInputException(name + " is required");
        }
        return value;
    }
}
