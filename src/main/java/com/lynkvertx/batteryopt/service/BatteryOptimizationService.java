package com.lynkvertx.batteryopt.service;

import com.lynkvertx.batteryopt.dto.GreedyScheduleResultDTO;
import com.lynkvertx.batteryopt.dto.GreedyScheduleResultDTO.PowerStep;
import com.lynkvertx.batteryopt.dto.OptimizationRequestDTO;
import com.lynkvertx.batteryopt.dto.OptimizationResultDTO;
import com.lynkvertx.batteryopt.dto.OptimizationResultDTO.SavingsSummary;
import com.lynkvertx.batteryopt.dto.OptimizationResultDTO.SchedulePoint;
import com.lynkvertx.batteryopt.dto.SimulationRequestDTO;
import com.lynkvertx.batteryopt.dto.SimulationResultDTO;
import com.lynkvertx.batteryopt.exception.InfeasibleModelException;
import com.lynkvertx.batteryopt.exception.SolverException;
import com.lynkvertx.batteryopt.exception.UnboundedModelException;
import com.lynkvertx.batteryopt.model.BatterySpec;
import com.lynkvertx.batteryopt.model.OptimizationMode;
import com.lynkvertx.batteryopt.model.OptimizationRun;
import com.lynkvertx.batteryopt.model.ProfileData;
import com.lynkvertx.batteryopt.model.SavingsReport;
import com.lynkvertx.batteryopt.model.Schedule;
import com.lynkvertx.batteryopt.model.SimulationResult;
import com.lynkvertx.batteryopt.optimizer.BatterySimulator;
import com.lynkvertx.batteryopt.optimizer.GreedyScheduler;
import com.lynkvertx.batteryopt.optimizer.InputValidator;
import com.lynkvertx.batteryopt.optimizer.ObjectiveSelector;
import com.lynkvertx.batteryopt.optimizer.SavingsCalculator;
import com.lynkvertx.batteryopt.optimizer.ScheduleExtractor;
import com.lynkvertx.batteryopt.optimizer.ScheduleModel;
import com.lynkvertx.batteryopt.optimizer.ScheduleModelBuilder;
import com.lynkvertx.batteryopt.solver.LpSolver;
import com.lynkvertx.batteryopt.solver.SolverResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Battery Optimization Service
 *
 * Orchestrates one offline optimization run:
 * validate inputs, build the LP, select the objective, solve, extract the
 * schedule and compare it with the no-battery baseline.
 *
 * Every run builds a fresh model from its own inputs; the service holds no
 * state between runs. The solve blocks the calling thread and cannot be
 * cancelled from here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BatteryOptimizationService {

    private final InputValidator inputValidator;
    private final ScheduleModelBuilder modelBuilder;
    private final ObjectiveSelector objectiveSelector;
    private final LpSolver solver;
    private final ScheduleExtractor scheduleExtractor;
    private final SavingsCalculator savingsCalculator;
    private final GreedyScheduler greedyScheduler;
    private final BatterySimulator batterySimulator;
    private final OptimizationInputAssembler inputAssembler;

    /**
     * Compute the optimal schedule for the battery's optimization mode.
     *
     * @param profile Per-timestep tariffs, demand and carbon intensity
     * @param battery Battery parameters and optimization mode
     * @return Schedule, savings report and calculation trace
     * @throws com.lynkvertx.batteryopt.exception.InvalidInputException if inputs are malformed
     * @throws InfeasibleModelException if no schedule satisfies the constraints
     * @throws UnboundedModelException  if the solver reports an unbounded objective
     * @throws SolverException          on solver-internal failure
     */
    public OptimizationRun optimize(ProfileData profile, BatterySpec battery) {
        List<String> steps = new ArrayList<>();

        // === Step 1: Validate inputs ===
        inputValidator.validate(profile, battery);
        OptimizationMode mode = battery.getMode();
        steps.add(String.format("Step 1: Inputs valid, N=%d timesteps of %.4fh, mode=%s",
            profile.size(), profile.getTimestepHours(), mode));
        steps.add(String.format("Step 1a: Battery capacity=%.3fkWh, charge<=%.3fkW, discharge<=%.3fkW, efficiency=%.4f, initial=%.3fkWh, window=[%.3f, %.3f]kWh",
            battery.getCapacityKwh(), battery.getMaxChargeKw(), battery.getMaxDischargeKw(), battery.getEfficiency(),
            battery.getInitialEnergyKwh(), battery.effectiveMinEnergyKwh(), battery.effectiveMaxEnergyKwh()));

        // === Step 2: Build variables and constraints ===
        ScheduleModel model = modelBuilder.build(profile, battery);
        steps.add(String.format("Step 2: LP built with %d variables and %d constraints",
            model.getLinearModel().variableCount(), model.getLinearModel().constraintCount()));

        // === Step 3: Objective for the active mode ===
        objectiveSelector.apply(model, profile, mode);
        steps.add(mode == OptimizationMode.COST
            ? "Step 3: Objective = minimize import cost - export revenue"
            : "Step 3: Objective = minimize imported carbon (no export credit)");

        // === Step 4: Solve ===
        SolverResult result = solver.solve(model.getLinearModel());
        steps.add("Step 4: Solver status = " + result.getStatus());
        requireOptimal(result, profile, battery);
        steps.add(String.format("Step 4a: Objective value = %.6f", result.getObjectiveValue()));

        // === Step 5: Extract schedule ===
        Schedule schedule = scheduleExtractor.extract(model, result, battery);
        steps.add(String.format("Step 5: Schedule extracted, final energy = %.4fkWh",
            schedule.energy(schedule.size())));

        // === Step 6: Savings against the no-battery baseline ===
        SavingsReport savings = savingsCalculator.calculate(profile, schedule, mode);
        steps.add(String.format("Step 6: Cost baseline=%.4f optimized=%.4f savings=%.4f",
            savings.getBaselineCost(), savings.getOptimizedCost(), savings.getCostSavings()));
        steps.add(String.format("Step 6a: Carbon baseline=%.4f optimized=%.4f savings=%.4f",
            savings.getBaselineCarbon(), savings.getOptimizedCarbon(), savings.getCarbonSavings()));

        log.info("Optimized {} timesteps in {} mode: objective={}, cost savings={}, carbon savings={}",
            profile.size(), mode, result.getObjectiveValue(), savings.getCostSavings(), savings.getCarbonSavings());

        return new OptimizationRun(profile, battery, schedule, savings, result.getObjectiveValue(), steps);
    }

    public OptimizationResultDTO optimize(OptimizationRequestDTO request) {
        OptimizationMode mode = inputAssembler.mode(request);
        ProfileData profile = inputAssembler.toProfile(request);
        BatterySpec battery = inputAssembler.toBatterySpec(request.getBattery(), mode);

        OptimizationRun run = optimize(profile, battery);
        return toResultDTO(run, TariffProfileFactory.timeToMinutes(inputAssembler.startTime(request)));
    }

    /**
     * Heuristic plan for the battery's mode, replayed through the simulator.
     */
    public GreedyScheduleResultDTO greedySchedule(OptimizationRequestDTO request) {
        OptimizationMode mode = inputAssembler.mode(request);
        ProfileData profile = inputAssembler.toProfile(request);
        BatterySpec battery = inputAssembler.toBatterySpec(request.getBattery(), mode);
        inputValidator.validate(profile, battery);

        double[] plan = greedyScheduler.plan(profile, battery);
        SimulationResult simulation = batterySimulator.simulate(plan, battery, profile.getTimestepHours());
        int startMinutes = TariffProfileFactory.timeToMinutes(inputAssembler.startTime(request));

        List<PowerStep> powerSteps = new ArrayList<>();
        for (int t = 0; t < plan.length; t++) {
            powerSteps.add(PowerStep.builder()
                .timestep(t)
                .timeSlot(timeSlot(t, profile.getTimestepHours(), startMinutes))
                .plannedPowerKw(plan[t])
                .actualPowerKw(simulation.actualPower(t))
                .energyStartKwh(simulation.energy(t))
                .build());
        }

        List<String> steps = new ArrayList<>();
        steps.add(String.format("Step 1: Greedy %s plan over %d timesteps", mode, plan.length));
        steps.add(String.format("Step 2: Simulated final energy = %.4fkWh", simulation.energy(plan.length)));
        log.info("Greedy {} plan for {} timesteps, final energy {}kWh", mode, plan.length, simulation.energy(plan.length));

        return GreedyScheduleResultDTO.builder()
            .mode(mode)
            .timestepHours(profile.getTimestepHours())
            .steps(powerSteps)
            .finalEnergyKwh(simulation.energy(plan.length))
            .calculationSteps(steps)
            .build();
    }

    /**
     * Replay a net power plan against a battery.
     */
    public SimulationResultDTO simulate(SimulationRequestDTO request) {
        BatterySpec battery = inputAssembler.toBatterySpec(request.getBattery(), OptimizationMode.COST);
        inputValidator.validateBattery(battery);
        double dt = inputAssembler.timestepHours(request.getTimestepHours());
        inputValidator.validateTimestep(dt);

        double[] plan = new double[request.getPlan().size()];
        for (int t = 0; t < plan.length; t++) {
            Double power = request.getPlan().get(t);
            plan[t] = power != null ? power : 0.0;
        }

        SimulationResult simulation = batterySimulator.simulate(plan, battery, dt);
        return SimulationResultDTO.builder()
            .timestepHours(dt)
            .actualPowerKw(toList(simulation.getActualPower()))
            .energyKwh(toList(simulation.getEnergy()))
            .build();
    }

    /** Map non-optimal outcomes onto the error taxonomy; no schedule is produced for them */
    private void requireOptimal(SolverResult result, ProfileData profile, BatterySpec battery) {
        switch (result.getStatus()) {
            case OPTIMAL:
                return;
            case INFEASIBLE:
                log.warn("Infeasible schedule model for {} timesteps: {}", profile.size(), result.getMessage());
                throw new InfeasibleModelException(
                    "No feasible schedule: the battery limits, energy window and demand cannot all be met", result.getCause());
            case UNBOUNDED:
                log.error("Unbounded schedule model for {} timesteps (battery {}); the model builder is defective",
                    profile.size(), battery);
                throw new UnboundedModelException(
                    "Solver reported an unbounded objective; the schedule model is defective", result.getCause());
            default:
                log.error("Solver failed: {}", result.getMessage(), result.getCause());
                throw new SolverException("LP solver failed: " + result.getMessage(), result.getCause());
        }
    }

    private OptimizationResultDTO toResultDTO(OptimizationRun run, int startMinutes) {
        ProfileData profile = run.getProfile();
        Schedule schedule = run.getSchedule();
        double dt = profile.getTimestepHours();

        List<SchedulePoint> points = new ArrayList<>();
        for (int t = 0; t < schedule.size(); t++) {
            points.add(SchedulePoint.builder()
                .timestep(t)
                .timeSlot(timeSlot(t, dt, startMinutes))
                .chargeKw(schedule.charge(t))
                .dischargeHomeKw(schedule.dischargeHome(t))
                .dischargeGridKw(schedule.dischargeGrid(t))
                .gridHomeKw(schedule.gridHome(t))
                .energyStartKwh(schedule.energy(t))
                .energyEndKwh(schedule.energy(t + 1))
                .demandKw(profile.demand(t))
                .importTariff(profile.importTariff(t))
                .exportTariff(profile.exportTariff(t))
                .carbonIntensity(profile.carbonIntensity(t))
                .build());
        }

        SavingsReport savings = run.getSavings();
        return OptimizationResultDTO.builder()
            .mode(savings.getMode())
            .status("OPTIMAL")
            .timestepHours(dt)
            .objectiveValue(run.getObjectiveValue())
            .schedule(points)
            .energyKwh(toList(schedule.getEnergy()))
            .savings(SavingsSummary.builder()
                .costSavings(savings.getCostSavings())
                .carbonSavings(savings.getCarbonSavings())
                .baselineCost(savings.getBaselineCost())
                .optimizedCost(savings.getOptimizedCost())
                .baselineCarbon(savings.getBaselineCarbon())
                .optimizedCarbon(savings.getOptimizedCarbon())
                .build())
            .calculationSteps(run.getCalculationSteps())
            .build();
    }

    private static String timeSlot(int t, double dt, int startMinutes) {
        return TariffProfileFactory.minutesToTime(TariffProfileFactory.slotStartMinutes(t, dt, startMinutes));
    }

    private static List<Double> toList(double[] values) {
        List<Double> list = new ArrayList<>(values.length);
        for (double value : values) {
            list.add(value);
        }
        return list;
    }
}
