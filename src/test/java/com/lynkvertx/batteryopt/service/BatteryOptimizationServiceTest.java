package com.lynkvertx.batteryopt.service;

import com.lynkvertx.batteryopt.config.OptimizerConfig;
import com.lynkvertx.batteryopt.dto.BatteryParametersDTO;
import com.lynkvertx.batteryopt.dto.GreedyScheduleResultDTO;
import com.lynkvertx.batteryopt.dto.OptimizationRequestDTO;
import com.lynkvertx.batteryopt.dto.OptimizationResultDTO;
import com.lynkvertx.batteryopt.dto.ProfileSeriesDTO;
import com.lynkvertx.batteryopt.dto.SimulationRequestDTO;
import com.lynkvertx.batteryopt.dto.SimulationResultDTO;
import com.lynkvertx.batteryopt.dto.TouPeriodDTO;
import com.lynkvertx.batteryopt.exception.InfeasibleModelException;
import com.lynkvertx.batteryopt.exception.InvalidInputException;
import com.lynkvertx.batteryopt.exception.SolverException;
import com.lynkvertx.batteryopt.exception.UnboundedModelException;
import com.lynkvertx.batteryopt.model.BatterySpec;
import com.lynkvertx.batteryopt.model.OptimizationMode;
import com.lynkvertx.batteryopt.model.OptimizationRun;
import com.lynkvertx.batteryopt.model.ProfileData;
import com.lynkvertx.batteryopt.model.Schedule;
import com.lynkvertx.batteryopt.optimizer.BatterySimulator;
import com.lynkvertx.batteryopt.optimizer.GreedyScheduler;
import com.lynkvertx.batteryopt.optimizer.InputValidator;
import com.lynkvertx.batteryopt.optimizer.ObjectiveSelector;
import com.lynkvertx.batteryopt.optimizer.SavingsCalculator;
import com.lynkvertx.batteryopt.optimizer.ScheduleExtractor;
import com.lynkvertx.batteryopt.optimizer.ScheduleModelBuilder;
import com.lynkvertx.batteryopt.solver.CommonsMathLpSolver;
import com.lynkvertx.batteryopt.solver.LpSolver;
import com.lynkvertx.batteryopt.solver.SolverResult;
import com.lynkvertx.batteryopt.solver.SolverStatus;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class BatteryOptimizationServiceTest {

    private static final double TOL = 1e-5;

    private final OptimizerConfig config = new OptimizerConfig();

    private final BatteryOptimizationService service = serviceWith(new CommonsMathLpSolver(config));

    @Test
    void shouldShiftDemandToCheapTimestepInCostMode() {
        OptimizationRun run = service.optimize(twoStepProfile(), tenKwhBattery(OptimizationMode.COST));

        Schedule schedule = run.getSchedule();
        assertThat(schedule.charge(0)).isCloseTo(5.0, within(TOL));
        assertThat(schedule.gridHome(0)).isCloseTo(5.0, within(TOL));
        assertThat(schedule.dischargeHome(1)).isCloseTo(5.0, within(TOL));
        assertThat(schedule.gridHome(1)).isCloseTo(0.0, within(TOL));
        assertThat(schedule.energy(1)).isCloseTo(5.0, within(TOL));
        assertThat(schedule.energy(2)).isCloseTo(0.0, within(TOL));

        assertThat(run.getSavings().getBaselineCost()).isCloseTo(2.0, within(TOL));
        assertThat(run.getSavings().getOptimizedCost()).isCloseTo(1.0, within(TOL));
        assertThat(run.getSavings().getCostSavings()).isCloseTo(1.0, within(TOL));
        assertThat(run.getObjectiveValue()).isCloseTo(1.0, within(TOL));
        assertThat(run.getCalculationSteps()).isNotEmpty();
        assertThat(run.getCalculationSteps().get(0)).startsWith("Step 1:");
    }

    @Test
    void shouldShiftDemandToCleanTimestepInCarbonMode() {
        OptimizationRun run = service.optimize(twoStepProfile(), tenKwhBattery(OptimizationMode.CARBON));

        assertThat(run.getSchedule().charge(0)).isCloseTo(5.0, within(TOL));
        assertThat(run.getSavings().getMode()).isEqualTo(OptimizationMode.CARBON);
        assertThat(run.getSavings().getBaselineCarbon()).isCloseTo(2000.0, within(TOL));
        assertThat(run.getSavings().getCarbonSavings()).isCloseTo(1000.0, within(TOL));
        assertThat(run.getSavings().targetSavings()).isCloseTo(1000.0, within(TOL));
    }

    @Test
    void shouldHoldInvariantsOnRandomInputs() {
        Random random = new Random(42);
        for (int trial = 0; trial < 25; trial++) {
            int n = 4 + random.nextInt(9);
            double dt = random.nextBoolean() ? 1.0 : 0.5;
            double[] importTariff = new double[n];
            double[] exportTariff = new double[n];
            double[] demand = new double[n];
            double[] intensity = new double[n];
            for (int t = 0; t < n; t++) {
                importTariff[t] = 0.05 + random.nextDouble() * 0.4;
                exportTariff[t] = random.nextDouble() * 0.1;
                demand[t] = random.nextDouble() * 4.0;
                intensity[t] = 50 + random.nextDouble() * 400;
            }
            double capacity = 5 + random.nextDouble() * 10;
            OptimizationMode mode = random.nextBoolean() ? OptimizationMode.COST : OptimizationMode.CARBON;
            BatterySpec battery = BatterySpec.builder()
                .capacityKwh(capacity)
                .maxChargeKw(1 + random.nextDouble() * 4)
                .maxDischargeKw(1 + random.nextDouble() * 4)
                .efficiency(0.8 + random.nextDouble() * 0.2)
                .initialEnergyKwh(random.nextDouble() * capacity)
                .mode(mode)
                .build();
            ProfileData profile = ProfileData.of(importTariff, exportTariff, demand, intensity, dt);

            OptimizationRun run = service.optimize(profile, battery);

            assertScheduleInvariants(profile, battery, run.getSchedule());
            assertThat(run.getSavings().targetSavings())
                .as("target savings in trial %d", trial)
                .isGreaterThanOrEqualTo(-TOL);
        }
    }

    @Test
    void shouldReturnSameScheduleForSameInputs() {
        ProfileData profile = twoStepProfile();
        BatterySpec battery = tenKwhBattery(OptimizationMode.COST);

        OptimizationRun first = service.optimize(profile, battery);
        OptimizationRun second = service.optimize(profile, battery);

        assertThat(second.getSchedule()).isEqualTo(first.getSchedule());
        assertThat(second.getSavings()).isEqualTo(first.getSavings());
    }

    @Test
    void shouldReportInfeasibleForNegativeDemand() {
        ProfileData profile = ProfileData.hourly(
            new double[]{0.1, 0.3}, new double[]{0, 0}, new double[]{-1.0, 5.0}, new double[]{0, 0});

        assertThatThrownBy(() -> service.optimize(profile, tenKwhBattery(OptimizationMode.COST)))
            .isInstanceOf(InfeasibleModelException.class);
    }

    @Test
    void shouldReportInfeasibleForUnreachableFinalEnergy() {
        BatterySpec battery = tenKwhBattery(OptimizationMode.COST).toBuilder()
            .maxChargeKw(2.0)
            .minFinalEnergyKwh(10.0)
            .build();

        assertThatThrownBy(() -> service.optimize(twoStepProfile(), battery))
            .isInstanceOf(InfeasibleModelException.class)
            .hasMessageContaining("No feasible schedule");
    }

    @Test
    void shouldRejectInvalidInputBeforeSolving() {
        AtomicInteger solves = new AtomicInteger();
        BatteryOptimizationService counting = serviceWith(model -> {
            solves.incrementAndGet();
            return SolverResult.failed(SolverStatus.SOLVER_ERROR, "unexpected", null);
        });
        BatterySpec overfull = tenKwhBattery(OptimizationMode.COST).toBuilder().initialEnergyKwh(12.0).build();

        assertThatThrownBy(() -> counting.optimize(twoStepProfile(), overfull))
            .isInstanceOf(InvalidInputException.class)
            .hasMessageContaining("initialEnergyKwh");
        assertThat(solves).hasValue(0);
    }

    @Test
    void shouldMapUnboundedResultToDefect() {
        BatteryOptimizationService unbounded = serviceWith(
            model -> SolverResult.failed(SolverStatus.UNBOUNDED, "unbounded", null));

        assertThatThrownBy(() -> unbounded.optimize(twoStepProfile(), tenKwhBattery(OptimizationMode.COST)))
            .isInstanceOf(UnboundedModelException.class);
    }

    @Test
    void shouldMapSolverFailureToSolverException() {
        IllegalStateException cause = new IllegalStateException("numerical trouble");
        BatteryOptimizationService failing = serviceWith(
            model -> SolverResult.failed(SolverStatus.SOLVER_ERROR, "numerical trouble", cause));

        assertThatThrownBy(() -> failing.optimize(twoStepProfile(), tenKwhBattery(OptimizationMode.COST)))
            .isInstanceOf(SolverException.class)
            .hasMessageContaining("numerical trouble")
            .hasCause(cause);
    }

    @Test
    void shouldOptimizeRequestWithTimeOfUseTariff() {
        OptimizationRequestDTO request = OptimizationRequestDTO.builder()
            .timesteps(4)
            .timestepHours(1.0)
            .startTime("22:00")
            .importTariff(ProfileSeriesDTO.builder().touPeriods(Arrays.asList(
                period("peak", "17:00", "23:00", 0.30),
                period("off-peak", "23:00", "07:00", 0.10))).build())
            .demand(ProfileSeriesDTO.flat(2.0))
            .battery(batteryParameters(10.0, 5.0))
            .build();

        OptimizationResultDTO result = service.optimize(request);

        assertThat(result.getStatus()).isEqualTo("OPTIMAL");
        assertThat(result.getMode()).isEqualTo(OptimizationMode.COST);
        assertThat(result.getSchedule()).extracting(OptimizationResultDTO.SchedulePoint::getTimeSlot)
            .containsExactly("22:00", "23:00", "00:00", "01:00");
        assertThat(result.getSchedule()).extracting(OptimizationResultDTO.SchedulePoint::getImportTariff)
            .containsExactly(0.30, 0.10, 0.10, 0.10);
        assertThat(result.getEnergyKwh()).hasSize(5);
        // 2kWh displaced at 0.30, the remaining 3kWh at 0.10
        assertThat(result.getSavings().getCostSavings()).isCloseTo(0.9, within(TOL));
        assertThat(result.getCalculationSteps()).isNotEmpty();
    }

    @Test
    void shouldRequireCarbonIntensityInCarbonMode() {
        OptimizationRequestDTO request = OptimizationRequestDTO.builder()
            .mode(OptimizationMode.CARBON)
            .importTariff(ProfileSeriesDTO.ofValues(Arrays.asList(0.1, 0.3)))
            .demand(ProfileSeriesDTO.ofValues(Arrays.asList(5.0, 5.0)))
            .battery(batteryParameters(10.0, 0.0))
            .build();

        assertThatThrownBy(() -> service.optimize(request))
            .isInstanceOf(InvalidInputException.class)
            .hasMessageContaining("carbonIntensity is required");
    }

    @Test
    void shouldPlanGreedyScheduleAndSimulateIt() {
        OptimizationRequestDTO request = OptimizationRequestDTO.builder()
            .importTariff(ProfileSeriesDTO.ofValues(Arrays.asList(0.1, 0.1, 0.3, 0.3)))
            .demand(ProfileSeriesDTO.ofValues(Arrays.asList(0.0, 0.0, 2.0, 2.0)))
            .battery(batteryParameters(10.0, 0.0))
            .build();

        GreedyScheduleResultDTO result = service.greedySchedule(request);

        assertThat(result.getSteps()).hasSize(4);
        assertThat(result.getSteps().get(0).getPlannedPowerKw()).isCloseTo(5.0, within(TOL));
        assertThat(result.getSteps().get(2).getPlannedPowerKw()).isCloseTo(-2.0, within(TOL));
        assertThat(result.getSteps().get(2).getActualPowerKw()).isCloseTo(-2.0, within(TOL));
        assertThat(result.getFinalEnergyKwh()).isCloseTo(6.0, within(TOL));
    }

    @Test
    void shouldSimulatePlanTreatingGapsAsIdle() {
        SimulationRequestDTO request = SimulationRequestDTO.builder()
            .plan(Arrays.asList(2.0, null, -1.0))
            .timestepHours(0.5)
            .battery(BatteryParametersDTO.builder()
                .capacityKwh(3.0).maxChargeKw(2.5).maxDischargeKw(1.5)
                .efficiency(0.9).initialEnergyKwh(1.0).build())
            .build();

        SimulationResultDTO result = service.simulate(request);

        assertThat(result.getTimestepHours()).isEqualTo(0.5);
        assertThat(result.getActualPowerKw()).containsExactly(2.0, 0.0, -1.0);
        assertThat(result.getEnergyKwh()).hasSize(4);
        assertThat(result.getEnergyKwh().get(1)).isCloseTo(1.9, within(1e-9));
        assertThat(result.getEnergyKwh().get(3)).isCloseTo(1.4, within(1e-9));
    }

    @Test
    void shouldRejectHorizonAboveCapBeforeBuildingArrays() {
        AtomicInteger solves = new AtomicInteger();
        BatteryOptimizationService counting = serviceWith(model -> {
            solves.incrementAndGet();
            return SolverResult.failed(SolverStatus.SOLVER_ERROR, "unexpected", null);
        });
        OptimizationRequestDTO request = OptimizationRequestDTO.builder()
            .timesteps(3000)
            .importTariff(ProfileSeriesDTO.flat(0.2))
            .demand(ProfileSeriesDTO.flat(1.0))
            .battery(batteryParameters(10.0, 0.0))
            .build();

        assertThatThrownBy(() -> counting.optimize(request))
            .isInstanceOf(InvalidInputException.class)
            .hasMessageContaining("exceeds maxTimesteps=288");
        assertThatThrownBy(() -> counting.greedySchedule(request))
            .isInstanceOf(InvalidInputException.class);
        assertThat(solves).hasValue(0);
    }

    @Test
    void shouldRejectNonPositiveTimestepWhenSimulating() {
        SimulationRequestDTO request = SimulationRequestDTO.builder()
            .plan(Collections.singletonList(1.0))
            .timestepHours(-0.5)
            .battery(BatteryParametersDTO.builder()
                .capacityKwh(3.0).maxChargeKw(2.5).maxDischargeKw(1.5)
                .efficiency(0.9).initialEnergyKwh(1.0).build())
            .build();

        assertThatThrownBy(() -> service.simulate(request))
            .isInstanceOf(InvalidInputException.class)
            .hasMessageContaining("timestepHours must be > 0");
    }

    @Test
    void shouldValidateBatteryBeforeSimulating() {
        SimulationRequestDTO request = SimulationRequestDTO.builder()
            .plan(Collections.singletonList(1.0))
            .battery(BatteryParametersDTO.builder()
                .capacityKwh(3.0).maxChargeKw(2.5).maxDischargeKw(1.5)
                .efficiency(1.5).initialEnergyKwh(1.0).build())
            .build();

        assertThatThrownBy(() -> service.simulate(request))
            .isInstanceOf(InvalidInputException.class)
            .hasMessageContaining("efficiency");
    }

    private BatteryOptimizationService serviceWith(LpSolver solver) {
        InputValidator validator = new InputValidator(config);
        return new BatteryOptimizationService(
            validator,
            new ScheduleModelBuilder(),
            new ObjectiveSelector(),
            solver,
            new ScheduleExtractor(config),
            new SavingsCalculator(),
            new GreedyScheduler(),
            new BatterySimulator(),
            new OptimizationInputAssembler(config, new TariffProfileFactory(), validator));
    }

    private static void assertScheduleInvariants(ProfileData profile, BatterySpec battery, Schedule schedule) {
        double dt = profile.getTimestepHours();
        assertThat(schedule.energy(0)).isCloseTo(battery.getInitialEnergyKwh(), within(TOL));
        for (int t = 0; t < schedule.size(); t++) {
            assertThat(schedule.charge(t)).isBetween(-TOL, battery.getMaxChargeKw() + TOL);
            assertThat(schedule.dischargeHome(t)).isGreaterThanOrEqualTo(-TOL);
            assertThat(schedule.dischargeGrid(t)).isGreaterThanOrEqualTo(-TOL);
            assertThat(schedule.gridHome(t)).isGreaterThanOrEqualTo(-TOL);
            assertThat(schedule.dischargeHome(t) + schedule.dischargeGrid(t))
                .isLessThanOrEqualTo(battery.getMaxDischargeKw() + TOL);
            assertThat(schedule.gridHome(t) + schedule.dischargeHome(t))
                .isCloseTo(profile.demand(t), within(TOL));
            double expectedNext = schedule.energy(t) + dt * (battery.getEfficiency() * schedule.charge(t)
                - schedule.dischargeHome(t) - schedule.dischargeGrid(t));
            assertThat(schedule.energy(t + 1)).isCloseTo(expectedNext, within(TOL));
        }
        for (int t = 0; t <= schedule.size(); t++) {
            assertThat(schedule.energy(t)).isBetween(-TOL, battery.getCapacityKwh() + TOL);
        }
    }

    private static ProfileData twoStepProfile() {
        return ProfileData.hourly(
            new double[]{0.10, 0.30},
            new double[]{0.0, 0.0},
            new double[]{5.0, 5.0},
            new double[]{100.0, 300.0});
    }

    private static BatterySpec tenKwhBattery(OptimizationMode mode) {
        return BatterySpec.builder()
            .capacityKwh(10.0)
            .maxChargeKw(5.0)
            .maxDischargeKw(5.0)
            .efficiency(1.0)
            .initialEnergyKwh(0.0)
            .mode(mode)
            .build();
    }

    private static BatteryParametersDTO batteryParameters(double capacity, double initial) {
        return BatteryParametersDTO.builder()
            .capacityKwh(capacity)
            .maxChargeKw(5.0)
            .maxDischargeKw(5.0)
            .efficiency(1.0)
            .initialEnergyKwh(initial)
            .build();
    }

    private static TouPeriodDTO period(String type, String start, String end, double value) {
        List<TouPeriodDTO.TimeRangeEntry> ranges =
            Collections.singletonList(new TouPeriodDTO.TimeRangeEntry(start, end));
        return TouPeriodDTO.builder().periodType(type).timeRanges(ranges).value(value).build();
    }
}
