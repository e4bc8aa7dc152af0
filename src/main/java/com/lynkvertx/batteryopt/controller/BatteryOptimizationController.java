package com.lynkvertx.batteryopt.controller;

import com.lynkvertx.batteryopt.dto.ApiResponse;
import com.lynkvertx.batteryopt.dto.GreedyScheduleResultDTO;
import com.lynkvertx.batteryopt.dto.OptimizationRequestDTO;
import com.lynkvertx.batteryopt.dto.OptimizationResultDTO;
import com.lynkvertx.batteryopt.dto.SimulationRequestDTO;
import com.lynkvertx.batteryopt.dto.SimulationResultDTO;
import com.lynkvertx.batteryopt.service.BatteryOptimizationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import javax.validation.Valid;

/**
 * Battery Schedule REST Controller
 */
@RestController
@RequestMapping("/api/battery")
@RequiredArgsConstructor
@Tag(name = "Battery Optimization", description = "Home battery charge/discharge scheduling APIs")
public class BatteryOptimizationController {

    private final BatteryOptimizationService optimizationService;

    @PostMapping("/optimize")
    @Operation(summary = "Optimize schedule", description = "Compute the cost- or carbon-optimal battery schedule with linear programming and report savings against no battery")
    public ResponseEntity<ApiResponse<OptimizationResultDTO>> optimize(
            @Valid @RequestBody OptimizationRequestDTO request) {
        OptimizationResultDTO result = optimizationService.optimize(request);
        return ResponseEntity.ok(ApiResponse.success("Optimization completed", result));
    }

    @PostMapping("/greedy-schedule")
    @Operation(summary = "Greedy schedule", description = "Build a heuristic charge/discharge plan without an LP and simulate it")
    public ResponseEntity<ApiResponse<GreedyScheduleResultDTO>> greedySchedule(
            @Valid @RequestBody OptimizationRequestDTO request) {
        GreedyScheduleResultDTO result = optimizationService.greedySchedule(request);
        return ResponseEntity.ok(ApiResponse.success("Greedy schedule completed", result));
    }

    @PostMapping("/simulate")
    @Operation(summary = "Simulate plan", description = "Replay a net power plan against the battery's rate and energy limits")
    public ResponseEntity<ApiResponse<SimulationResultDTO>> simulate(
            @Valid @RequestBody SimulationRequestDTO request) {
        SimulationResultDTO result = optimizationService.simulate(request);
        return ResponseEntity.ok(ApiResponse.success("Simulation completed", result));
    }
}
