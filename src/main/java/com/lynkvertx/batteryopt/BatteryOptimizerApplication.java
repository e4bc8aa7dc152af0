package com.lynkvertx.batteryopt;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Battery Optimizer - home battery charge/discharge scheduling engine
 * Main application entry point
 */
@SpringBootApplication
public class BatteryOptimizerApplication {

    public static void main(String[] args) {
        SpringApplication.run(BatteryOptimizerApplication.class, args);
    }
}
