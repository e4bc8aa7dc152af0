package com.lynkvertx.batteryopt.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springdoc.core.GroupedOpenApi;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI (Swagger) Configuration
 */
@Configuration
public class OpenApiConfig {

    private static final String ERROR_TYPES =
        "Failed runs return no schedule. errorType is one of INVALID_INPUT (400), "
            + "INFEASIBLE_MODEL (422), UNBOUNDED_MODEL (500) or SOLVER_ERROR (500).";

    @Bean
    public OpenAPI batteryOptimizerOpenAPI(@Value("${spring.application.name:battery-optimizer}") String name,
                                           @Value("${battery-optimizer.api-version:0.1.0}") String version) {
        return new OpenAPI()
            .info(new Info()
                .title(name)
                .version(version)
                .description("Cost- or carbon-optimal home battery schedules over a discrete horizon. "
                    + ERROR_TYPES));
    }

    @Bean
    public GroupedOpenApi batteryApi() {
        return GroupedOpenApi.builder()
            .group("battery")
            .pathsToMatch("/api/battery/**")
            .build();
    }
}
