package com.example.Botlyne.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
        info = @Info(
                title = "Botlyne API",
                version = "v1",
                description = "Query turns, conversation lifecycle and dependency health for the Botlyne orchestration engine"
        )
)
public class OpenApiConfig {
}
