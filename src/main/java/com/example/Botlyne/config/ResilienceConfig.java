package com.example.Botlyne.config;

import com.example.Botlyne.resilience.DependencyGuardRegistry;
import com.example.Botlyne.resilience.DependencyNames;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
public class ResilienceConfig {

    /**
     * One guard per external dependency, created at startup so breaker state is process-wide.
     */
    @Bean
    public DependencyGuardRegistry dependencyGuardRegistry(
            BotlyneProperties properties,
            @Qualifier("dependencyCallExecutor") ThreadPoolTaskExecutor dependencyCallExecutor,
            ObjectProvider<MeterRegistry> meterRegistry,
            Clock clock
    ) {
        DependencyGuardRegistry registry = new DependencyGuardRegistry(
                properties.getResilience(),
                dependencyCallExecutor,
                meterRegistry.getIfAvailable(SimpleMeterRegistry::new),
                clock
        );
        registry.register(DependencyNames.EMBEDDING, properties.getRetrieval().getTimeout());
        registry.register(DependencyNames.VECTOR_STORE, properties.getRetrieval().getTimeout());
        registry.register(DependencyNames.GENERATION, properties.getGeneration().getTimeout());
        return registry;
    }
}
