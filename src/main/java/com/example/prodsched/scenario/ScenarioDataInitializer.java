package com.example.prodsched.scenario;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;

import java.io.IOException;
import java.io.InputStream;

@Configuration
public class ScenarioDataInitializer {

    private static final Logger logger = LoggerFactory.getLogger(ScenarioDataInitializer.class);

    // Loads bundled scenarios into an empty catalog at start-up
    @Bean
    CommandLineRunner loadScenarios(ScenarioCatalog catalog, ObjectMapper objectMapper,
                                    @Value("${prodsched.scenarios.location:classpath*:scenarios/*.json}") String location) {
        return args -> {
            if (!catalog.isEmpty()) {
                return;
            }
            Resource[] resources = new PathMatchingResourcePatternResolver().getResources(location);
            for (Resource resource : resources) {
                try (InputStream in = resource.getInputStream()) {
                    Scenario scenario = objectMapper.readValue(in, Scenario.class);
                    if (scenario.id() == null || scenario.id().isBlank()) {
                        String filename = resource.getFilename();
                        scenario = scenario.withId(filename == null ? "baseline" : filename.replaceFirst("\\.json$", ""));
                    }
                    catalog.register(scenario);
                } catch (IOException e) {
                    logger.error("Failed to load scenario from {}", resource.getDescription(), e);
                }
            }
        };
    }
}
