package com.spreadsheet.formula.config;

import com.spreadsheet.formula.functions.FunctionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
@EnableConfigurationProperties(FormulaProperties.class)
public class FormulaEngineConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(FormulaEngineConfiguration.class);

    @Bean
    public FunctionRegistry functionRegistry() {
        FunctionRegistry registry = FunctionRegistry.withBuiltins();
        LOG.info("Registered {} built-in functions", registry.names().size());
        return registry;
    }

    @Bean
    public Clock formulaClock(FormulaProperties properties) {
        String zone = properties.getTimeZone();
        if (zone == null || zone.trim().isEmpty()) {
            return Clock.systemDefaultZone();
        }
        return Clock.system(ZoneId.of(zone.trim()));
    }
}
