package com.example.leafmachine.config;

import com.example.leafmachine.model.Agent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Builds the provenance agent once at startup. Every annotation produced by this
 * process references the same instance.
 */
@Configuration
public class AgentConfiguration {

    private static final Logger log = LoggerFactory.getLogger(AgentConfiguration.class);

    @Bean
    public Agent masAgent(LeafMachineProperties properties) {
        LeafMachineProperties.Mas mas = properties.getMas();
        Agent agent = Agent.machineAnnotationService(mas.getId(), mas.getName());
        log.info("Annotations will be created by agent {} ({})", agent.id(), agent.name());
        return agent;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
