package com.example.leafmachine;

import com.example.leafmachine.config.LeafMachineProperties;
import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Contact;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@OpenAPIDefinition(
        info = @Info(
                title = "LeafMachine Annotation Connector",
                version = "1.0",
                description = "Consumes annotation jobs, runs LeafMachine plant component detection and publishes openDS annotation events.",
                contact = @Contact(name = "LeafMachine Connector")))
@SpringBootApplication
@EnableConfigurationProperties(LeafMachineProperties.class)
public class LeafMachineConnectorApplication {

    public static void main(String[] args) {
        SpringApplication.run(LeafMachineConnectorApplication.class, args);
    }
}
