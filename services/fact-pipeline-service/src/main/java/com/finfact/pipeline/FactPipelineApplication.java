package com.finfact.pipeline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class FactPipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(FactPipelineApplication.class, args);
    }
}
