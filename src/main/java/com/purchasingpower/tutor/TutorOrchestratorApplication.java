package com.purchasingpower.tutor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TutorOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(TutorOrchestratorApplication.class, args);
    }
}
