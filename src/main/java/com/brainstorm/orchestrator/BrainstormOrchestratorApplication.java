package com.brainstorm.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class BrainstormOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(BrainstormOrchestratorApplication.class, args);
    }
}
