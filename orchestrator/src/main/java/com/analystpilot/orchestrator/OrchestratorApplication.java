package com.analystpilot.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Data analyst agent service.
 *
 * To run:
 *   NVIDIA_API_KEY=... GEMINI_API_KEY=... mvn -pl orchestrator spring-boot:run
 */
@SpringBootApplication
public class OrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrchestratorApplication.class, args);
    }
}
