package com.agentflow.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Pipeline orchestrator for autonomous coding agents.
 *
 * To run locally:
 *   DB_URL=jdbc:postgresql://localhost:5432/agentflow mvn -pl orchestrator spring-boot:run
 */
@SpringBootApplication
public class AgentflowApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentflowApplication.class, args);
    }
}
