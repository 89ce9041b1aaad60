package io.agentbridge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Agent Bridge: shared memory between an AI decision subsystem and a trading subsystem,
 * with retention sweeps scheduled by JobRunr.
 */
@SpringBootApplication
public class AgentBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentBridgeApplication.class, args);
    }
}
