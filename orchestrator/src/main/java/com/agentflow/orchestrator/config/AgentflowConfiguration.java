package com.agentflow.orchestrator.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Binds the {@code agentflow.*} property groups.
 *
 * Kept off the application class so that web slice tests do not need the
 * property beans.
 */
@Configuration
@EnableConfigurationProperties({
        AdapterProperties.class,
        RegistryProperties.class,
        PipelineProperties.class,
        BridgeProperties.class
})
public class AgentflowConfiguration {
}
