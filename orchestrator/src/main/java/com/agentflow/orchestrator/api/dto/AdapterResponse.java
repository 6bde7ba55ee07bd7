package com.agentflow.orchestrator.api.dto;

import com.agentflow.orchestrator.adapter.AgentAdapter;
import com.agentflow.orchestrator.adapter.CapabilityDescriptor;

/**
 * One entry of GET /adapters.
 */
public record AdapterResponse(
        String               toolId,
        String               executable,
        String               memoryFile,
        boolean              consistentlyUnhealthy,
        CapabilityDescriptor capabilities
) {
    public static AdapterResponse from(AgentAdapter adapter, boolean consistentlyUnhealthy) {
        return new AdapterResponse(
                adapter.toolId(),
                adapter.executableName(),
                adapter.memoryFilename(),
                consistentlyUnhealthy,
                adapter.capabilities()
        );
    }
}
