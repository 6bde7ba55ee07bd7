package com.agentflow.orchestrator.adapter;

/**
 * Uniform contract for driving one agent CLI.
 *
 * Each supported tool has exactly one implementation, registered with the
 * {@link com.agentflow.orchestrator.registry.AdapterRegistry}. Stage logic
 * only ever talks to this interface, so it never needs to know which tool
 * is underneath: config format, prompt envelope, response shape, memory file
 * and executable are all answered here.
 *
 * <p>New tools are added by implementing this interface and declaring the
 * implementation as a Spring {@code @Component}. Implementations share
 * behaviour through {@link AdapterSupport}, not through a common superclass.
 *
 * <p>Adapters are immutable once registered and are called concurrently
 * from stage runs and from the background health probe.
 */
public interface AgentAdapter {

    /** Tool identity, e.g. "claude". {@link AgentConfig#toolId()} must match it. */
    String toolId();

    /**
     * Best-effort model acceptance. Never rejects an unrecognized model
     * string outright: model catalogs change faster than this service.
     */
    boolean validateModel(String model);

    /**
     * Render the tool's configuration artifact.
     *
     * @throws AdapterException {@code VALIDATION} on a bad config shape or bounds,
     *                          {@code TEMPLATE} when the template is missing or broken
     */
    String generateConfig(AgentConfig config);

    /**
     * Render the tool's memory / instructions file.
     *
     * @throws AdapterException same kinds as {@link #generateConfig}
     */
    String generateMemory(AgentConfig config);

    /** Wrap a raw instruction in the tool's prompt envelope. Pure. */
    String formatPrompt(String prompt);

    /**
     * Normalize one turn of raw tool output.
     *
     * Tolerates zero, one or many tool calls and missing metadata.
     */
    ParsedResponse parseResponse(String response);

    CapabilityDescriptor capabilities();

    String memoryFilename();

    String executableName();

    /** @throws AdapterException {@code INITIALIZATION} on an incomplete context */
    void initialize(ContainerContext container);

    void cleanup(ContainerContext container);

    /** Self-test with synthetic inputs. Never throws; failures are reported in the status. */
    HealthStatus healthCheck();
}
