package com.agentflow.orchestrator.adapter;

import java.util.Set;

/**
 * Static facts about one agent tool, fixed when the adapter is constructed.
 *
 * @param streaming        Tool can stream partial output.
 * @param multimodal       Tool accepts non-text input.
 * @param functionCalling  Tool emits structured tool calls.
 * @param systemPrompts    Tool honours a separate system prompt.
 * @param maxContextTokens Context window; the registry rejects 0.
 * @param memoryFile       File the tool reads as persistent instructions (e.g. CLAUDE.md).
 * @param configFormat     Format of the rendered config artifact.
 * @param authMethods      Authentication methods the tool supports.
 */
public record CapabilityDescriptor(
        boolean         streaming,
        boolean         multimodal,
        boolean         functionCalling,
        boolean         systemPrompts,
        int             maxContextTokens,
        String          memoryFile,
        ConfigFormat    configFormat,
        Set<AuthMethod> authMethods) {

    public CapabilityDescriptor {
        authMethods = authMethods == null ? Set.of() : Set.copyOf(authMethods);
    }

    public enum ConfigFormat { JSON, TOML, YAML, MARKDOWN }

    public enum AuthMethod { SESSION_TOKEN, API_KEY, OAUTH, NONE }
}
