package com.agentflow.orchestrator.template;

/**
 * Template locations for one adapter, relative to the template root.
 *
 * Supplied to each adapter at construction from configuration, so the
 * tool-to-template mapping is data rather than string literals in code.
 *
 * @param config Config artifact template, e.g. {@code code/claude/config.json.hbs}.
 * @param memory Memory / instructions template, e.g. {@code code/claude/memory.md.hbs}.
 */
public record TemplatePaths(String config, String memory) {}
