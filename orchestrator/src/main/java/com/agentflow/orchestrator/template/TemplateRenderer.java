package com.agentflow.orchestrator.template;

import java.util.Map;

/**
 * Template collaborator used by the adapter layer.
 *
 * Templates are addressed by a path relative to the configured root; the
 * root and the template content are supplied by packaging, not by adapters.
 * Implementations raise {@link com.agentflow.orchestrator.adapter.AdapterException}
 * of kind {@code TEMPLATE} for missing or malformed templates.
 */
public interface TemplateRenderer {

    String render(String templatePath, Map<String, Object> context);

    /** Render a template given as a string rather than a path. */
    String renderInline(String template, Map<String, Object> context);
}
