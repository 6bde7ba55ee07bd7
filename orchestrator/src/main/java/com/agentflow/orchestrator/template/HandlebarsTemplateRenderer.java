package com.agentflow.orchestrator.template;

import com.agentflow.orchestrator.adapter.AdapterException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.jknack.handlebars.EscapingStrategy;
import com.github.jknack.handlebars.Handlebars;
import com.github.jknack.handlebars.HandlebarsException;
import com.github.jknack.handlebars.Helper;
import com.github.jknack.handlebars.Options;
import com.github.jknack.handlebars.Template;
import com.github.jknack.handlebars.cache.ConcurrentMapTemplateCache;
import com.github.jknack.handlebars.io.ClassPathTemplateLoader;
import com.github.jknack.handlebars.io.FileTemplateLoader;
import com.github.jknack.handlebars.io.TemplateLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;

/**
 * Handlebars-backed {@link TemplateRenderer}.
 *
 * The root is either {@code classpath:/some/dir} (templates packaged with the
 * service) or a filesystem directory mounted by the deployment, typically set
 * through {@code CLI_TEMPLATES_ROOT}.
 *
 * <p>HTML escaping is disabled: templates produce JSON, TOML and Markdown.
 * Values that must be quoted go through the {@code json} helper, e.g.
 * <pre>
 *   "model": {{{json model}}}
 * </pre>
 * which writes a correctly escaped JSON literal (also a valid TOML basic string).
 */
@Component
public class HandlebarsTemplateRenderer implements TemplateRenderer {

    private static final Logger log = LoggerFactory.getLogger(HandlebarsTemplateRenderer.class);

    private static final String CLASSPATH_PREFIX = "classpath:";

    private final Handlebars handlebars;
    private final String     root;

    public HandlebarsTemplateRenderer(
            @Value("${agentflow.templates.root:classpath:/templates}") String root,
            ObjectMapper objectMapper) {
        this.root = root;
        this.handlebars = new Handlebars(loaderFor(root))
                .with(EscapingStrategy.NOOP)
                .with(new ConcurrentMapTemplateCache());
        this.handlebars.registerHelper("json", jsonHelper(objectMapper));
        log.info("Template root: {}", root);
    }

    @Override
    public String render(String templatePath, Map<String, Object> context) {
        Template template;
        try {
            template = handlebars.compile(templatePath);
        } catch (IOException | HandlebarsException e) {
            throw new AdapterException(AdapterException.Kind.TEMPLATE,
                    "Failed to load template " + templatePath + " from " + root + ": " + e.getMessage(), e);
        }
        return apply(template, templatePath, context);
    }

    @Override
    public String renderInline(String source, Map<String, Object> context) {
        Template template;
        try {
            template = handlebars.compileInline(source);
        } catch (IOException | HandlebarsException e) {
            throw new AdapterException(AdapterException.Kind.TEMPLATE,
                    "Failed to compile inline template: " + e.getMessage(), e);
        }
        return apply(template, "<inline>", context);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static String apply(Template template, String name, Map<String, Object> context) {
        try {
            return template.apply(context);
        } catch (IOException | HandlebarsException e) {
            throw new AdapterException(AdapterException.Kind.TEMPLATE,
                    "Failed to render template " + name + ": " + e.getMessage(), e);
        }
    }

    private static TemplateLoader loaderFor(String root) {
        if (root.startsWith(CLASSPATH_PREFIX)) {
            return new ClassPathTemplateLoader(root.substring(CLASSPATH_PREFIX.length()), "");
        }
        return new FileTemplateLoader(root, "");
    }

    private static Helper<Object> jsonHelper(ObjectMapper objectMapper) {
        return (Object value, Options options) ->
                new Handlebars.SafeString(objectMapper.writeValueAsString(value));
    }
}
