package com.agentflow.orchestrator.template;

import com.agentflow.orchestrator.adapter.AdapterException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HandlebarsTemplateRendererTest {

    private final ObjectMapper json = new ObjectMapper();

    @Test
    void renderInline_substitutesContext() {
        TemplateRenderer renderer = new HandlebarsTemplateRenderer("classpath:/templates", json);

        assertThat(renderer.renderInline("test: {{cliType}}", Map.of("cliType", "codex"))).isEqualTo("test: codex");
    }

    @Test
    void renderInline_noHtmlEscaping() {
        TemplateRenderer renderer = new HandlebarsTemplateRenderer("classpath:/templates", json);

        assertThat(renderer.renderInline("{{v}}", Map.of("v", "a < b & \"c\""))).isEqualTo("a < b & \"c\"");
    }

    @Test
    void jsonHelper_writesEscapedLiterals() {
        TemplateRenderer renderer = new HandlebarsTemplateRenderer("classpath:/templates", json);

        String out = renderer.renderInline("{{{json s}}} {{{json xs}}}",
                Map.of("s", "say \"hi\"\n", "xs", List.of("a", "b")));

        assertThat(out).isEqualTo("\"say \\\"hi\\\"\\n\" [\"a\",\"b\"]");
    }

    @Test
    void render_missingTemplate_templateError() {
        TemplateRenderer renderer = new HandlebarsTemplateRenderer("classpath:/templates", json);

        assertThatThrownBy(() -> renderer.render("code/nope/missing.hbs", Map.of()))
                .isInstanceOf(AdapterException.class)
                .hasMessageContaining("Failed to load template code/nope/missing.hbs")
                .extracting(e -> ((AdapterException) e).getKind())
                .isEqualTo(AdapterException.Kind.TEMPLATE);
    }

    @Test
    void render_filesystemRoot_loadsMountedTemplates(@TempDir Path root) throws Exception {
        Files.createDirectories(root.resolve("code/custom"));
        Files.writeString(root.resolve("code/custom/config.hbs"), "model={{model}}");
        TemplateRenderer renderer = new HandlebarsTemplateRenderer(root.toString(), json);

        assertThat(renderer.render("code/custom/config.hbs", Map.of("model", "m1"))).isEqualTo("model=m1");
    }
}
