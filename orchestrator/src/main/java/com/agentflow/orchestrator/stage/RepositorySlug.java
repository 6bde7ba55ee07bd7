package com.agentflow.orchestrator.stage;

import java.util.Locale;

/**
 * Normalized repository identifiers.
 *
 * The slug depends only on the repository's canonical name, never on run
 * or task ids, so every run for the same repository finds the same record:
 * <pre>
 *   "https://github.com/5dlabs/cto.git" -> "5dlabs-cto"
 *   "5dlabs/cto"                       -> "5dlabs-cto"
 * </pre>
 */
public final class RepositorySlug {

    static final String KEY_PREFIX = "pipeline-progress-";

    private RepositorySlug() {}

    public static String of(String repository) {
        if (repository == null || repository.isBlank()) {
            throw new IllegalArgumentException("Repository cannot be empty");
        }
        String name = repository.trim().toLowerCase(Locale.ROOT);
        name = name.replaceFirst("^[a-z][a-z0-9+.-]*://", "");   // scheme
        name = name.replaceFirst("^git@", "");
        name = name.replaceFirst("^[^/:]+\\.[a-z]{2,}[/:]", "");   // host, e.g. github.com/
        name = name.replaceFirst("\\.git$", "");
        String slug = name.replaceAll("[^a-z0-9]+", "-").replaceAll("^-+|-+$", "");
        if (slug.isEmpty()) {
            throw new IllegalArgumentException("Repository has no usable name: '" + repository + "'");
        }
        return slug;
    }

    public static String progressKey(String repository) {
        return KEY_PREFIX + of(repository);
    }
}
