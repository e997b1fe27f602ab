package com.entity.reconciliation.api;

/**
 * View URL templates. Sources may write the id placeholder as {@code {{id}}},
 * {@code ${id}} or {@code %s}; the manifest always advertises {@code {{id}}}.
 */
public final class UrlTemplate {

    public static final String PLACEHOLDER = "{{id}}";

    private UrlTemplate() {
        // utility class
    }

    /**
     * Rewrites any supported placeholder to {@value #PLACEHOLDER}.
     *
     * @return the normalized template, empty when it has no placeholder
     */
    public static String normalize(String template) {
        if (template == null || template.isEmpty()) {
            return "";
        }
        if (template.contains(PLACEHOLDER)) {
            return template;
        }
        if (template.contains("${id}")) {
            return template.replace("${id}", PLACEHOLDER);
        }
        if (template.contains("%s")) {
            return template.replace("%s", PLACEHOLDER);
        }
        return "";
    }

    /**
     * Substitutes an entity id into a template.
     */
    public static String apply(String template, String id) {
        return normalize(template).replace(PLACEHOLDER, id);
    }
}
