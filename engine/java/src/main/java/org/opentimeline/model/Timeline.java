package org.opentimeline.model;

/**
 * A curated view over entities. Which entities it shows is decided by its explicit
 * links, its boolean tag expression and its sub-timelines, none of which live here.
 *
 * <p>A blank expression is stored as {@code null}.
 */
public record Timeline(
        String id,
        String name,
        String expression
) {
    public Timeline {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Timeline id is required");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Timeline '" + id + "': name is required");
        }
        name = name.trim();
        if (expression != null && expression.isBlank()) {
            expression = null;
        }
    }

    public boolean hasExpression() {
        return expression != null;
    }
}
