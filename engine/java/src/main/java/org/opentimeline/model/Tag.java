package org.opentimeline.model;

/**
 * A name/value annotation on an entity or timeline.
 *
 * <p>The name may be {@code null} for an anonymous value tag such as {@code "king"}.
 * Tag sets are multisets: the same name may carry several values.
 */
public record Tag(String name, String value) {

    public Tag {
        if (value == null) {
            throw new IllegalArgumentException("Tag value is required");
        }
    }

    public static Tag of(String name, String value) {
        return new Tag(name, value);
    }

    public static Tag anonymous(String value) {
        return new Tag(null, value);
    }

    public boolean isAnonymous() {
        return name == null;
    }

    /** {@code name=value}, or just the value for anonymous tags. */
    @Override
    public String toString() {
        return isAnonymous() ? value : name + "=" + value;
    }
}
