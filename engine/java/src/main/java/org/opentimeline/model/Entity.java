package org.opentimeline.model;

/**
 * A person, event or period placed on timelines.
 *
 * <p>The end date is optional. When present it must not fall before the start date
 * at the precision both dates share.
 */
public record Entity(
        String id,
        String name,
        PartialDate start,
        PartialDate end
) {
    public Entity {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Entity id is required");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Entity '" + id + "': name is required");
        }
        if (start == null) {
            throw new IllegalArgumentException("Entity '" + id + "': start date is required");
        }
        if (end != null && end.compareAtSharedPrecision(start) < 0) {
            throw new IllegalArgumentException(
                    "Entity '" + id + "': end " + end + " is before start " + start);
        }
        name = name.trim();
    }

    public Entity(String id, String name, PartialDate start) {
        this(id, name, start, null);
    }

    /** {@code 28 Jun 1914}, or {@code 1865 to 1936} when the end is known. */
    public String span() {
        String from = start.toLongFormat();
        return end == null ? from : from + " to " + end.toLongFormat();
    }

    /** {@code 28 / 6 / 1914}, with the end appended the same way as {@link #span()}. */
    public String shortSpan() {
        String from = start.toShortFormat();
        return end == null ? from : from + " to " + end.toShortFormat();
    }
}
