package org.opentimeline.resolve;

import org.opentimeline.model.Entity;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Orders entities by start date, then name, then ID.
 *
 * <p>Start dates use {@link org.opentimeline.model.PartialDate#compareTo}, where an unknown
 * month or day sorts before any known one. The order is total and the sort stable.
 */
public final class ChronologicalSorter {

    public static final Comparator<Entity> ORDER = Comparator
            .comparing(Entity::start)
            .thenComparing(Entity::name)
            .thenComparing(Entity::id);

    private ChronologicalSorter() {}

    public static List<Entity> sort(Collection<Entity> entities) {
        List<Entity> sorted = new ArrayList<>(entities);
        sorted.sort(ORDER);
        return List.copyOf(sorted);
    }
}
