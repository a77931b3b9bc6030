package org.opentimeline.resolve;

import org.opentimeline.model.Entity;
import org.opentimeline.model.PartialDate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * The number of stored tags on each entity.
 *
 * @param counts One entry per entity, in store order.
 */
public record EntityTagCounts(List<EntityTagCount> counts) {

    public record EntityTagCount(Entity entity, int tagCount) {}

    private static final Comparator<EntityTagCount> BY_NAME = Comparator.comparing(c -> c.entity().name());

    public EntityTagCounts {
        counts = List.copyOf(counts);
    }

    public List<EntityTagCount> sortedByName(boolean ascending) {
        return sorted(ascending ? BY_NAME : BY_NAME.reversed());
    }

    public List<EntityTagCount> sortedByStart(boolean ascending) {
        Comparator<EntityTagCount> byStart = Comparator.comparing(c -> c.entity().start());
        return sorted((ascending ? byStart : byStart.reversed()).thenComparing(BY_NAME));
    }

    /** Entities without an end sort last in either direction. */
    public List<EntityTagCount> sortedByEnd(boolean ascending) {
        Comparator<PartialDate> order = ascending ? Comparator.naturalOrder() : Comparator.reverseOrder();
        Comparator<EntityTagCount> byEnd = Comparator.comparing(c -> c.entity().end(), Comparator.nullsLast(order));
        return sorted(byEnd.thenComparing(BY_NAME));
    }

    public List<EntityTagCount> sortedByTagCount(boolean descending) {
        Comparator<EntityTagCount> byCount = Comparator.comparingInt(EntityTagCount::tagCount);
        if (descending) byCount = byCount.reversed();
        return sorted(byCount.thenComparing(BY_NAME));
    }

    private List<EntityTagCount> sorted(Comparator<EntityTagCount> order) {
        List<EntityTagCount> copy = new ArrayList<>(counts);
        copy.sort(order);
        return List.copyOf(copy);
    }
}
