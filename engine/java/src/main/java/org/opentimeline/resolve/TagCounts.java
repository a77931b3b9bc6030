package org.opentimeline.resolve;

import org.opentimeline.model.Tag;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * How often each distinct tag is stored, across all entities or all timelines.
 * Counts are of stored tags; implied tags are not included.
 *
 * @param counts One entry per distinct name/value pair, in first-seen order.
 */
public record TagCounts(List<TagCount> counts) {

    public record TagCount(Tag tag, int count) {}

    private static final Comparator<String> NULLS_FIRST = Comparator.nullsFirst(Comparator.naturalOrder());

    private static final Comparator<TagCount> BY_NAME =
            Comparator.comparing((TagCount c) -> c.tag().name(), NULLS_FIRST);
    private static final Comparator<TagCount> BY_VALUE =
            Comparator.comparing((TagCount c) -> c.tag().value());

    public TagCounts {
        counts = List.copyOf(counts);
    }

    /** Groups the given tag lists by name and value. */
    public static TagCounts of(Collection<List<Tag>> tagLists) {
        Map<Tag, Integer> grouped = new LinkedHashMap<>();
        for (List<Tag> tags : tagLists) {
            for (Tag tag : tags) {
                grouped.merge(tag, 1, Integer::sum);
            }
        }
        List<TagCount> counts = new ArrayList<>();
        grouped.forEach((tag, count) -> counts.add(new TagCount(tag, count)));
        return new TagCounts(counts);
    }

    public int size() {
        return counts.size();
    }

    public List<TagCount> sortedByCount(boolean descending) {
        Comparator<TagCount> byCount = Comparator.comparingInt(TagCount::count);
        if (descending) byCount = byCount.reversed();
        return sorted(byCount.thenComparing(BY_NAME).thenComparing(BY_VALUE));
    }

    /** Anonymous tags sort before named ones. */
    public List<TagCount> sortedByName(boolean ascending) {
        return sorted((ascending ? BY_NAME : BY_NAME.reversed()).thenComparing(BY_VALUE));
    }

    public List<TagCount> sortedByValue(boolean ascending) {
        return sorted((ascending ? BY_VALUE : BY_VALUE.reversed()).thenComparing(BY_NAME));
    }

    private List<TagCount> sorted(Comparator<TagCount> order) {
        List<TagCount> copy = new ArrayList<>(counts);
        copy.sort(order);
        return List.copyOf(copy);
    }
}
