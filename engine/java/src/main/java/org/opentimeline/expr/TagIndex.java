package org.opentimeline.expr;

import org.opentimeline.model.Tag;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lookup view over one tag multiset, built once per entity and shared by every
 * predicate evaluated against it.
 */
public final class TagIndex {

    private static final TagIndex EMPTY = new TagIndex(Map.of(), Set.of());

    private final Map<String, Set<String>> valuesByName;
    private final Set<String> anonymousValues;

    private TagIndex(Map<String, Set<String>> valuesByName, Set<String> anonymousValues) {
        this.valuesByName = valuesByName;
        this.anonymousValues = anonymousValues;
    }

    public static TagIndex of(List<Tag> tags) {
        if (tags == null || tags.isEmpty()) return EMPTY;
        Map<String, Set<String>> byName = new HashMap<>();
        Set<String> anonymous = new HashSet<>();
        for (Tag tag : tags) {
            if (tag.isAnonymous()) {
                anonymous.add(tag.value());
            } else {
                byName.computeIfAbsent(tag.name(), n -> new HashSet<>()).add(tag.value());
            }
        }
        return new TagIndex(byName, anonymous);
    }

    public boolean hasName(String name) {
        return valuesByName.containsKey(name);
    }

    public boolean hasValue(String name, String value) {
        Set<String> values = valuesByName.get(name);
        return values != null && values.contains(value);
    }

    public boolean hasAnonymousValue(String value) {
        return anonymousValues.contains(value);
    }
}
