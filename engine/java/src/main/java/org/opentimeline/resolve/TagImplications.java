package org.opentimeline.resolve;

import org.opentimeline.model.Tag;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Automatic tags: if a tag set contains {@code when}, it also gets {@code then}.
 *
 * <p>Rules are applied repeatedly until nothing changes, so chains such as
 * {@code king -> monarch -> person} resolve fully. Existing tags are never removed and
 * an implied tag is added once even if several rules produce it.
 */
public record TagImplications(List<Rule> rules) {

    public record Rule(Tag when, Tag then) {
        public Rule {
            if (when == null || then == null) {
                throw new IllegalArgumentException("Tag implication needs both 'when' and 'then'");
            }
        }
    }

    public static final TagImplications NONE = new TagImplications(List.of());

    public TagImplications {
        rules = rules != null ? List.copyOf(rules) : List.of();
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    public List<Tag> apply(List<Tag> tags) {
        if (isEmpty()) return tags;
        List<Tag> result = new ArrayList<>(tags);
        Set<Tag> present = new HashSet<>(tags);
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Rule rule : rules) {
                if (present.contains(rule.when()) && present.add(rule.then())) {
                    result.add(rule.then());
                    changed = true;
                }
            }
        }
        return result;
    }
}
