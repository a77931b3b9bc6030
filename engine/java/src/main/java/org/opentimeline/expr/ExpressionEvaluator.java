package org.opentimeline.expr;

import org.opentimeline.model.Tag;

import java.util.List;

/**
 * Evaluates compiled expressions against tag multisets. Stateless.
 */
public final class ExpressionEvaluator {

    private ExpressionEvaluator() {}

    public static boolean evaluate(Predicate predicate, List<Tag> tags) {
        return evaluate(predicate, TagIndex.of(tags));
    }

    public static boolean evaluate(Predicate predicate, TagIndex tags) {
        return predicate.matches(tags);
    }
}
