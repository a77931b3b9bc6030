package org.opentimeline.expr;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Memoises {@link ExpressionParser#parse(String)} by expression text.
 *
 * <p>Parsing is pure, so entries never expire. Malformed expressions are not cached
 * and fail again on every lookup.
 */
public final class ExpressionCache {

    private static final Logger logger = LoggerFactory.getLogger(ExpressionCache.class);

    private final Map<String, Predicate> compiled = new ConcurrentHashMap<>();

    public Predicate get(String expression) {
        Predicate cached = compiled.get(expression);
        if (cached != null) {
            return cached;
        }
        Predicate predicate = ExpressionParser.parse(expression);
        compiled.putIfAbsent(expression, predicate);
        logger.debug("Compiled expression: {}", predicate.toExpression());
        return predicate;
    }

    public int size() {
        return compiled.size();
    }

    public void clear() {
        compiled.clear();
    }
}
