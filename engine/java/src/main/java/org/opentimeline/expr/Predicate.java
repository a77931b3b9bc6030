package org.opentimeline.expr;

/**
 * A compiled boolean tag expression.
 *
 * <p>Absence of a tag is never a third truth value: each leaf answers {@code true} or
 * {@code false} for any tag set. {@link NotEquals} in particular is {@code false} when
 * the entity carries no tag of that name at all.
 */
public sealed interface Predicate
        permits Predicate.And, Predicate.Or, Predicate.Not,
                Predicate.Equals, Predicate.NotEquals, Predicate.Exists, Predicate.NotExists,
                Predicate.AnonymousValue {

    boolean matches(TagIndex tags);

    /** Canonical form; parsing it yields an equal predicate. */
    String toExpression();

    record And(Predicate left, Predicate right) implements Predicate {
        @Override public boolean matches(TagIndex tags) {
            return left.matches(tags) && right.matches(tags);
        }

        @Override public String toExpression() {
            boolean groupRight = right instanceof Or || right instanceof And;
            return group(left, left instanceof Or) + " AND " + group(right, groupRight);
        }
    }

    record Or(Predicate left, Predicate right) implements Predicate {
        @Override public boolean matches(TagIndex tags) {
            return left.matches(tags) || right.matches(tags);
        }

        @Override public String toExpression() {
            return left.toExpression() + " OR " + group(right, right instanceof Or);
        }
    }

    record Not(Predicate operand) implements Predicate {
        @Override public boolean matches(TagIndex tags) {
            return !operand.matches(tags);
        }

        @Override public String toExpression() {
            return "NOT " + group(operand, operand instanceof And || operand instanceof Or);
        }
    }

    /** {@code name = "value"}: some tag with this name has exactly this value. */
    record Equals(String name, String value) implements Predicate {
        @Override public boolean matches(TagIndex tags) {
            return tags.hasValue(name, value);
        }

        @Override public String toExpression() {
            return name + " = " + quote(value);
        }
    }

    /** {@code name != "value"}: the tag is present, and none of its values is this one. */
    record NotEquals(String name, String value) implements Predicate {
        @Override public boolean matches(TagIndex tags) {
            return tags.hasName(name) && !tags.hasValue(name, value);
        }

        @Override public String toExpression() {
            return name + " != " + quote(value);
        }
    }

    record Exists(String name) implements Predicate {
        @Override public boolean matches(TagIndex tags) {
            return tags.hasName(name);
        }

        @Override public String toExpression() {
            return name + " exists";
        }
    }

    record NotExists(String name) implements Predicate {
        @Override public boolean matches(TagIndex tags) {
            return !tags.hasName(name);
        }

        @Override public String toExpression() {
            return name + " not exists";
        }
    }

    /** A bare {@code "value"}: an anonymous tag with this value is present. */
    record AnonymousValue(String value) implements Predicate {
        @Override public boolean matches(TagIndex tags) {
            return tags.hasAnonymousValue(value);
        }

        @Override public String toExpression() {
            return quote(value);
        }
    }

    private static String group(Predicate p, boolean parenthesise) {
        return parenthesise ? "(" + p.toExpression() + ")" : p.toExpression();
    }

    private static String quote(String s) {
        StringBuilder sb = new StringBuilder("\"");
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }
}
