package org.opentimeline.expr;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Compiles boolean tag expressions into {@link Predicate} trees.
 *
 * <pre>
 * expression := or
 * or         := and ( OR and )*
 * and        := unary ( AND unary )*
 * unary      := NOT unary | primary
 * primary    := '(' or ')' | STRING | IDENT '=' STRING | IDENT '!=' STRING
 *             | IDENT EXISTS | IDENT NOT EXISTS
 * </pre>
 *
 * Keywords are case-insensitive; tag names are case-sensitive. Strings are double-quoted
 * and accept {@code \" \\ \n \r \t \\uXXXX} escapes.
 */
public final class ExpressionParser {

    /** Deepest predicate tree accepted; compiled predicates are evaluated recursively. */
    public static final int MAX_DEPTH = 1000;

    private enum Kind { LPAREN, RPAREN, IDENT, STRING, EQ, NEQ, AND, OR, NOT, EXISTS, END }

    private record Token(Kind kind, String text, int position) {}

    private final List<Token> tokens;
    private int index;
    private int nesting;

    private ExpressionParser(String source) {
        this.tokens = tokenize(source);
    }

    /**
     * Parses a non-empty expression.
     *
     * @throws ExpressionParseException if the expression is empty or malformed
     */
    public static Predicate parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ExpressionParseException(0, "expression is empty");
        }
        ExpressionParser parser = new ExpressionParser(expression);
        Predicate predicate = parser.parseOr();
        if (depth(predicate) > MAX_DEPTH) {
            throw new ExpressionParseException(0, "expression nested too deeply");
        }
        Token trailing = parser.peek();
        if (trailing.kind() == Kind.RPAREN) {
            throw new ExpressionParseException(trailing.position(), "unbalanced ')'");
        }
        if (trailing.kind() != Kind.END) {
            throw new ExpressionParseException(trailing.position(),
                    "unexpected " + describe(trailing) + " after complete expression");
        }
        return predicate;
    }

    /**
     * Parses an optional expression. {@code null} or blank input means the timeline
     * selects nothing by expression, which is not an error.
     */
    public static Optional<Predicate> parseOptional(String expression) {
        if (expression == null || expression.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(parse(expression));
    }

    // ── Recursive descent ─────────────────────────────────────────────────────────

    private Predicate parseOr() {
        Predicate left = parseAnd();
        while (peek().kind() == Kind.OR) {
            next();
            left = new Predicate.Or(left, parseAnd());
        }
        return left;
    }

    private Predicate parseAnd() {
        Predicate left = parseUnary();
        while (peek().kind() == Kind.AND) {
            next();
            left = new Predicate.And(left, parseUnary());
        }
        return left;
    }

    private Predicate parseUnary() {
        if (peek().kind() == Kind.NOT) {
            enter(next());
            Predicate operand = parseUnary();
            nesting--;
            return new Predicate.Not(operand);
        }
        return parsePrimary();
    }

    private void enter(Token token) {
        if (++nesting > MAX_DEPTH) {
            throw new ExpressionParseException(token.position(), "expression nested too deeply");
        }
    }

    private Predicate parsePrimary() {
        Token token = next();
        switch (token.kind()) {
            case LPAREN -> {
                enter(token);
                Predicate inner = parseOr();
                nesting--;
                Token close = next();
                if (close.kind() != Kind.RPAREN) {
                    throw new ExpressionParseException(close.position(),
                            "expected ')' to close '(' at position " + token.position()
                                    + ", found " + describe(close));
                }
                return inner;
            }
            case STRING -> {
                return new Predicate.AnonymousValue(token.text());
            }
            case IDENT -> {
                return parseLeaf(token.text());
            }
            default -> throw new ExpressionParseException(token.position(),
                    "expected a tag name, quoted value, '(' or NOT, found " + describe(token));
        }
    }

    private Predicate parseLeaf(String name) {
        Token op = next();
        return switch (op.kind()) {
            case EQ -> new Predicate.Equals(name, expectString(op));
            case NEQ -> new Predicate.NotEquals(name, expectString(op));
            case EXISTS -> new Predicate.Exists(name);
            case NOT -> {
                Token exists = next();
                if (exists.kind() != Kind.EXISTS) {
                    throw new ExpressionParseException(exists.position(),
                            "expected 'exists' after '" + name + " not', found " + describe(exists));
                }
                yield new Predicate.NotExists(name);
            }
            default -> throw new ExpressionParseException(op.position(),
                    "expected '=', '!=', 'exists' or 'not exists' after tag name '" + name
                            + "', found " + describe(op));
        };
    }

    /** Tree depth, counted with an explicit stack. */
    private static int depth(Predicate root) {
        record Level(Predicate node, int depth) {}
        Deque<Level> pending = new ArrayDeque<>();
        pending.push(new Level(root, 1));
        int max = 0;
        while (!pending.isEmpty()) {
            Level level = pending.pop();
            max = Math.max(max, level.depth());
            if (level.depth() > MAX_DEPTH) break;
            Predicate node = level.node();
            if (node instanceof Predicate.And and) {
                pending.push(new Level(and.left(), level.depth() + 1));
                pending.push(new Level(and.right(), level.depth() + 1));
            } else if (node instanceof Predicate.Or or) {
                pending.push(new Level(or.left(), level.depth() + 1));
                pending.push(new Level(or.right(), level.depth() + 1));
            } else if (node instanceof Predicate.Not not) {
                pending.push(new Level(not.operand(), level.depth() + 1));
            }
        }
        return max;
    }

    private String expectString(Token operator) {
        Token value = next();
        if (value.kind() != Kind.STRING) {
            throw new ExpressionParseException(value.position(),
                    "expected a quoted value after '" + operator.text() + "', found " + describe(value));
        }
        return value.text();
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token next() {
        Token token = tokens.get(index);
        if (token.kind() != Kind.END) index++;
        return token;
    }

    private static String describe(Token token) {
        return switch (token.kind()) {
            case END -> "end of expression";
            case STRING -> "quoted value";
            default -> "'" + token.text() + "'";
        };
    }

    // ── Tokenizer ─────────────────────────────────────────────────────────────────

    private static List<Token> tokenize(String src) {
        List<Token> out = new ArrayList<>();
        int i = 0;
        while (i < src.length()) {
            char c = src.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '(') {
                out.add(new Token(Kind.LPAREN, "(", i++));
            } else if (c == ')') {
                out.add(new Token(Kind.RPAREN, ")", i++));
            } else if (c == '"') {
                i = readString(src, i, out);
            } else if (c == '=' && !startsWith(src, i, "==")) {
                out.add(new Token(Kind.EQ, "=", i++));
            } else if (startsWith(src, i, "!=") && !startsWith(src, i, "!==")) {
                out.add(new Token(Kind.NEQ, "!=", i));
                i += 2;
            } else if (isIdentStart(c)) {
                int start = i;
                while (i < src.length() && isIdentPart(src.charAt(i))) i++;
                String word = src.substring(start, i);
                out.add(new Token(keyword(word), word, start));
            } else {
                int start = i;
                while (i < src.length() && isOperatorChar(src.charAt(i))) i++;
                if (i == start) i++;
                throw new ExpressionParseException(start,
                        "unknown operator '" + src.substring(start, i) + "'");
            }
        }
        out.add(new Token(Kind.END, "", src.length()));
        return out;
    }

    private static int readString(String src, int open, List<Token> out) {
        StringBuilder value = new StringBuilder();
        int i = open + 1;
        while (i < src.length()) {
            char c = src.charAt(i);
            if (c == '"') {
                out.add(new Token(Kind.STRING, value.toString(), open));
                return i + 1;
            }
            if (c == '\\') {
                if (i + 1 >= src.length()) break;
                char e = src.charAt(i + 1);
                switch (e) {
                    case '"' -> value.append('"');
                    case '\\' -> value.append('\\');
                    case 'n' -> value.append('\n');
                    case 'r' -> value.append('\r');
                    case 't' -> value.append('\t');
                    case 'u' -> {
                        if (i + 6 > src.length()) {
                            throw new ExpressionParseException(i, "incomplete unicode escape");
                        }
                        int code = 0;
                        for (int k = i + 2; k < i + 6; k++) {
                            char h = src.charAt(k);
                            int digit = h < 128 ? Character.digit(h, 16) : -1;
                            if (digit < 0) {
                                throw new ExpressionParseException(i, "invalid unicode escape '"
                                        + src.substring(i, i + 6) + "'");
                            }
                            code = code * 16 + digit;
                        }
                        value.append((char) code);
                        i += 4;
                    }
                    default -> throw new ExpressionParseException(i, "unknown escape '\\" + e + "'");
                }
                i += 2;
            } else {
                value.append(c);
                i++;
            }
        }
        throw new ExpressionParseException(open, "unterminated string");
    }

    private static Kind keyword(String word) {
        return switch (word.toLowerCase(Locale.ROOT)) {
            case "and" -> Kind.AND;
            case "or" -> Kind.OR;
            case "not" -> Kind.NOT;
            case "exists" -> Kind.EXISTS;
            default -> Kind.IDENT;
        };
    }

    private static boolean startsWith(String src, int at, String prefix) {
        return src.startsWith(prefix, at);
    }

    private static boolean isIdentStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' || c == ':';
    }

    private static boolean isOperatorChar(char c) {
        return "=!<>~&|^*+/%".indexOf(c) >= 0;
    }
}
