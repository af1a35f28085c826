package com.vidnyan.sixer.domain.grammar;

/**
 * Small scanner for the Python expressions the rewrite rules need to capture.
 *
 * <p>Supported shapes:
 * <ul>
 *   <li>identifier: {@code var3}, {@code NameCamelCase}</li>
 *   <li>chain: {@code identifier(subscript|call)*} joined by {@code .attr}, e.g.
 *       {@code obj.attr[0].method()}; a subscript has non-empty content without {@code ]},
 *       a call has no nested parenthesis</li>
 *   <li>parenthesized: {@code (...)} with at most one level of nested parenthesis, e.g.
 *       {@code ((x * 2) for x in data)}</li>
 * </ul>
 *
 * <p>Nothing here crosses a line break. Anything deeper than one level of nesting
 * ({@code f(g(x)).next()}) is reported as "no match" so that a rule leaves the code alone.
 */
public final class ExpressionGrammar {

    /** Regex fragment for an identifier, for rules that match simple token shapes. */
    public static final String IDENTIFIER = "[a-zA-Z_][a-zA-Z0-9_]*";

    /** Regex fragment for a dotted name such as {@code select.error}. */
    public static final String DOTTED_NAME = IDENTIFIER + "(?:\\." + IDENTIFIER + ")*";

    public static final int NO_MATCH = -1;

    private ExpressionGrammar() {
    }

    public static boolean isIdentifierStart(char c) {
        return c == '_' || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    public static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || (c >= '0' && c <= '9');
    }

    /**
     * Start offset of the attribute chain that ends right before {@code end},
     * or {@link #NO_MATCH}.
     */
    public static int chainStart(CharSequence text, int end) {
        int pos = end;
        while (true) {
            pos = suffixesStart(text, pos);
            if (pos == NO_MATCH) {
                return NO_MATCH;
            }
            int idStart = pos;
            while (idStart > 0 && isIdentifierPart(text.charAt(idStart - 1))) {
                idStart--;
            }
            if (idStart == pos || !isIdentifierStart(text.charAt(idStart))) {
                return NO_MATCH;
            }
            pos = idStart;
            if (pos > 0 && text.charAt(pos - 1) == '.') {
                // the part before the dot must itself be a chain element
                pos--;
                continue;
            }
            return isCutOff(text, pos) ? NO_MATCH : pos;
        }
    }

    /**
     * Start offset of a parenthesized expression (one nesting level) that ends right
     * before {@code end}, or {@link #NO_MATCH}. A group directly preceded by a name is a
     * call with nested arguments and is not matched.
     */
    public static int parenthesizedStart(CharSequence text, int end) {
        if (end <= 0 || text.charAt(end - 1) != ')') {
            return NO_MATCH;
        }
        int depth = 0;
        int pos = end - 1;
        while (pos > 0) {
            pos--;
            char c = text.charAt(pos);
            if (c == '\n') {
                return NO_MATCH;
            }
            if (c == ')') {
                if (depth == 1) {
                    return NO_MATCH;
                }
                depth = 1;
            } else if (c == '(') {
                if (depth == 0) {
                    return isCutOff(text, pos) ? NO_MATCH : pos;
                }
                depth = 0;
            }
        }
        return NO_MATCH;
    }

    /**
     * Start offset of either a chain or a parenthesized expression ending before {@code end}.
     */
    public static int operandStart(CharSequence text, int end) {
        int start = chainStart(text, end);
        if (start != NO_MATCH) {
            return start;
        }
        return parenthesizedStart(text, end);
    }

    /**
     * End offset of the longest chain starting at {@code start}, or {@link #NO_MATCH}.
     */
    public static int chainEnd(CharSequence text, int start) {
        int pos = identifierEnd(text, start);
        if (pos == NO_MATCH) {
            return NO_MATCH;
        }
        while (true) {
            pos = suffixesEnd(text, pos);
            if (pos < text.length() - 1 && text.charAt(pos) == '.'
                    && isIdentifierStart(text.charAt(pos + 1))) {
                pos = identifierEnd(text, pos + 1);
                continue;
            }
            return pos;
        }
    }

    /**
     * End offset of the identifier starting at {@code start}, or {@link #NO_MATCH}.
     */
    public static int identifierEnd(CharSequence text, int start) {
        if (start >= text.length() || !isIdentifierStart(text.charAt(start))) {
            return NO_MATCH;
        }
        int pos = start + 1;
        while (pos < text.length() && isIdentifierPart(text.charAt(pos))) {
            pos++;
        }
        return pos;
    }

    // Walks back over trailing "(...)" and "[...]" suffixes.
    private static int suffixesStart(CharSequence text, int end) {
        int pos = end;
        while (pos > 0) {
            char c = text.charAt(pos - 1);
            if (c == ')') {
                pos = openingBefore(text, pos - 1, '(', true);
            } else if (c == ']') {
                pos = openingBefore(text, pos - 1, '[', false);
            } else {
                return pos;
            }
            if (pos == NO_MATCH) {
                return NO_MATCH;
            }
        }
        return pos;
    }

    private static int openingBefore(CharSequence text, int close, char open, boolean allowEmpty) {
        char closeChar = text.charAt(close);
        int pos = close;
        while (pos > 0) {
            pos--;
            char c = text.charAt(pos);
            if (c == open) {
                if (!allowEmpty && pos + 1 == close) {
                    return NO_MATCH;
                }
                return pos;
            }
            if (c == closeChar || c == '\n') {
                return NO_MATCH;
            }
        }
        return NO_MATCH;
    }

    private static int suffixesEnd(CharSequence text, int start) {
        int pos = start;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            int close;
            if (c == '(') {
                close = closingAfter(text, pos, ')', true);
            } else if (c == '[') {
                close = closingAfter(text, pos, ']', false);
            } else {
                return pos;
            }
            if (close == NO_MATCH) {
                return pos;
            }
            pos = close + 1;
        }
        return pos;
    }

    private static int closingAfter(CharSequence text, int open, char close, boolean allowEmpty) {
        for (int pos = open + 1; pos < text.length(); pos++) {
            char c = text.charAt(pos);
            if (c == close) {
                if (!allowEmpty && pos == open + 1) {
                    return NO_MATCH;
                }
                return pos;
            }
            if (c == '\n' || (close == ')' && c == '(')) {
                return NO_MATCH;
            }
        }
        return NO_MATCH;
    }

    // An operand glued to something we cannot see the start of (".x", "1x", "f(...)", "'s'.x").
    private static boolean isCutOff(CharSequence text, int start) {
        if (start == 0) {
            return false;
        }
        char before = text.charAt(start - 1);
        return isIdentifierPart(before) || before == '.' || before == ')' || before == ']'
                || before == '\'' || before == '"';
    }
}
