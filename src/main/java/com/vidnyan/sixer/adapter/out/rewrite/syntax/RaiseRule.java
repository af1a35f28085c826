package com.vidnyan.sixer.adapter.out.rewrite.syntax;

import com.vidnyan.sixer.adapter.out.rewrite.AbstractRewriteRule;
import com.vidnyan.sixer.domain.grammar.ExpressionGrammar;
import com.vidnyan.sixer.domain.rule.Diagnostic;
import com.vidnyan.sixer.domain.rule.RewriteContext;
import com.vidnyan.sixer.domain.rule.RewriteResult;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites the Python 2 forms of {@code raise}:
 * <ul>
 *   <li>{@code raise E, value} becomes {@code raise E(value)}; the value must end the line</li>
 *   <li>{@code raise T, V, TB} becomes {@code six.reraise(T, V, TB)}</li>
 *   <li>{@code raise exc[0], exc[1], exc[2]} becomes {@code six.reraise(*exc)}</li>
 * </ul>
 */
public class RaiseRule extends AbstractRewriteRule {

    private static final Pattern RAISE = Pattern.compile("(?<![\\w.])raise[ \\t]+");

    private static final Pattern RESIDUAL = Pattern.compile(
            "(?<![\\w.])raise\\s+" + ExpressionGrammar.DOTTED_NAME + "(?:\\[[^\\]]*\\]|\\([^()]*\\))*\\s*,");

    private static final Pattern LINE_END = Pattern.compile("[ \\t]*(?:#.*)?(?:\\n|$)");

    public RaiseRule() {
        super("raise", "replace 'raise exc, msg' with 'raise exc(msg)' and 'raise a, b, c' with 'six.reraise(a, b, c)'",
                "raise");
    }

    @Override
    public RewriteResult apply(RewriteContext context) {
        String content = context.content();
        StringBuilder out = new StringBuilder(content.length() + 32);
        boolean reraise = false;
        int copied = 0;
        Matcher raise = RAISE.matcher(content);
        while (raise.find()) {
            if (raise.start() < copied) {
                continue;
            }
            int typeEnd = ExpressionGrammar.chainEnd(content, raise.end());
            int valueStart = afterComma(content, typeEnd);
            if (valueStart == ExpressionGrammar.NO_MATCH) {
                continue;
            }
            String type = content.substring(raise.end(), typeEnd);

            int valueEnd = ExpressionGrammar.chainEnd(content, valueStart);
            int tracebackStart = afterComma(content, valueEnd);
            if (tracebackStart != ExpressionGrammar.NO_MATCH) {
                int tracebackEnd = ExpressionGrammar.chainEnd(content, tracebackStart);
                if (!endsStatement(content, tracebackEnd)) {
                    continue;
                }
                out.append(content, copied, raise.start()).append(reraise(type,
                        content.substring(valueStart, valueEnd),
                        content.substring(tracebackStart, tracebackEnd)));
                copied = tracebackEnd;
                reraise = true;
                continue;
            }

            if (valueEnd == ExpressionGrammar.NO_MATCH) {
                valueEnd = quotedEnd(content, valueStart);
            }
            if (!endsStatement(content, valueEnd)) {
                continue;
            }
            out.append(content, copied, raise.start())
                    .append("raise ").append(type).append('(')
                    .append(content, valueStart, valueEnd).append(')');
            copied = valueEnd;
        }
        if (copied == 0) {
            return RewriteResult.withoutImports(content);
        }
        out.append(content, copied, content.length());
        return reraise
                ? RewriteResult.of(out.toString(), List.of("import six"))
                : RewriteResult.withoutImports(out.toString());
    }

    @Override
    public List<Diagnostic> check(RewriteContext context) {
        return reportLines(context, RESIDUAL);
    }

    private static String reraise(String type, String value, String traceback) {
        if (type.endsWith("[0]") && value.endsWith("[1]") && traceback.endsWith("[2]")) {
            String info = type.substring(0, type.length() - 3);
            if (value.startsWith(info + "[") && traceback.startsWith(info + "[")
                    && value.length() == type.length() && traceback.length() == type.length()) {
                return "six.reraise(*" + info + ")";
            }
        }
        return "six.reraise(" + type + ", " + value + ", " + traceback + ")";
    }

    // Offset after "<spaces>,<spaces>" at pos, or NO_MATCH.
    private static int afterComma(String content, int pos) {
        if (pos == ExpressionGrammar.NO_MATCH) {
            return ExpressionGrammar.NO_MATCH;
        }
        int cursor = skipBlanks(content, pos);
        if (cursor >= content.length() || content.charAt(cursor) != ',') {
            return ExpressionGrammar.NO_MATCH;
        }
        return skipBlanks(content, cursor + 1);
    }

    private static int skipBlanks(String content, int pos) {
        int cursor = pos;
        while (cursor < content.length() && (content.charAt(cursor) == ' ' || content.charAt(cursor) == '\t')) {
            cursor++;
        }
        return cursor;
    }

    private static int quotedEnd(String content, int start) {
        if (start >= content.length()) {
            return ExpressionGrammar.NO_MATCH;
        }
        char quote = content.charAt(start);
        if (quote != '\'' && quote != '"') {
            return ExpressionGrammar.NO_MATCH;
        }
        int close = start + 1;
        while (close < content.length() && content.charAt(close) != quote && content.charAt(close) != '\n') {
            close++;
        }
        if (close >= content.length() || content.charAt(close) != quote || close == start + 1) {
            return ExpressionGrammar.NO_MATCH;
        }
        return close + 1;
    }

    private static boolean endsStatement(String content, int pos) {
        if (pos == ExpressionGrammar.NO_MATCH) {
            return false;
        }
        return LINE_END.matcher(content).region(pos, content.length()).lookingAt();
    }
}
