package com.vidnyan.sixer.adapter.out.rewrite.dict;

import com.vidnyan.sixer.adapter.out.rewrite.AbstractRewriteRule;
import com.vidnyan.sixer.domain.grammar.ExpressionGrammar;
import com.vidnyan.sixer.domain.rule.Diagnostic;
import com.vidnyan.sixer.domain.rule.RewriteContext;
import com.vidnyan.sixer.domain.rule.RewriteResult;

import java.util.List;
import java.util.regex.Pattern;

/**
 * {@code data.has_key(key)} becomes {@code key in data}.
 *
 * <p>The key must be a chain or a quoted string. The membership test is put between
 * parenthesis unless it already stands alone, e.g. after {@code if} or before {@code :}.
 */
public class HasKeyRule extends AbstractRewriteRule {

    private static final String CALL = ".has_key(";

    private static final Pattern RESIDUAL = Pattern.compile("\\.has_key *\\(");

    private static final Pattern SAFE_PREFIX = Pattern.compile(
            ".*(?:^|[(\\[,:]|[^=!<>]=|\\b(?:if|elif|while|and|or|not|return|assert))\\s*$");

    private static final Pattern SAFE_SUFFIX = Pattern.compile(
            "^\\s*(?:$|[)\\],:#]|(?:and|or|if|else)\\b)");

    public HasKeyRule() {
        super("has_key", "replace dict.has_key(key) with key in dict", CALL);
    }

    @Override
    public RewriteResult apply(RewriteContext context) {
        String content = context.content();
        StringBuilder out = new StringBuilder(content.length());
        int copied = 0;
        int index = content.indexOf(CALL);
        while (index >= 0) {
            int start = ExpressionGrammar.chainStart(content, index);
            int argStart = index + CALL.length();
            int argEnd = argumentEnd(content, argStart);
            if (start != ExpressionGrammar.NO_MATCH && start >= copied
                    && argEnd != ExpressionGrammar.NO_MATCH
                    && argEnd < content.length() && content.charAt(argEnd) == ')') {
                int end = argEnd + 1;
                String test = content.substring(argStart, argEnd) + " in " + content.substring(start, index);
                if (!standsAlone(content, start, end)) {
                    test = "(" + test + ")";
                }
                out.append(content, copied, start).append(test);
                copied = end;
            }
            index = content.indexOf(CALL, index + CALL.length());
        }
        if (copied == 0) {
            return RewriteResult.withoutImports(content);
        }
        out.append(content, copied, content.length());
        return RewriteResult.withoutImports(out.toString());
    }

    @Override
    public List<Diagnostic> check(RewriteContext context) {
        return reportLines(context, RESIDUAL);
    }

    private static int argumentEnd(String content, int argStart) {
        if (argStart >= content.length()) {
            return ExpressionGrammar.NO_MATCH;
        }
        char first = content.charAt(argStart);
        if (first == '\'' || first == '"') {
            for (int pos = argStart + 1; pos < content.length(); pos++) {
                char c = content.charAt(pos);
                if (c == first) {
                    return pos + 1;
                }
                if (c == '\\' || c == '\n') {
                    return ExpressionGrammar.NO_MATCH;
                }
            }
            return ExpressionGrammar.NO_MATCH;
        }
        return ExpressionGrammar.chainEnd(content, argStart);
    }

    private static boolean standsAlone(String content, int start, int end) {
        int lineStart = content.lastIndexOf('\n', start - 1) + 1;
        int lineEnd = content.indexOf('\n', end);
        String before = content.substring(lineStart, start);
        String after = content.substring(end, lineEnd < 0 ? content.length() : lineEnd);
        return SAFE_PREFIX.matcher(before).matches() && SAFE_SUFFIX.matcher(after).find();
    }
}
