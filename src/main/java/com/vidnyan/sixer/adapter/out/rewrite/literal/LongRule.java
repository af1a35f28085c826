package com.vidnyan.sixer.adapter.out.rewrite.literal;

import com.vidnyan.sixer.adapter.out.rewrite.AbstractRewriteRule;
import com.vidnyan.sixer.domain.rule.Diagnostic;
import com.vidnyan.sixer.domain.rule.RewriteContext;
import com.vidnyan.sixer.domain.rule.RewriteResult;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Drops the long suffix of integer literals: {@code 123L} becomes {@code 123}, {@code 0x1fL}
 * becomes {@code 0x1f}. {@code (int, long)} becomes {@code six.integer_types}.
 *
 * <p>Octal-looking literals such as {@code 0123L} are left alone and reported.
 */
public class LongRule extends AbstractRewriteRule {

    private static final Pattern LONG_LITERAL = Pattern.compile("\\b(0[xX][0-9a-fA-F]+|[1-9][0-9]*|0)[lL](?!\\w)");

    private static final Pattern ANY_LONG_LITERAL = Pattern.compile("\\b(?:0[xX][0-9a-fA-F]+|[0-9]+)[lL]\\b");

    private static final Pattern INTEGER_TYPES = Pattern.compile("\\(\\s*(?:int,\\s*long|long,\\s*int)\\s*\\)");

    public LongRule() {
        super("long", "replace 123L with 123 and (int, long) with six.integer_types");
    }

    @Override
    public boolean detect(String content) {
        return ANY_LONG_LITERAL.matcher(content).find() || INTEGER_TYPES.matcher(content).find();
    }

    @Override
    public RewriteResult apply(RewriteContext context) {
        String content = replaceAll(LONG_LITERAL, context.content(), matcher -> matcher.group(1));
        String types = replaceAll(INTEGER_TYPES, content, matcher -> "six.integer_types");
        if (types.equals(content)) {
            return RewriteResult.withoutImports(content);
        }
        return RewriteResult.of(types, List.of("import six"));
    }

    @Override
    public List<Diagnostic> check(RewriteContext context) {
        return reportLines(context, ANY_LONG_LITERAL, INTEGER_TYPES);
    }
}
