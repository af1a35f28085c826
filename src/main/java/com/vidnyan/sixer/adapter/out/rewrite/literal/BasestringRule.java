package com.vidnyan.sixer.adapter.out.rewrite.literal;

import com.vidnyan.sixer.adapter.out.rewrite.AbstractRewriteRule;
import com.vidnyan.sixer.domain.rule.Diagnostic;
import com.vidnyan.sixer.domain.rule.RewriteContext;
import com.vidnyan.sixer.domain.rule.RewriteResult;

import java.util.List;
import java.util.regex.Pattern;

/**
 * {@code basestring} becomes {@code six.string_types}, outside import lines and comments.
 */
public class BasestringRule extends AbstractRewriteRule {

    private static final Pattern BASESTRING = Pattern.compile("(?<![\\w.])basestring(?!\\w)");

    private static final Pattern RESIDUAL = Pattern.compile("\\bbasestring\\b");

    public BasestringRule() {
        super("basestring", "replace basestring with six.string_types", "basestring");
    }

    @Override
    public RewriteResult apply(RewriteContext context) {
        StringBuilder out = new StringBuilder(context.content().length() + 32);
        for (String line : CodeLines.split(context.content())) {
            if (CodeLines.isImport(line)) {
                out.append(line);
                continue;
            }
            String code = CodeLines.withoutComment(line);
            out.append(replaceAll(BASESTRING, code, matcher -> "six.string_types"))
                    .append(line, code.length(), line.length());
        }
        return RewriteResult.requiringWhenChanged(context.content(), out.toString(), "import six");
    }

    @Override
    public List<Diagnostic> check(RewriteContext context) {
        return reportLines(context, line -> RESIDUAL.matcher(CodeLines.withoutComment(line)).find());
    }
}
