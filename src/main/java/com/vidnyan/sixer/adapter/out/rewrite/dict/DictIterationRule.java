package com.vidnyan.sixer.adapter.out.rewrite.dict;

import com.vidnyan.sixer.adapter.out.rewrite.AbstractRewriteRule;
import com.vidnyan.sixer.domain.grammar.ReceiverCallRewriter;
import com.vidnyan.sixer.domain.grammar.ReceiverCallRewriter.Operand;
import com.vidnyan.sixer.domain.rule.Diagnostic;
import com.vidnyan.sixer.domain.rule.RewriteContext;
import com.vidnyan.sixer.domain.rule.RewriteResult;

import java.util.List;
import java.util.regex.Pattern;

/**
 * {@code data.iteritems()} becomes {@code six.iteritems(data)}, same for {@code itervalues}.
 */
public class DictIterationRule extends AbstractRewriteRule {

    static final String IMPORT_SIX = "import six";

    private final String method;
    private final Pattern residual;

    protected DictIterationRule(String method) {
        super(method, "replace dict." + method + "() with six." + method + "(dict)", "." + method + "(");
        this.method = method;
        this.residual = Pattern.compile("\\b" + method + " *\\(");
    }

    public static DictIterationRule iteritems() {
        return new DictIterationRule("iteritems");
    }

    public static DictIterationRule itervalues() {
        return new DictIterationRule("itervalues");
    }

    @Override
    public RewriteResult apply(RewriteContext context) {
        String content = context.content();
        ReceiverCallRewriter.Result result = ReceiverCallRewriter.rewrite(content, callSuffix(), Operand.CHAIN,
                occurrence -> "six." + method + "(" + occurrence.operand() + ")");
        return RewriteResult.requiringWhenChanged(content, result.content(), IMPORT_SIX);
    }

    @Override
    public List<Diagnostic> check(RewriteContext context) {
        String sixCall = "six." + method;
        return reportLines(context, line -> residual.matcher(line).find() && !line.contains(sixCall));
    }

    protected String callSuffix() {
        return "." + method + "()";
    }
}
