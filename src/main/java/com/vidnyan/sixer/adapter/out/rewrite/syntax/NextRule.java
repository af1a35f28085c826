package com.vidnyan.sixer.adapter.out.rewrite.syntax;

import com.vidnyan.sixer.adapter.out.rewrite.AbstractRewriteRule;
import com.vidnyan.sixer.domain.grammar.ReceiverCallRewriter;
import com.vidnyan.sixer.domain.grammar.ReceiverCallRewriter.Operand;
import com.vidnyan.sixer.domain.rule.Diagnostic;
import com.vidnyan.sixer.domain.rule.RewriteContext;
import com.vidnyan.sixer.domain.rule.RewriteResult;

import java.util.List;
import java.util.regex.Pattern;

/**
 * {@code it.next()} becomes {@code next(it)}; {@code (x for x in data).next()} becomes
 * {@code next(x for x in data)}.
 */
public class NextRule extends AbstractRewriteRule {

    private static final Pattern NEXT_CALL = Pattern.compile("\\.next *\\(");

    // iterator classes still defining next() need a __next__ alias
    private static final Pattern NEXT_METHOD = Pattern.compile("\\bdef next *\\(");

    public NextRule() {
        super("next", "replace it.next() with next(it)", ".next(");
    }

    @Override
    public RewriteResult apply(RewriteContext context) {
        ReceiverCallRewriter.Result result = ReceiverCallRewriter.rewrite(context.content(), ".next()",
                Operand.CHAIN_OR_PARENTHESIZED,
                occurrence -> "next(" + occurrence.unwrappedOperand() + ")");
        return RewriteResult.withoutImports(result.content());
    }

    @Override
    public List<Diagnostic> check(RewriteContext context) {
        return reportLines(context, NEXT_CALL, NEXT_METHOD);
    }
}
