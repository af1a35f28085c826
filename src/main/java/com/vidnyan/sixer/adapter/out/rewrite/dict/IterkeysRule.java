package com.vidnyan.sixer.adapter.out.rewrite.dict;

import com.vidnyan.sixer.domain.grammar.ReceiverCallRewriter;
import com.vidnyan.sixer.domain.grammar.ReceiverCallRewriter.Operand;
import com.vidnyan.sixer.domain.rule.RewriteContext;
import com.vidnyan.sixer.domain.rule.RewriteResult;

import java.util.regex.Pattern;

/**
 * {@code for key in data.iterkeys():} becomes {@code for key in data:}; any other
 * {@code data.iterkeys()} becomes {@code six.iterkeys(data)}.
 */
public class IterkeysRule extends DictIterationRule {

    private static final Pattern FOR_LOOP_HEAD = Pattern.compile("^\\s*for\\s.+\\sin\\s+$");

    public IterkeysRule() {
        super("iterkeys");
    }

    @Override
    public RewriteResult apply(RewriteContext context) {
        String loops = ReceiverCallRewriter.rewrite(context.content(), callSuffix(), Operand.CHAIN,
                occurrence -> iteratesInForLoop(occurrence) ? occurrence.operand() : null).content();
        return super.apply(context.withContent(loops));
    }

    private static boolean iteratesInForLoop(ReceiverCallRewriter.Occurrence occurrence) {
        return FOR_LOOP_HEAD.matcher(occurrence.linePrefix()).matches()
                && occurrence.lineSuffix().startsWith(":");
    }
}
