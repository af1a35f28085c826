package com.vidnyan.sixer.adapter.out.rewrite;

import com.vidnyan.sixer.adapter.out.rewrite.dict.DictIterationRule;
import com.vidnyan.sixer.adapter.out.rewrite.dict.DictListRule;
import com.vidnyan.sixer.adapter.out.rewrite.dict.HasKeyRule;
import com.vidnyan.sixer.adapter.out.rewrite.dict.IterkeysRule;
import com.vidnyan.sixer.adapter.out.rewrite.literal.BasestringRule;
import com.vidnyan.sixer.adapter.out.rewrite.literal.LongRule;
import com.vidnyan.sixer.adapter.out.rewrite.literal.UnicodeRule;
import com.vidnyan.sixer.adapter.out.rewrite.moves.ItertoolsRule;
import com.vidnyan.sixer.adapter.out.rewrite.moves.SixMovesRule;
import com.vidnyan.sixer.adapter.out.rewrite.moves.StringIoRule;
import com.vidnyan.sixer.adapter.out.rewrite.moves.UrllibRule;
import com.vidnyan.sixer.adapter.out.rewrite.moves.XrangeRule;
import com.vidnyan.sixer.adapter.out.rewrite.syntax.ExceptRule;
import com.vidnyan.sixer.adapter.out.rewrite.syntax.NextRule;
import com.vidnyan.sixer.adapter.out.rewrite.syntax.RaiseRule;
import com.vidnyan.sixer.domain.rule.RewriteRule;

import java.util.List;

/**
 * The rules shipped with sixer, in the order the engine applies them.
 *
 * <p>Import-removing rules ({@code stringio}, {@code urllib}) run before {@code six_moves}
 * and {@code itertools}, which decide from the remaining imports what to do.
 */
public final class BuiltInRules {

    private BuiltInRules() {
    }

    public static List<RewriteRule> all() {
        return List.of(
                DictIterationRule.iteritems(),
                DictIterationRule.itervalues(),
                new IterkeysRule(),
                new HasKeyRule(),
                new NextRule(),
                new LongRule(),
                new UnicodeRule(),
                new XrangeRule(),
                new BasestringRule(),
                new StringIoRule(),
                new UrllibRule(),
                new RaiseRule(),
                new ExceptRule(),
                new SixMovesRule(),
                new ItertoolsRule(),
                DictListRule.firstItem(),
                DictListRule.concatenation());
    }
}
