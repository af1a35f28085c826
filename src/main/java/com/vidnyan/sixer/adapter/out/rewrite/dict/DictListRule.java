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
 * Wraps {@code keys()}, {@code values()} and {@code items()} views in {@code list(...)}
 * where the code relies on getting a list back.
 */
public final class DictListRule extends AbstractRewriteRule {

    private static final List<String> VIEWS = List.of("keys", "values", "items");

    private static final Pattern ADDITION = Pattern.compile("^ *\\+(?!=)");

    private final boolean indexing;
    private final Pattern residual;

    private DictListRule(String name, String description, boolean indexing, Pattern residual, String... keywords) {
        super(name, description, keywords);
        this.indexing = indexing;
        this.residual = residual;
    }

    /**
     * {@code data.keys()[0]} becomes {@code list(data.keys())[0]}.
     */
    public static DictListRule firstItem() {
        return new DictListRule("dict0",
                "replace dict.keys()[0] with list(dict.keys())[0], same for values() and items()",
                true,
                Pattern.compile("\\.(?:keys|values|items)\\(\\)\\[0\\]"),
                ".keys()[0]", ".values()[0]", ".items()[0]");
    }

    /**
     * {@code data.keys() + other} becomes {@code list(data.keys()) + other}.
     */
    public static DictListRule concatenation() {
        return new DictListRule("dict_add",
                "replace dict.keys() + list2 with list(dict.keys()) + list2, same for values() and items()",
                false,
                Pattern.compile("\\.(?:keys|values|items)\\(\\) *\\+(?!=)"),
                ".keys()", ".values()", ".items()");
    }

    @Override
    public RewriteResult apply(RewriteContext context) {
        String content = context.content();
        for (String view : VIEWS) {
            String call = "." + view + "()";
            if (indexing) {
                content = ReceiverCallRewriter.rewrite(content, call + "[0]", Operand.CHAIN,
                        occurrence -> "list(" + occurrence.operand() + call + ")[0]").content();
            } else {
                content = ReceiverCallRewriter.rewrite(content, call, Operand.CHAIN,
                        occurrence -> ADDITION.matcher(occurrence.lineSuffix()).find()
                                ? "list(" + occurrence.operand() + call + ")"
                                : null).content();
            }
        }
        return RewriteResult.withoutImports(content);
    }

    @Override
    public List<Diagnostic> check(RewriteContext context) {
        return reportLines(context, residual);
    }
}
