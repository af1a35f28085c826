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
 * {@code except ValueError, exc:} becomes {@code except ValueError as exc:}, also for a
 * tuple of exception types.
 */
public class ExceptRule extends AbstractRewriteRule {

    private static final String DOTTED = ExpressionGrammar.DOTTED_NAME;
    private static final String IDENTIFIER = ExpressionGrammar.IDENTIFIER;

    private static final Pattern EXCEPT = Pattern.compile(
            "(?<![\\w.])except\\s+(" + DOTTED + ")\\s*,\\s*(" + IDENTIFIER + ")\\s*:");

    private static final Pattern EXCEPT_TUPLE = Pattern.compile(
            "(?<![\\w.])except\\s+(\\(\\s*" + DOTTED + "(?:\\s*,\\s*" + DOTTED + ")*\\s*\\))\\s*,\\s*("
                    + IDENTIFIER + ")\\s*:");

    private static final Pattern RESIDUAL = Pattern.compile("\\bexcept [^,()]+, *[^:]+:");
    private static final Pattern RESIDUAL_TUPLE = Pattern.compile("\\bexcept \\([^()]+\\) *, *[^:]+:");

    public ExceptRule() {
        super("except", "replace 'except ValueError, exc:' with 'except ValueError as exc:'", "except");
    }

    @Override
    public RewriteResult apply(RewriteContext context) {
        String content = replaceAll(EXCEPT, context.content(), ExceptRule::asClause);
        content = replaceAll(EXCEPT_TUPLE, content, ExceptRule::asClause);
        return RewriteResult.withoutImports(content);
    }

    @Override
    public List<Diagnostic> check(RewriteContext context) {
        return reportLines(context, RESIDUAL, RESIDUAL_TUPLE);
    }

    private static String asClause(Matcher matcher) {
        return "except " + matcher.group(1) + " as " + matcher.group(2) + ":";
    }
}
