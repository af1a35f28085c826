package com.vidnyan.sixer.adapter.out.rewrite.moves;

import com.vidnyan.sixer.adapter.out.rewrite.AbstractRewriteRule;
import com.vidnyan.sixer.domain.rule.Diagnostic;
import com.vidnyan.sixer.domain.rule.RewriteContext;
import com.vidnyan.sixer.domain.rule.RewriteResult;

import java.math.BigInteger;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code xrange(...)} becomes {@code range(...)}.
 *
 * <p>Small literal ranges are cheap to build as a list on Python 2 and need no import.
 * Symbolic bounds, or spans larger than the configured maximum, need
 * {@code from six.moves import range}.
 */
public class XrangeRule extends AbstractRewriteRule {

    static final String IMPORT_RANGE = "from six.moves import range";

    private static final Pattern XRANGE_STOP = Pattern.compile("(?<![\\w.])xrange\\((\\d+)\\)");

    private static final Pattern XRANGE_START_STOP = Pattern.compile("(?<![\\w.])xrange\\((\\d+),\\s*(\\d+)\\)");

    private static final Pattern XRANGE_CALL = Pattern.compile("(?<![\\w.])xrange(\\s*\\()");

    public XrangeRule() {
        super("xrange", "replace xrange() with range() using 'from six.moves import range'", "xrange");
    }

    @Override
    public RewriteResult apply(RewriteContext context) {
        BigInteger maxRange = BigInteger.valueOf(context.settings().maxRange());
        String content = context.content();
        boolean needsMoves = false;

        Matcher stop = XRANGE_STOP.matcher(content);
        while (stop.find()) {
            needsMoves |= new BigInteger(stop.group(1)).compareTo(maxRange) > 0;
        }
        content = replaceAll(XRANGE_STOP, content, matcher -> "range(" + matcher.group(1) + ")");

        Matcher startStop = XRANGE_START_STOP.matcher(content);
        while (startStop.find()) {
            BigInteger span = new BigInteger(startStop.group(2)).subtract(new BigInteger(startStop.group(1)));
            needsMoves |= span.compareTo(maxRange) > 0;
        }
        content = replaceAll(XRANGE_START_STOP, content,
                matcher -> "range(" + matcher.group(1) + ", " + matcher.group(2) + ")");

        String symbolic = replaceAll(XRANGE_CALL, content, matcher -> "range" + matcher.group(1));
        if (!symbolic.equals(content)) {
            needsMoves = true;
            content = symbolic;
        }

        return needsMoves
                ? RewriteResult.of(content, List.of(IMPORT_RANGE))
                : RewriteResult.withoutImports(content);
    }

    @Override
    public List<Diagnostic> check(RewriteContext context) {
        return reportLines(context, XRANGE_CALL);
    }
}
