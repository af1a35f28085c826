package com.vidnyan.sixer.adapter.out.rewrite.moves;

import com.vidnyan.sixer.adapter.out.rewrite.AbstractRewriteRule;
import com.vidnyan.sixer.domain.grammar.ExpressionGrammar;
import com.vidnyan.sixer.domain.imports.ImportLines;
import com.vidnyan.sixer.domain.rule.Diagnostic;
import com.vidnyan.sixer.domain.rule.RewriteContext;
import com.vidnyan.sixer.domain.rule.RewriteResult;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * {@code itertools.imap} becomes {@code six.moves.map}, same for {@code ifilter},
 * {@code izip}, {@code ifilterfalse} and {@code izip_longest}.
 *
 * <p>{@code import itertools} is dropped once nothing else uses the module.
 */
public class ItertoolsRule extends AbstractRewriteRule {

    private static final Map<String, String> FUNCTIONS = Map.of(
            "imap", "map",
            "ifilter", "filter",
            "ifilterfalse", "filterfalse",
            "izip", "zip",
            "izip_longest", "zip_longest");

    private static final String FUNCTION_NAMES = "(ifilterfalse|ifilter|imap|izip_longest|izip)";

    private static final String IDENTIFIER = ExpressionGrammar.IDENTIFIER;

    private static final Pattern FROM_LINE = Pattern.compile(
            "from itertools import (" + IDENTIFIER + "(?:\\s*,\\s*" + IDENTIFIER + ")*)[ \\t]*");

    private static final Pattern IMPORT_LINE = Pattern.compile("import itertools[ \\t]*");

    private static final Pattern FUNCTION = Pattern.compile("(?<![\\w.])" + FUNCTION_NAMES + "(?!\\w)");

    private static final Pattern QUALIFIED_FUNCTION = Pattern.compile(
            "(?<![\\w.])itertools\\." + FUNCTION_NAMES + "(?!\\w)");

    private static final Pattern MODULE_USAGE = Pattern.compile("(?<![\\w.])itertools\\.");

    public ItertoolsRule() {
        super("itertools", "replace itertools.imap with six.moves.map", "imap", "ifilter", "izip");
    }

    @Override
    public RewriteResult apply(RewriteContext context) {
        String original = context.content();
        Set<String> imported = new LinkedHashSet<>();

        String content = ImportLines.rewrite(original, FROM_LINE, matcher -> {
            List<String> kept = new ArrayList<>();
            for (String name : matcher.group(1).split("\\s*,\\s*")) {
                if (FUNCTIONS.containsKey(name)) {
                    imported.add(name);
                } else {
                    kept.add(name);
                }
            }
            if (kept.size() == matcher.group(1).split("\\s*,\\s*").length) {
                return null;
            }
            return kept.isEmpty() ? "" : "from itertools import " + String.join(", ", kept);
        });
        if (!imported.isEmpty()) {
            content = replaceAll(FUNCTION, content,
                    matcher -> imported.contains(matcher.group(1)) ? moved(matcher.group(1)) : null);
        }

        String qualified = replaceAll(QUALIFIED_FUNCTION, content, matcher -> moved(matcher.group(1)));
        if (!qualified.equals(content)) {
            content = qualified;
            if (!MODULE_USAGE.matcher(content).find()) {
                content = ImportLines.remove(content, IMPORT_LINE);
            }
        }

        return RewriteResult.requiringWhenChanged(original, content, "import six");
    }

    @Override
    public List<Diagnostic> check(RewriteContext context) {
        return reportLines(context, FUNCTION);
    }

    private static String moved(String function) {
        return "six.moves." + FUNCTIONS.get(function);
    }
}
