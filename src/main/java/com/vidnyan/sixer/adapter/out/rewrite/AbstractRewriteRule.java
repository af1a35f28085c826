package com.vidnyan.sixer.adapter.out.rewrite;

import com.vidnyan.sixer.domain.rule.Diagnostic;
import com.vidnyan.sixer.domain.rule.RewriteContext;
import com.vidnyan.sixer.domain.rule.RewriteRule;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Base class for rules whose detection is a keyword lookup.
 */
public abstract class AbstractRewriteRule implements RewriteRule {

    private final String name;
    private final String description;
    private final List<String> keywords;

    protected AbstractRewriteRule(String name, String description, String... keywords) {
        this.name = name;
        this.description = description;
        this.keywords = List.of(keywords);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String description() {
        return description;
    }

    @Override
    public boolean detect(String content) {
        return keywords.stream().anyMatch(content::contains);
    }

    /**
     * One diagnostic per line accepted by {@code residual}.
     */
    protected List<Diagnostic> reportLines(RewriteContext context, Predicate<String> residual) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (String line : context.content().split("\n", -1)) {
            if (residual.test(line)) {
                diagnostics.add(new Diagnostic(name, context.fileName(), line));
            }
        }
        return diagnostics;
    }

    /**
     * One diagnostic per line containing a match of any pattern.
     */
    protected List<Diagnostic> reportLines(RewriteContext context, Pattern... patterns) {
        return reportLines(context, line -> {
            for (Pattern pattern : patterns) {
                if (pattern.matcher(line).find()) {
                    return true;
                }
            }
            return false;
        });
    }

    /**
     * Replace every match with the callback result, taken literally. A {@code null}
     * result keeps the matched text.
     */
    protected static String replaceAll(Pattern pattern, String text, Function<Matcher, String> replacement) {
        Matcher matcher = pattern.matcher(text);
        StringBuilder out = null;
        int copied = 0;
        while (matcher.find()) {
            String replaced = replacement.apply(matcher);
            if (replaced == null || replaced.equals(matcher.group())) {
                continue;
            }
            if (out == null) {
                out = new StringBuilder(text.length() + 16);
            }
            out.append(text, copied, matcher.start()).append(replaced);
            copied = matcher.end();
        }
        if (out == null) {
            return text;
        }
        return out.append(text, copied, text.length()).toString();
    }
}
