package com.vidnyan.sixer.adapter.out.rewrite.moves;

import com.vidnyan.sixer.adapter.out.rewrite.AbstractRewriteRule;
import com.vidnyan.sixer.domain.grammar.ExpressionGrammar;
import com.vidnyan.sixer.domain.imports.ImportLines;
import com.vidnyan.sixer.domain.rule.Diagnostic;
import com.vidnyan.sixer.domain.rule.RewriteContext;
import com.vidnyan.sixer.domain.rule.RewriteResult;
import com.vidnyan.sixer.domain.rule.UnknownSymbolException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces {@code urllib}, {@code urllib2} and {@code urlparse} with
 * {@code six.moves.urllib}, whose symbols are split into the {@code error},
 * {@code parse} and {@code request} submodules.
 *
 * <p>A symbol missing from the submodule table aborts the file with
 * {@link UnknownSymbolException}. {@code parse_http_list} has no six equivalent: it is
 * left untouched and reported.
 */
public class UrllibRule extends AbstractRewriteRule {

    static final String IMPORT_URLLIB = "from six.moves import urllib";

    private static final String PASS_THROUGH = "parse_http_list";

    private static final Map<String, String> SUBMODULES = submodules(Map.of(
            "error", List.of("HTTPError", "URLError"),
            "request", List.of("HTTPBasicAuthHandler", "HTTPCookieProcessor", "HTTPPasswordMgrWithDefaultRealm",
                    "HTTPSHandler", "ProxyHandler", "Request", "build_opener", "install_opener", "pathname2url",
                    "urlopen"),
            "parse", List.of("parse_qs", "parse_qsl", "quote", "quote_plus", "unquote", "urlencode", "urljoin",
                    "urlparse", "urlsplit", "urlunparse", "urlunsplit")));

    private static final String IDENTIFIER = ExpressionGrammar.IDENTIFIER;

    private static final Pattern IMPORT_LINE = Pattern.compile("import (?:urllib2?|urlparse)[ \\t]*");

    private static final Pattern FROM_LINE = Pattern.compile(
            "from (urllib2?|urlparse) import (" + IDENTIFIER + "(?:\\s*,\\s*" + IDENTIFIER + ")*)[ \\t]*");

    // urllib2.urlparse.attr or urllib2.urllib.attr
    private static final Pattern NESTED_ATTRIBUTE = Pattern.compile(
            "(?<![\\w.])urllib2\\.(?:urllib|urlparse)\\.(" + IDENTIFIER + ")");

    private static final Pattern ATTRIBUTE = Pattern.compile(
            "(?<![\\w.])(urllib2?|urlparse)\\.(" + IDENTIFIER + ")");

    private static final Pattern URLLIB2 = Pattern.compile("(?<![\\w.])urllib2(?!\\w)(?!\\." + PASS_THROUGH + ")");

    private static final Pattern RESIDUAL_IMPORT = Pattern.compile("^(?:import (?:urllib2?|urlparse)\\b|from (?:urllib2?|urlparse) import)");

    public UrllibRule() {
        super("urllib", "replace urllib, urllib2 and urlparse with six.moves.urllib", "urllib", "urlparse");
    }

    @Override
    public RewriteResult apply(RewriteContext context) {
        String content = context.content();
        List<String> imports = new ArrayList<>();

        String withoutImports = ImportLines.remove(content, IMPORT_LINE);
        if (!withoutImports.equals(content)) {
            content = replaceAll(NESTED_ATTRIBUTE, withoutImports, matcher -> qualified("urllib2", matcher.group(1)));
            content = replaceAll(ATTRIBUTE, content, UrllibRule::attribute);
            content = replaceAll(URLLIB2, content, matcher -> "urllib");
            imports.add(IMPORT_URLLIB);
        }

        Map<String, Set<String>> symbolsBySubmodule = new TreeMap<>();
        content = ImportLines.rewrite(content, FROM_LINE, matcher -> mergeSymbols(matcher, symbolsBySubmodule));
        symbolsBySubmodule.forEach((submodule, symbols) ->
                imports.add("from six.moves.urllib." + submodule + " import " + String.join(", ", symbols)));

        return RewriteResult.of(content, imports);
    }

    @Override
    public List<Diagnostic> check(RewriteContext context) {
        return reportLines(context, line -> line.contains("urllib2." + PASS_THROUGH)
                || RESIDUAL_IMPORT.matcher(line).find());
    }

    private static String attribute(Matcher matcher) {
        String module = matcher.group(1);
        String name = matcher.group(2);
        if (PASS_THROUGH.equals(name)) {
            return null;
        }
        if ("urllib".equals(module) && SUBMODULES.containsValue(name)) {
            // already six.moves.urllib style
            return null;
        }
        return qualified(module, name);
    }

    private static String qualified(String module, String name) {
        String submodule = SUBMODULES.get(name);
        if (submodule == null) {
            throw new UnknownSymbolException("urllib", module + "." + name);
        }
        return "urllib." + submodule + "." + name;
    }

    // Returns "" to drop the line, null to keep it.
    private static String mergeSymbols(Matcher matcher, Map<String, Set<String>> symbolsBySubmodule) {
        String module = matcher.group(1);
        String[] names = matcher.group(2).split("\\s*,\\s*");
        if (List.of(names).contains(PASS_THROUGH)) {
            return null;
        }
        for (String name : names) {
            String submodule = SUBMODULES.get(name);
            if (submodule == null) {
                throw new UnknownSymbolException("urllib", module + "." + name);
            }
            symbolsBySubmodule.computeIfAbsent(submodule, key -> new LinkedHashSet<>()).add(name);
        }
        return "";
    }

    private static Map<String, String> submodules(Map<String, List<String>> symbolsBySubmodule) {
        Map<String, String> submodules = new TreeMap<>();
        symbolsBySubmodule.forEach((submodule, symbols) -> symbols.forEach(symbol -> submodules.put(symbol, submodule)));
        return Map.copyOf(submodules);
    }
}
