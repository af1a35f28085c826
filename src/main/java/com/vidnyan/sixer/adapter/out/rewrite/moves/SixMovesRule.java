package com.vidnyan.sixer.adapter.out.rewrite.moves;

import com.vidnyan.sixer.adapter.out.rewrite.AbstractRewriteRule;
import com.vidnyan.sixer.domain.grammar.ExpressionGrammar;
import com.vidnyan.sixer.domain.imports.ImportLines;
import com.vidnyan.sixer.domain.imports.ImportPlanner;
import com.vidnyan.sixer.domain.rule.Diagnostic;
import com.vidnyan.sixer.domain.rule.RewriteContext;
import com.vidnyan.sixer.domain.rule.RewriteResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Replaces modules and builtins renamed in Python 3 with their {@code six.moves} names.
 *
 * <p>{@code import Queue} becomes {@code from six.moves import queue} and every code
 * reference to {@code Queue} is renamed, attribute accesses and bare module arguments
 * alike; an aliased import keeps its alias.
 * {@code reduce()} and {@code reload()} are imported from {@code six.moves},
 * {@code unichr()} becomes {@code six.unichr()}, and mock patch targets such as
 * {@code '__builtin__.open'} are renamed too.
 */
public class SixMovesRule extends AbstractRewriteRule {

    private static final Map<String, String> MODULES = new TreeMap<>(Map.ofEntries(
            Map.entry("BaseHTTPServer", "BaseHTTPServer"),
            Map.entry("ConfigParser", "configparser"),
            Map.entry("Cookie", "http_cookies"),
            Map.entry("HTMLParser", "html_parser"),
            Map.entry("Queue", "queue"),
            Map.entry("SimpleHTTPServer", "SimpleHTTPServer"),
            Map.entry("SimpleXMLRPCServer", "xmlrpc_server"),
            Map.entry("__builtin__", "builtins"),
            Map.entry("cPickle", "cPickle"),
            Map.entry("cookielib", "http_cookiejar"),
            Map.entry("htmlentitydefs", "html_entities"),
            Map.entry("httplib", "http_client"),
            Map.entry("repr", "reprlib"),
            Map.entry("xmlrpclib", "xmlrpc_client")));

    private static final Map<String, String> BUILTINS = new LinkedHashMap<>();

    static {
        BUILTINS.put("reduce", "reduce");
        BUILTINS.put("reload", "reload_module");
    }

    private static final String IDENTIFIER = ExpressionGrammar.IDENTIFIER;

    private static final String MODULE_NAMES = MODULES.keySet().stream()
            .map(Pattern::quote)
            .collect(Collectors.joining("|", "(?:", ")"));

    private static final Pattern IMPORT_LINE = Pattern.compile(
            "import (" + MODULE_NAMES + ")(?: as (" + IDENTIFIER + "))?[ \\t]*");

    private static final Pattern FROM_LINE = Pattern.compile(
            "from (" + MODULE_NAMES + ") import (" + IDENTIFIER + "(?:\\s*,\\s*" + IDENTIFIER + ")*)[ \\t]*");

    private static final Pattern MOCK_TARGET = Pattern.compile("(patch\\(\\s*['\"])(" + MODULE_NAMES + ")\\.");

    private static final Pattern UNICHR = Pattern.compile("(?<![\\w.])unichr(?=\\s*\\()");

    private static final Pattern RESIDUAL_IMPORT = Pattern.compile("^(?:import|from) " + MODULE_NAMES + "\\b");

    public SixMovesRule() {
        super("six_moves", "replace Python 2 imports with six.moves imports", keywords());
    }

    @Override
    public RewriteResult apply(RewriteContext context) {
        Set<String> imports = new TreeSet<>();
        Map<String, String> renamed = new LinkedHashMap<>();

        String content = ImportLines.rewrite(context.content(), IMPORT_LINE, matcher -> {
            String module = matcher.group(1);
            String alias = matcher.group(2);
            String moved = MODULES.get(module);
            if (alias == null) {
                imports.add("from six.moves import " + moved);
                renamed.put(module, moved);
            } else {
                imports.add("from six.moves import " + moved + " as " + alias);
            }
            return "";
        });

        content = ImportLines.rewrite(content, FROM_LINE, matcher -> {
            imports.add("from six.moves." + MODULES.get(matcher.group(1)) + " import " + matcher.group(2));
            return "";
        });

        for (Map.Entry<String, String> entry : renamed.entrySet()) {
            content = renameModule(content, entry.getKey(), entry.getValue());
        }

        for (Map.Entry<String, String> entry : BUILTINS.entrySet()) {
            String importLine = "from six.moves import " + entry.getValue();
            if (ImportPlanner.containsImport(content, importLine)) {
                continue;
            }
            Pattern call = Pattern.compile("(?<![\\w.])(?<!def )" + entry.getKey() + "(?=\\s*\\()");
            if (call.matcher(content).find()) {
                content = replaceAll(call, content, matcher -> entry.getValue());
                imports.add(importLine);
            }
        }

        String sixUnichr = replaceAll(UNICHR, content, matcher -> "six.unichr");
        if (!sixUnichr.equals(content)) {
            imports.add("import six");
            content = sixUnichr;
        }

        content = replaceAll(MOCK_TARGET, content,
                matcher -> matcher.group(1) + "six.moves." + MODULES.get(matcher.group(2)) + ".");

        return RewriteResult.of(content, imports);
    }

    @Override
    public List<Diagnostic> check(RewriteContext context) {
        return reportLines(context, RESIDUAL_IMPORT, UNICHR, MOCK_TARGET);
    }

    // comments, quoted names, calls and keyword arguments keep the old name
    private static String renameModule(String content, String module, String moved) {
        Pattern usage = Pattern.compile(
                "(?<![\\w.'\"])" + Pattern.quote(module) + "(?![\\w'\"(])(?!\\s*=(?!=))");
        StringBuilder out = new StringBuilder(content.length());
        for (String line : content.split("(?<=\n)")) {
            int comment = line.indexOf('#');
            String code = comment < 0 ? line : line.substring(0, comment);
            out.append(replaceAll(usage, code, matcher -> moved));
            if (comment >= 0) {
                out.append(line, comment, line.length());
            }
        }
        return out.toString();
    }

    private static String[] keywords() {
        Set<String> keywords = new TreeSet<>(MODULES.keySet());
        keywords.addAll(BUILTINS.keySet());
        keywords.add("unichr");
        return keywords.toArray(new String[0]);
    }
}
