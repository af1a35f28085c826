package com.vidnyan.sixer.adapter.out.rewrite.literal;

import com.vidnyan.sixer.adapter.out.rewrite.AbstractRewriteRule;
import com.vidnyan.sixer.domain.rule.Diagnostic;
import com.vidnyan.sixer.domain.rule.RewriteContext;
import com.vidnyan.sixer.domain.rule.RewriteResult;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code unicode} becomes {@code six.text_type} and {@code (str, unicode)} becomes
 * {@code six.string_types}.
 *
 * <p>Each line is scanned between a start and an end cursor. Import lines are skipped, the
 * end cursor stops at a comment or a triple-quoted string and the start cursor moves past
 * the name of a {@code def}.
 */
public class UnicodeRule extends AbstractRewriteRule {

    private static final Pattern UNICODE = Pattern.compile("(?<![\\w.])unicode(?!\\w)");

    private static final Pattern STRING_TYPES = Pattern.compile("\\(str,\\s*unicode\\)");

    private static final Pattern DEF = Pattern.compile("^\\s*def\\s+[a-zA-Z_][a-zA-Z0-9_]*\\s*\\(");

    public UnicodeRule() {
        super("unicode", "replace unicode with six.text_type", "unicode");
    }

    @Override
    public RewriteResult apply(RewriteContext context) {
        StringBuilder out = new StringBuilder(context.content().length() + 32);
        boolean changed = false;
        for (String line : CodeLines.split(context.content())) {
            String patched = patchLine(line);
            changed |= !patched.equals(line);
            out.append(patched);
        }
        if (!changed) {
            return RewriteResult.withoutImports(context.content());
        }
        return RewriteResult.of(out.toString(), List.of("import six"));
    }

    @Override
    public List<Diagnostic> check(RewriteContext context) {
        return reportLines(context, line -> UNICODE.matcher(CodeLines.withoutComment(line)).find());
    }

    private static String patchLine(String line) {
        if (CodeLines.isImport(line)) {
            return line;
        }
        int end = CodeLines.codeEnd(line);
        int start = 0;
        Matcher def = DEF.matcher(line).region(0, end);
        if (def.lookingAt()) {
            start = def.end();
        }
        String code = line.substring(start, end);
        String patched = replaceAll(STRING_TYPES, code, matcher -> "six.string_types");
        patched = replaceAll(UNICODE, patched, matcher -> "six.text_type");
        if (patched.equals(code)) {
            return line;
        }
        return line.substring(0, start) + patched + line.substring(end);
    }
}
