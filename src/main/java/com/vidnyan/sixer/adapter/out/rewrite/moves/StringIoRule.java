package com.vidnyan.sixer.adapter.out.rewrite.moves;

import com.vidnyan.sixer.adapter.out.rewrite.AbstractRewriteRule;
import com.vidnyan.sixer.domain.imports.ImportLines;
import com.vidnyan.sixer.domain.rule.Diagnostic;
import com.vidnyan.sixer.domain.rule.RewriteContext;
import com.vidnyan.sixer.domain.rule.RewriteResult;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Moves {@code StringIO} and {@code cStringIO} usages to six:
 * <pre>
 * from StringIO import StringIO          -&gt; from six import StringIO
 * import StringIO; StringIO.StringIO     -&gt; import six; six.StringIO
 * from cStringIO import StringIO         -&gt; from six.moves import cStringIO as StringIO
 * import cStringIO; cStringIO.StringIO   -&gt; from six import moves; moves.cStringIO
 * import cStringIO as StringIO           -&gt; from six import moves; moves.cStringIO
 * </pre>
 */
public class StringIoRule extends AbstractRewriteRule {

    private static final Pattern FROM_STRINGIO = Pattern.compile("from StringIO import StringIO[ \\t]*");
    private static final Pattern IMPORT_STRINGIO = Pattern.compile("import StringIO[ \\t]*");
    private static final Pattern FROM_CSTRINGIO = Pattern.compile("from cStringIO import StringIO[ \\t]*");
    private static final Pattern IMPORT_CSTRINGIO = Pattern.compile("import cStringIO[ \\t]*");
    private static final Pattern IMPORT_CSTRINGIO_AS = Pattern.compile("import cStringIO as StringIO[ \\t]*");

    private static final Pattern STRINGIO_CLASS = Pattern.compile("(?<![\\w.])StringIO\\.StringIO");
    private static final Pattern CSTRINGIO_CLASS = Pattern.compile("(?<![\\w.])cStringIO\\.StringIO");

    private static final Pattern RESIDUAL_ATTRIBUTE = Pattern.compile("(?<![\\w.])c?StringIO\\.");
    private static final Pattern RESIDUAL_IMPORT = Pattern.compile("^(?:import c?StringIO\\b|from c?StringIO import)");

    public StringIoRule() {
        super("stringio",
                "replace StringIO.StringIO with six.StringIO and cStringIO.StringIO with six.moves.cStringIO",
                "StringIO");
    }

    @Override
    public RewriteResult apply(RewriteContext context) {
        String content = context.content();
        Set<String> imports = new LinkedHashSet<>();

        String patched = ImportLines.remove(content, FROM_STRINGIO);
        if (!patched.equals(content)) {
            imports.add("from six import StringIO");
            content = patched;
        }

        patched = ImportLines.remove(content, IMPORT_STRINGIO);
        if (!patched.equals(content)) {
            imports.add("import six");
            content = replaceAll(STRINGIO_CLASS, patched, matcher -> "six.StringIO");
        }

        patched = ImportLines.remove(content, FROM_CSTRINGIO);
        if (!patched.equals(content)) {
            imports.add("from six.moves import cStringIO as StringIO");
            content = patched;
        }

        patched = ImportLines.remove(content, IMPORT_CSTRINGIO);
        if (!patched.equals(content)) {
            imports.add("from six import moves");
            content = replaceAll(CSTRINGIO_CLASS, patched, matcher -> "moves.cStringIO");
        }

        patched = ImportLines.remove(content, IMPORT_CSTRINGIO_AS);
        if (!patched.equals(content)) {
            imports.add("from six import moves");
            content = replaceAll(STRINGIO_CLASS, patched, matcher -> "moves.cStringIO");
        }

        return RewriteResult.of(content, imports);
    }

    @Override
    public List<Diagnostic> check(RewriteContext context) {
        return reportLines(context, RESIDUAL_ATTRIBUTE, RESIDUAL_IMPORT);
    }
}
