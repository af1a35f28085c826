package com.vidnyan.sixer.domain.rule;

import com.vidnyan.sixer.domain.RewriteException;
import com.vidnyan.sixer.domain.imports.ImportPlanner;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Applies rewrite rules to the content of one file.
 *
 * <p>Rules run in the given order; the imports each rule asks for are added before the
 * next rule runs. Once every rule ran, all of them check the final text for leftovers.
 * A {@link RewriteException} aborts the file: no partial content is returned.
 *
 * <p>Rules only see {@code \n} line endings. Content whose lines all end with
 * {@code \r\n} is converted before the first rule and converted back at the end.
 */
@Slf4j
public class RewriteEngine {

    private static final String CRLF = "\r\n";

    private static final Pattern BARE_LF = Pattern.compile("(?<!\r)\n");

    public PatchOutcome patch(String fileName, String content, List<RewriteRule> rules, RewriteSettings settings) {
        ImportPlanner planner = new ImportPlanner(settings.moduleTables());
        SortedSet<String> applied = new TreeSet<>();
        boolean crlf = usesCrlf(content);
        String original = crlf ? content.replace(CRLF, "\n") : content;
        String current = original;

        for (RewriteRule rule : rules) {
            if (!rule.detect(current)) {
                continue;
            }
            RewriteResult result = rule.apply(new RewriteContext(fileName, current, settings));
            String updated = planner.addImports(result.content(), result.requiredImports());
            if (!updated.equals(current)) {
                log.debug("{}: applied {}", fileName, rule.name());
                applied.add(rule.name());
                current = updated;
            }
        }

        RewriteContext finalContext = new RewriteContext(fileName, current, settings);
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (RewriteRule rule : rules) {
            diagnostics.addAll(rule.check(finalContext));
        }

        if (current.equals(original)) {
            return new PatchOutcome(false, applied, content, diagnostics);
        }
        return new PatchOutcome(true, applied, crlf ? current.replace("\n", CRLF) : current, diagnostics);
    }

    // mixed endings are left alone so untouched lines keep their bytes
    private static boolean usesCrlf(String content) {
        return content.contains(CRLF) && !BARE_LF.matcher(content).find();
    }
}
