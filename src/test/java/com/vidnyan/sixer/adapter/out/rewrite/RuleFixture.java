package com.vidnyan.sixer.adapter.out.rewrite;

import com.vidnyan.sixer.domain.rule.Diagnostic;
import com.vidnyan.sixer.domain.rule.RewriteContext;
import com.vidnyan.sixer.domain.rule.RewriteResult;
import com.vidnyan.sixer.domain.rule.RewriteRule;
import com.vidnyan.sixer.domain.rule.RewriteSettings;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Shared helpers for rule tests.
 */
public final class RuleFixture {

    public static final String FILE = "test.py";

    private RuleFixture() {
    }

    public static RewriteResult apply(RewriteRule rule, String code) {
        return rule.apply(new RewriteContext(FILE, code, RewriteSettings.defaults()));
    }

    public static List<Diagnostic> check(RewriteRule rule, String code) {
        return rule.check(new RewriteContext(FILE, code, RewriteSettings.defaults()));
    }

    /**
     * Rewrites {@code before} into {@code after} with the given imports, then leaves
     * {@code after} alone.
     */
    public static void assertRewrite(RewriteRule rule, String before, String after, String... imports) {
        RewriteResult result = apply(rule, before);
        assertEquals(after, result.content());
        assertEquals(List.of(imports), result.requiredImports());

        RewriteResult again = apply(rule, after);
        assertEquals(after, again.content(), "second pass changed the text");
        assertTrue(List.of(imports).containsAll(again.requiredImports()), "second pass asked for new imports");
    }

    public static void assertUnchanged(RewriteRule rule, String code) {
        RewriteResult result = apply(rule, code);
        assertEquals(code, result.content());
        assertTrue(result.requiredImports().isEmpty());
    }
}
