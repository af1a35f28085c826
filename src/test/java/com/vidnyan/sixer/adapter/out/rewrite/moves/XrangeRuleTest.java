package com.vidnyan.sixer.adapter.out.rewrite.moves;

import com.vidnyan.sixer.domain.imports.ModuleTables;
import com.vidnyan.sixer.domain.rule.RewriteContext;
import com.vidnyan.sixer.domain.rule.RewriteResult;
import com.vidnyan.sixer.domain.rule.RewriteSettings;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.vidnyan.sixer.adapter.out.rewrite.RuleFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class XrangeRuleTest {

    private final XrangeRule rule = new XrangeRule();

    @Test
    void apply_SmallRange_ShouldNotNeedImport() {
        assertRewrite(rule, "for i in xrange(10): pass\n", "for i in range(10): pass\n");
        assertRewrite(rule, "for i in xrange(1,9): pass\n", "for i in range(1, 9): pass\n");
    }

    @Test
    void apply_SymbolicRange_ShouldImportMovesRange() {
        assertRewrite(rule, "for i in xrange(n): pass\n", "for i in range(n): pass\n", XrangeRule.IMPORT_RANGE);
    }

    @Test
    void apply_LargeRange_ShouldImportMovesRange() {
        assertRewrite(rule, "for i in xrange(100000): pass\n", "for i in range(100000): pass\n",
                XrangeRule.IMPORT_RANGE);
        assertRewrite(rule, "for i in xrange(0, 2000): pass\n", "for i in range(0, 2000): pass\n",
                XrangeRule.IMPORT_RANGE);
    }

    @Test
    void apply_ShouldHonourConfiguredMaxRange() {
        RewriteSettings settings = new RewriteSettings(5, ModuleTables.defaults());

        RewriteResult result = rule.apply(new RewriteContext(FILE, "for i in xrange(10): pass\n", settings));

        assertEquals("for i in range(10): pass\n", result.content());
        assertEquals(List.of(XrangeRule.IMPORT_RANGE), result.requiredImports());
    }

    @Test
    void apply_ShouldLeaveSixMovesXrange() {
        assertUnchanged(rule, "from six.moves import xrange\n");
        assertUnchanged(rule, "x = list(moves.xrange(n))\nx = list(moves.xrange(0, 10, 2))\n");
    }
}
