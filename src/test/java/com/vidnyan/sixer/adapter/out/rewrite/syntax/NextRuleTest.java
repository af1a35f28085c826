package com.vidnyan.sixer.adapter.out.rewrite.syntax;

import org.junit.jupiter.api.Test;

import static com.vidnyan.sixer.adapter.out.rewrite.RuleFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class NextRuleTest {

    private final NextRule rule = new NextRule();

    @Test
    void apply_ShouldUseBuiltinNext() {
        assertRewrite(rule, "item = gen.next()\n", "item = next(gen)\n");
        assertRewrite(rule, "item = self.items[0].next()\n", "item = next(self.items[0])\n");
    }

    @Test
    void apply_ShouldUnwrapGeneratorExpression() {
        assertRewrite(rule, "item = (x+1 for x in data).next()\n", "item = next(x+1 for x in data)\n");
        assertRewrite(rule, "item = ((x * 2) for x in data).next()\n", "item = next((x * 2) for x in data)\n");
    }

    @Test
    void apply_ShouldLeaveDeeperNesting() {
        assertUnchanged(rule, "item = f(g(x)).next()\n");
    }

    @Test
    void check_ShouldReportNextMethodDefinitions() {
        assertEquals(1, check(rule, "class It(object):\n    def next(self):\n        return 1\n").size());
        assertTrue(check(rule, "item = next(gen)\n").isEmpty());
    }
}
