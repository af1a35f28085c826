package com.vidnyan.sixer.adapter.out.rewrite.dict;

import com.vidnyan.sixer.domain.rule.Diagnostic;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.vidnyan.sixer.adapter.out.rewrite.RuleFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class HasKeyRuleTest {

    private final HasKeyRule rule = new HasKeyRule();

    @Test
    void apply_ShouldUseMembershipTest() {
        assertRewrite(rule, "dict.has_key(key)\n", "key in dict\n");
    }

    @Test
    void apply_ShouldAcceptQuotedKey() {
        assertRewrite(rule, "if data.has_key('x'):\n    pass\n", "if 'x' in data:\n    pass\n");
    }

    @Test
    void apply_ShouldNotParenthesizeStandaloneTests() {
        assertRewrite(rule, "found = self.cache.has_key(name)\n", "found = name in self.cache\n");
        assertRewrite(rule, "check(d.has_key(k), True)\n", "check(k in d, True)\n");
    }

    @Test
    void apply_ShouldParenthesizeInsideLargerExpression() {
        assertRewrite(rule, "total = 1 + d.has_key(k)\n", "total = 1 + (k in d)\n");
    }

    @Test
    void apply_ShouldLeaveComplexArgumentAndReportIt() {
        String code = "if d.has_key(f(x) + 1):\n";

        assertUnchanged(rule, code);
        assertEquals(List.of(new Diagnostic("has_key", FILE, "if d.has_key(f(x) + 1):")), check(rule, code));
    }
}
