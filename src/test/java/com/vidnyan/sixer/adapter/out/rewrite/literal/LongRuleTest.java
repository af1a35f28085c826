package com.vidnyan.sixer.adapter.out.rewrite.literal;

import com.vidnyan.sixer.domain.rule.Diagnostic;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.vidnyan.sixer.adapter.out.rewrite.RuleFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class LongRuleTest {

    private final LongRule rule = new LongRule();

    @Test
    void apply_ShouldDropLongSuffix() {
        assertRewrite(rule,
                "values = (0L, 1L, 12L, 123L, 1234L, 12345L)\n",
                "values = (0, 1, 12, 123, 1234, 12345)\n");
        assertRewrite(rule, "x = 1l\n", "x = 1\n");
    }

    @Test
    void apply_ShouldHandleHexadecimal() {
        assertRewrite(rule,
                "values = (0x1L, 0x1l, 0xfL, 0x0L)\n",
                "values = (0x1, 0x1, 0xf, 0x0)\n");
    }

    @Test
    void apply_ShouldReplaceIntegerTypesTuple() {
        assertRewrite(rule,
                "isinstance(s, (int, long))\n",
                "isinstance(s, six.integer_types)\n",
                "import six");
    }

    @Test
    void apply_ShouldLeaveOctalLookingLiterals() {
        String code = "values = (00L, 01L, 012L, 0123L)\n";

        assertUnchanged(rule, code);
        assertEquals(List.of(new Diagnostic("long", FILE, "values = (00L, 01L, 012L, 0123L)")), check(rule, code));
    }

    @Test
    void detect_ShouldIgnoreIdentifiers() {
        assertFalse(rule.detect("level = html\n"));
        assertTrue(rule.detect("x = 10L\n"));
    }
}
