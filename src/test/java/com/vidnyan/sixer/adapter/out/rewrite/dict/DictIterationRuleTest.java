package com.vidnyan.sixer.adapter.out.rewrite.dict;

import com.vidnyan.sixer.domain.rule.Diagnostic;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.vidnyan.sixer.adapter.out.rewrite.RuleFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class DictIterationRuleTest {

    private final DictIterationRule iteritems = DictIterationRule.iteritems();
    private final DictIterationRule itervalues = DictIterationRule.itervalues();

    @Test
    void apply_ShouldWrapReceiverInSixCall() {
        assertRewrite(iteritems,
                "for key, value in data.iteritems(): pass\n",
                "for key, value in six.iteritems(data): pass\n",
                "import six");
    }

    @Test
    void apply_ShouldCaptureAttributeChain() {
        assertRewrite(iteritems,
                "items = obj.data[0].attr.iteritems()\n",
                "items = six.iteritems(obj.data[0].attr)\n",
                "import six");
    }

    @Test
    void apply_Itervalues() {
        assertRewrite(itervalues,
                "for value in data.itervalues(): pass\n",
                "for value in six.itervalues(data): pass\n",
                "import six");
    }

    @Test
    void apply_ShouldLeaveNestedCallAndReportIt() {
        String code = "items = f(g(x)).iteritems()\n";

        assertUnchanged(iteritems, code);
        assertEquals(List.of(new Diagnostic("iteritems", FILE, "items = f(g(x)).iteritems()")), check(iteritems, code));
    }

    @Test
    void check_ShouldIgnoreSixCalls() {
        assertTrue(check(iteritems, "x = six.iteritems(data)\n").isEmpty());
    }

    @Test
    void detect_ShouldLookForMethodCall() {
        assertTrue(iteritems.detect("data.iteritems()"));
        assertFalse(iteritems.detect("data.itervalues()"));
    }
}
