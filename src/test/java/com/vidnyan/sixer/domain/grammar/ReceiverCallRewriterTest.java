package com.vidnyan.sixer.domain.grammar;

import com.vidnyan.sixer.domain.grammar.ReceiverCallRewriter.Operand;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ReceiverCallRewriterTest {

    @Test
    void rewrite_ShouldReplaceEveryOccurrence() {
        String text = "a.close()\nb.c.close()\n";

        ReceiverCallRewriter.Result result = ReceiverCallRewriter.rewrite(text, ".close()", Operand.CHAIN,
                occurrence -> "close(" + occurrence.operand() + ")");

        assertEquals("close(a)\nclose(b.c)\n", result.content());
        assertEquals(2, result.replacements());
        assertTrue(result.changed());
    }

    @Test
    void rewrite_ShouldKeepOccurrenceWhenCallbackReturnsNull() {
        String text = "a.close()\n";

        ReceiverCallRewriter.Result result = ReceiverCallRewriter.rewrite(text, ".close()", Operand.CHAIN,
                occurrence -> null);

        assertSame(text, result.content());
        assertFalse(result.changed());
    }

    @Test
    void rewrite_ShouldUnwrapParenthesizedOperand() {
        String text = "v = (x for x in data).next()";

        ReceiverCallRewriter.Result result = ReceiverCallRewriter.rewrite(text, ".next()",
                Operand.CHAIN_OR_PARENTHESIZED, occurrence -> "next(" + occurrence.unwrappedOperand() + ")");

        assertEquals("v = next(x for x in data)", result.content());
    }

    @Test
    void occurrence_ShouldExposeLineContext() {
        String text = "first\nfor k in d.iterkeys(): pass\nlast";
        ReceiverCallRewriter.rewrite(text, ".iterkeys()", Operand.CHAIN, occurrence -> {
            assertEquals("d", occurrence.operand());
            assertEquals("for k in ", occurrence.linePrefix());
            assertEquals(": pass", occurrence.lineSuffix());
            return null;
        });
    }
}
