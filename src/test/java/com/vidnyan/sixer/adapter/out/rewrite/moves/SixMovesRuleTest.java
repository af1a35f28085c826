package com.vidnyan.sixer.adapter.out.rewrite.moves;

import org.junit.jupiter.api.Test;

import static com.vidnyan.sixer.adapter.out.rewrite.RuleFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class SixMovesRuleTest {

    private final SixMovesRule rule = new SixMovesRule();

    @Test
    void apply_ImportRenamedModule() {
        assertRewrite(rule, "import __builtin__\n\n__builtin__.open()\n", "builtins.open()\n",
                "from six.moves import builtins");
        assertRewrite(rule, "import Queue\n\nq = Queue.Queue()\n", "q = queue.Queue()\n",
                "from six.moves import queue");
    }

    @Test
    void apply_ShouldRenameBareModuleReferences() {
        assertRewrite(rule,
                "import Queue\n\nimport mock\n\nmock.patch.object(Queue, 'Queue')\nq = Queue.Queue()\n",
                "import mock\n\nmock.patch.object(queue, 'Queue')\nq = queue.Queue()\n",
                "from six.moves import queue");
    }

    @Test
    void apply_ShouldKeepOldNameInCommentsAndKeywordArguments() {
        assertRewrite(rule,
                "import Queue\n\nf(Queue)  # Queue module\ng(Queue=1)\n",
                "f(queue)  # Queue module\ng(Queue=1)\n",
                "from six.moves import queue");
    }

    @Test
    void apply_ImportWithAlias_ShouldKeepAlias() {
        assertRewrite(rule, "import cPickle as pickle\n\npickle\n", "pickle\n",
                "from six.moves import cPickle as pickle");
    }

    @Test
    void apply_FromImport() {
        assertRewrite(rule, "from __builtin__ import len, open\n\nlen([])\n", "len([])\n",
                "from six.moves.builtins import len, open");
    }

    @Test
    void apply_ShouldNotRenameStringsOrAttributes() {
        assertRewrite(rule,
                "import ConfigParser\n\nparser = ConfigParser.ConfigParser()\nname = 'ConfigParser.x'\n",
                "parser = configparser.ConfigParser()\nname = 'ConfigParser.x'\n",
                "from six.moves import configparser");
    }

    @Test
    void apply_Reload() {
        assertRewrite(rule, "import sys\nreload(sys)\n", "import sys\nreload_module(sys)\n",
                "from six.moves import reload_module");
    }

    @Test
    void apply_Reduce() {
        assertRewrite(rule, "reduce(lambda x, y: x*10+y, [1, 2, 3])\n", "reduce(lambda x, y: x*10+y, [1, 2, 3])\n",
                "from six.moves import reduce");
    }

    @Test
    void apply_ShouldSkipAlreadyImportedBuiltin() {
        String code = "from six.moves import reduce\n\n\nprint(reduce(lambda x, y: x*10+y, [1, 2, 3]))\nreload(sys)\n";

        assertRewrite(rule, code, code.replace("reload(sys)", "reload_module(sys)"),
                "from six.moves import reload_module");
    }

    @Test
    void apply_ShouldNotTouchMovesAttribute() {
        assertUnchanged(rule, "from six import moves\n\n\nprint(moves.reduce(lambda x, y: x*10+y, [1, 2, 3]))\n");
        assertUnchanged(rule, "def reduce(items):\n    pass\n");
    }

    @Test
    void apply_MockPatchTarget() {
        assertRewrite(rule, "with mock.patch('__builtin__.open'): pass\n",
                "with mock.patch('six.moves.builtins.open'): pass\n");
        assertRewrite(rule, "with patch('__builtin__.open'): pass\n", "with patch('six.moves.builtins.open'): pass\n");
    }

    @Test
    void apply_Unichr() {
        assertRewrite(rule, "print(unichr(0x20ac))\n", "print(six.unichr(0x20ac))\n", "import six");
    }

    @Test
    void check_ShouldReportIndentedImportAndUnknownForms() {
        assertEquals(1, check(rule, "x = 1\nimport Queue as q, os\n").size());
        assertTrue(check(rule, "from six.moves import queue\n").isEmpty());
    }
}
