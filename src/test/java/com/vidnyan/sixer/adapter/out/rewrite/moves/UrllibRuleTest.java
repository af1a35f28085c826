package com.vidnyan.sixer.adapter.out.rewrite.moves;

import com.vidnyan.sixer.domain.rule.Diagnostic;
import com.vidnyan.sixer.domain.rule.UnknownSymbolException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.vidnyan.sixer.adapter.out.rewrite.RuleFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class UrllibRuleTest {

    private final UrllibRule rule = new UrllibRule();

    @Test
    void apply_ImportUrllib() {
        assertRewrite(rule, "import urllib\n\nurllib.urlopen(url)\n", "urllib.request.urlopen(url)\n",
                UrllibRule.IMPORT_URLLIB);
    }

    @Test
    void apply_ImportUrllib2() {
        assertRewrite(rule,
                "import urllib2\n\ntry:\n    urllib2.urlopen(url)\nexcept urllib2.URLError as exc:\n    pass\n",
                "try:\n    urllib.request.urlopen(url)\nexcept urllib.error.URLError as exc:\n    pass\n",
                UrllibRule.IMPORT_URLLIB);
    }

    @Test
    void apply_NestedUrlparseAttribute() {
        assertRewrite(rule, "import urllib2\n\nurllib2.urlparse.urlparse('')\n", "urllib.parse.urlparse('')\n",
                UrllibRule.IMPORT_URLLIB);
    }

    @Test
    void apply_ImportUrlparse() {
        assertRewrite(rule, "import urlparse\n\nurlparse.urlparse(uri)\n", "urllib.parse.urlparse(uri)\n",
                UrllibRule.IMPORT_URLLIB);
    }

    @Test
    void apply_ShouldKeepSeparatorOfRemainingGroup() {
        assertRewrite(rule,
                "import StringIO\nimport urllib2\n\nimport cue.tests.functional.fixtures.base as base\n\n"
                        + "urllib2.urlopen(url)\n",
                "import StringIO\n\nimport cue.tests.functional.fixtures.base as base\n\n"
                        + "urllib.request.urlopen(url)\n",
                UrllibRule.IMPORT_URLLIB);
    }

    @Test
    void apply_FromImport_ShouldMergeSymbolsPerSubmodule() {
        assertRewrite(rule,
                "from urllib import quote, urlopen\nfrom urllib2 import urlopen, URLError\n\nquote(\"abc\")\n",
                "quote(\"abc\")\n",
                "from six.moves.urllib.error import URLError",
                "from six.moves.urllib.parse import quote",
                "from six.moves.urllib.request import urlopen");
    }

    @Test
    void apply_UnknownSymbol_ShouldFail() {
        UnknownSymbolException error = assertThrows(UnknownSymbolException.class,
                () -> apply(rule, "import urllib2\n\n# urllib2.open\nurllib2.urlopen(url)\n"));

        assertEquals("Unknown urllib symbol: urllib2.open", error.getMessage());
        assertEquals("urllib2.open", error.getSymbol());
    }

    @Test
    void apply_UnknownSymbolInFromImport_ShouldFail() {
        assertThrows(UnknownSymbolException.class, () -> apply(rule, "from urllib2 import magic\n"));
    }

    @Test
    void apply_ShouldLeaveParseHttpList() {
        String code = "urllib2.parse_http_list()\n";

        assertUnchanged(rule, code);
        assertEquals(List.of(new Diagnostic("urllib", FILE, "urllib2.parse_http_list()")), check(rule, code));
    }
}
