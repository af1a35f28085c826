package com.vidnyan.sixer.domain.imports;

import org.junit.jupiter.api.Test;

import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class ImportLinesTest {

    private static final Pattern URLLIB2 = Pattern.compile("import urllib2");

    @Test
    void remove_ShouldKeepSeparatorOfRemainingGroup() {
        String code = "import StringIO\nimport urllib2\n\nimport cue\n";

        assertEquals("import StringIO\n\nimport cue\n", ImportLines.remove(code, URLLIB2));
    }

    @Test
    void remove_ShouldDropBlankLineOfEmptiedGroup() {
        assertEquals("x = 1\n", ImportLines.remove("import urllib2\n\nx = 1\n", URLLIB2));
        assertEquals("import os\n\nx = 1\n", ImportLines.remove("import os\n\nimport urllib2\n\nx = 1\n", URLLIB2));
    }

    @Test
    void remove_ShouldMatchWholeLinesOnly() {
        String code = "import urllib2.request\n    import urllib2\n";

        assertSame(code, ImportLines.remove(code, URLLIB2));
    }

    @Test
    void rewrite_ShouldReplaceOrKeepLines() {
        Pattern fromImport = Pattern.compile("from (\\w+) import (\\w+)");
        String code = "from a import b\nfrom c import d\n";

        String result = ImportLines.rewrite(code, fromImport,
                matcher -> matcher.group(1).equals("a") ? "from z import " + matcher.group(2) : null);

        assertEquals("from z import b\nfrom c import d\n", result);
    }
}
