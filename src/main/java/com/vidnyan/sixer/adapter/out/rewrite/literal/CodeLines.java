package com.vidnyan.sixer.adapter.out.rewrite.literal;

import java.util.ArrayList;
import java.util.List;

/**
 * Line helpers for rules that must not touch import statements, comments or docstrings.
 */
final class CodeLines {

    private CodeLines() {
    }

    /**
     * Lines of the text, each one keeping its newline.
     */
    static List<String> split(String content) {
        List<String> lines = new ArrayList<>();
        int pos = 0;
        while (pos < content.length()) {
            int eol = content.indexOf('\n', pos);
            int next = eol < 0 ? content.length() : eol + 1;
            lines.add(content.substring(pos, next));
            pos = next;
        }
        return lines;
    }

    static boolean isImport(String line) {
        return line.startsWith("import ") || line.startsWith("from ");
    }

    /**
     * Offset where code stops on this line: a comment or the start of a triple-quoted string.
     */
    static int codeEnd(String line) {
        int end = line.length();
        for (String marker : new String[]{"#", "\"\"\"", "'''"}) {
            int pos = line.indexOf(marker);
            if (pos >= 0 && pos < end) {
                end = pos;
            }
        }
        return end;
    }

    static String withoutComment(String line) {
        int pos = line.indexOf('#');
        return pos < 0 ? line : line.substring(0, pos);
    }
}
