package com.vidnyan.sixer.domain.imports;

import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Removes import statements from a source text.
 *
 * <p>The blank line following a removed statement is removed too when the statement was
 * alone in its group, so that no empty group is left behind.
 */
public final class ImportLines {

    private ImportLines() {
    }

    /**
     * Remove every line fully matched by {@code linePattern}.
     */
    public static String remove(String text, Pattern linePattern) {
        return rewrite(text, linePattern, matcher -> "");
    }

    /**
     * Replace every line fully matched by {@code linePattern} with the callback result.
     * The callback gets the matcher of the line (without its newline); returning an empty
     * string removes the line, returning {@code null} keeps it.
     */
    public static String rewrite(String text, Pattern linePattern, Function<Matcher, String> replacement) {
        StringBuilder out = new StringBuilder(text.length());
        int pos = 0;
        boolean changed = false;
        while (pos < text.length()) {
            int eol = text.indexOf('\n', pos);
            int lineEnd = eol < 0 ? text.length() : eol;
            int next = eol < 0 ? text.length() : eol + 1;
            Matcher matcher = linePattern.matcher(text.substring(pos, lineEnd));
            String replaced = matcher.matches() ? replacement.apply(matcher) : null;
            if (replaced == null) {
                out.append(text, pos, next);
            } else if (!replaced.isEmpty()) {
                out.append(replaced).append(text, lineEnd, next);
                changed = true;
            } else {
                changed = true;
                boolean aloneBefore = out.length() == 0 || endsWithBlankLine(out);
                if (aloneBefore && next < text.length() && text.charAt(next) == '\n') {
                    next++;
                }
            }
            pos = next;
        }
        return changed ? out.toString() : text;
    }

    private static boolean endsWithBlankLine(StringBuilder out) {
        int length = out.length();
        return length >= 2 && out.charAt(length - 1) == '\n' && out.charAt(length - 2) == '\n';
    }
}
