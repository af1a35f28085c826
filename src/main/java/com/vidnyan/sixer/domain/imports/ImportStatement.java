package com.vidnyan.sixer.domain.imports;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Name tuple of a single import line, used to keep import groups sorted.
 *
 * <p>{@code import a.b} gives {@code [a, b]}; {@code from a.b import c, d} gives
 * {@code [a, b, "c, d"]}.
 */
public record ImportStatement(List<String> names) implements Comparable<ImportStatement> {

    private static final String IMPORT = "import ";
    private static final String FROM = "from ";
    private static final String FROM_IMPORT = " import ";

    public ImportStatement {
        names = List.copyOf(names);
    }

    /**
     * Parse one line; empty when the line is not an import statement this parser understands.
     */
    public static Optional<ImportStatement> parse(String line) {
        String stripped = line.strip();
        if (stripped.startsWith(IMPORT)) {
            return Optional.of(new ImportStatement(
                    Arrays.asList(stripped.substring(IMPORT.length()).split("\\.", -1))));
        }
        if (stripped.startsWith(FROM)) {
            int pos = stripped.indexOf(FROM_IMPORT, FROM.length());
            if (pos < 0) {
                return Optional.empty();
            }
            List<String> names = new ArrayList<>(
                    Arrays.asList(stripped.substring(FROM.length(), pos).split("\\.", -1)));
            names.add(stripped.substring(pos + FROM_IMPORT.length()));
            return Optional.of(new ImportStatement(names));
        }
        return Optional.empty();
    }

    /**
     * Parse a line the caller knows to be an import statement.
     */
    public static ImportStatement of(String line) {
        return parse(line).orElseThrow(
                () -> new IllegalArgumentException("unable to parse import " + line));
    }

    public boolean isFuture() {
        return !names.isEmpty() && "__future__".equals(names.get(0));
    }

    /**
     * Lexicographic order of the name tuples.
     */
    @Override
    public int compareTo(ImportStatement other) {
        int common = Math.min(names.size(), other.names.size());
        for (int i = 0; i < common; i++) {
            int cmp = names.get(i).compareTo(other.names.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(names.size(), other.names.size());
    }
}
