package com.vidnyan.sixer.domain.imports;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Adds import lines to a source text while keeping the stdlib / third-party / application
 * grouping convention.
 *
 * <p>A new import goes into the third-party group when one can be found. Otherwise a new
 * group is created before the application imports or after the stdlib imports. When no
 * group can be classified, {@link AmbiguousPlacementException} is thrown instead of guessing.
 */
@Slf4j
public class ImportPlanner {

    private static final Pattern TRAILING_COMMENT = Pattern.compile("\\s*#.*$");

    private final ImportGroupClassifier classifier;

    public ImportPlanner(ModuleTables tables) {
        this(new ImportGroupClassifier(tables));
    }

    public ImportPlanner(ImportGroupClassifier classifier) {
        this.classifier = classifier;
    }

    /**
     * Add each line in order.
     */
    public String addImports(String text, List<String> lines) {
        String result = text;
        for (String line : lines) {
            result = addImport(result, line);
        }
        return result;
    }

    /**
     * Add {@code line} unless the text already contains it.
     *
     * @throws AmbiguousPlacementException if no group can host the import
     */
    public String addImport(String text, String line) {
        String importLine = line.strip();
        if (containsImport(text, importLine)) {
            return text;
        }
        ImportStatement statement = ImportStatement.of(importLine);
        String newLine = importLine + "\n";

        List<ImportGroup> groups = classifier.parseGroups(text);
        if (groups.isEmpty()) {
            return text.isEmpty() ? newLine : newLine + "\n\n" + text;
        }

        ImportGroup first = groups.get(0);
        if (statement.isFuture()) {
            if (first.isFutureOnly()) {
                return insertIntoGroup(text, first, newLine, statement);
            }
            return insertNewGroup(text, first.start(), newLine, false);
        }

        List<ImportGroup> candidates = first.isFutureOnly() ? groups.subList(1, groups.size()) : groups;
        if (candidates.isEmpty()) {
            return insertNewGroup(text, first.end(), newLine, true);
        }
        if (candidates.size() == 3) {
            log.debug("Three import groups, adding '{}' to the middle one", importLine);
            return insertIntoGroup(text, candidates.get(1), newLine, statement);
        }

        ImportGroup lastStdlib = null;
        for (ImportGroup group : candidates) {
            ModuleClassification classification = classifier.classify(group);
            if (classification == ModuleClassification.THIRD_PARTY) {
                return insertIntoGroup(text, group, newLine, statement);
            }
            if (classification == ModuleClassification.APPLICATION) {
                return insertNewGroup(text, group.start(), newLine, false);
            }
            if (classification == ModuleClassification.STDLIB) {
                lastStdlib = group;
            }
        }
        if (lastStdlib != null) {
            boolean lastGroup = lastStdlib.equals(candidates.get(candidates.size() - 1));
            return insertNewGroup(text, lastStdlib.end(), newLine, lastGroup);
        }
        throw new AmbiguousPlacementException(importLine, candidates);
    }

    /**
     * True when a column-0 line equal to {@code importLine} exists, ignoring trailing
     * whitespace and a trailing comment.
     */
    public static boolean containsImport(String text, String importLine) {
        String expected = importLine.strip();
        for (String existing : text.split("\n", -1)) {
            if (!existing.startsWith(expected)) {
                continue;
            }
            String cleaned = TRAILING_COMMENT.matcher(existing).replaceFirst("").stripTrailing();
            if (cleaned.equals(expected)) {
                return true;
            }
        }
        return false;
    }

    private String insertIntoGroup(String text, ImportGroup group, String newLine, ImportStatement statement) {
        int pos = group.start();
        while (pos < group.end()) {
            int eol = text.indexOf('\n', pos);
            String line = text.substring(pos, eol < 0 ? text.length() : eol + 1);
            if (line.equals("\n")) {
                break;
            }
            boolean sortsAfter = ImportStatement.parse(line)
                    .map(existing -> statement.compareTo(existing) < 0)
                    .orElse(false);
            if (sortsAfter) {
                break;
            }
            pos += line.length();
        }
        return text.substring(0, pos) + newLine + text.substring(pos);
    }

    private String insertNewGroup(String text, int pos, String newLine, boolean lastGroup) {
        String before = text.substring(0, pos);
        String separator = before.isEmpty() || before.endsWith("\n\n") ? "" : "\n";
        String after = lastGroup ? "\n\n" : "\n";
        return before + separator + newLine + after + text.substring(pos);
    }
}
