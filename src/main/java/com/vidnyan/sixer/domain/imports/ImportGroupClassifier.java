package com.vidnyan.sixer.domain.imports;

import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the import groups of a source text and tells stdlib, third-party and application
 * groups apart.
 */
@RequiredArgsConstructor
public class ImportGroupClassifier {

    // A run of column-0 import lines, followed by its blank lines.
    private static final Pattern IMPORT_GROUP = Pattern.compile(
            "^(?:import|from) .*\\n(?:(?:import|from) .*\\n)*\\n*", Pattern.MULTILINE);

    private static final Pattern MODULE_NAME = Pattern.compile(
            "^(?:import|from) ([a-zA-Z_][a-zA-Z0-9_]*)", Pattern.MULTILINE);

    private final ModuleTables tables;

    /**
     * Import groups in ascending offset order. Recomputed on each call.
     */
    public List<ImportGroup> parseGroups(String text) {
        List<ImportGroup> groups = new ArrayList<>();
        Matcher matcher = IMPORT_GROUP.matcher(text);
        while (matcher.find()) {
            Set<String> names = new LinkedHashSet<>();
            Matcher moduleMatcher = MODULE_NAME.matcher(matcher.group());
            while (moduleMatcher.find()) {
                names.add(moduleMatcher.group(1));
            }
            groups.add(new ImportGroup(matcher.start(), matcher.end(), names));
        }
        return groups;
    }

    public ModuleClassification classify(ImportGroup group) {
        if (group.isFutureOnly()) {
            return ModuleClassification.FUTURE;
        }
        Set<String> names = group.moduleNames();
        if (names.stream().anyMatch(tables::isThirdParty)) {
            return ModuleClassification.THIRD_PARTY;
        }
        if (names.stream().anyMatch(tables::isApplication)) {
            return ModuleClassification.APPLICATION;
        }
        if (names.stream().anyMatch(tables::isStdlib)) {
            return ModuleClassification.STDLIB;
        }
        return ModuleClassification.UNKNOWN;
    }
}
