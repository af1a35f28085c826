package com.vidnyan.sixer.domain.imports;

import com.vidnyan.sixer.domain.RewriteException;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * No import group of the file could be identified as the place for a new import.
 */
public class AmbiguousPlacementException extends RewriteException {

    private final String importLine;
    private final List<ImportGroup> groups;

    public AmbiguousPlacementException(String importLine, List<ImportGroup> groups) {
        super(String.format("Unable to locate the import group of third-party modules to add '%s' in %s. "
                + "Use the --app and --third-party options.", importLine, describe(groups)));
        this.importLine = importLine;
        this.groups = List.copyOf(groups);
    }

    public String getImportLine() {
        return importLine;
    }

    public List<ImportGroup> getGroups() {
        return groups;
    }

    private static String describe(List<ImportGroup> groups) {
        return groups.stream()
                .map(ImportGroup::moduleNames)
                .map(Set::toString)
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
