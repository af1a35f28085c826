package com.vidnyan.sixer.domain.imports;

import java.util.Set;

/**
 * A run of consecutive import lines. {@code end} includes the blank lines that follow the run.
 */
public record ImportGroup(int start, int end, Set<String> moduleNames) {

    public ImportGroup {
        moduleNames = Set.copyOf(moduleNames);
    }

    /**
     * True for a group made only of {@code from __future__ import ...} lines.
     */
    public boolean isFutureOnly() {
        return moduleNames.equals(Set.of("__future__"));
    }
}
