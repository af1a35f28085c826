package com.vidnyan.sixer.domain.rule;

import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Result of patching one file.
 */
public record PatchOutcome(
        boolean changed,
        SortedSet<String> appliedRules,
        String content,
        List<Diagnostic> diagnostics) {

    public PatchOutcome {
        appliedRules = Collections.unmodifiableSortedSet(new TreeSet<>(appliedRules));
        diagnostics = List.copyOf(diagnostics);
    }
}
