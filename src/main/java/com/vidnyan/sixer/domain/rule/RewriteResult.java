package com.vidnyan.sixer.domain.rule;

import java.util.Collection;
import java.util.List;

/**
 * Rewritten text plus the import lines it now requires, in insertion order.
 */
public record RewriteResult(String content, List<String> requiredImports) {

    public RewriteResult {
        requiredImports = List.copyOf(requiredImports);
    }

    /**
     * Possibly rewritten text that needs no new import.
     */
    public static RewriteResult withoutImports(String content) {
        return new RewriteResult(content, List.of());
    }

    public static RewriteResult of(String content, Collection<String> requiredImports) {
        return new RewriteResult(content, List.copyOf(requiredImports));
    }

    /**
     * Text that needs {@code importLine} only when it differs from the original.
     */
    public static RewriteResult requiringWhenChanged(String original, String content, String importLine) {
        if (content.equals(original)) {
            return withoutImports(original);
        }
        return new RewriteResult(content, List.of(importLine));
    }
}
