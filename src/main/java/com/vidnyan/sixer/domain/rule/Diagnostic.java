package com.vidnyan.sixer.domain.rule;

/**
 * A line where an idiom survived the rewrite. Informational only.
 */
public record Diagnostic(String ruleName, String file, String line) {

    public Diagnostic {
        line = line.strip();
    }

    @Override
    public String toString() {
        return String.format("WARNING: [%s] %s: %s", ruleName, file, line);
    }
}
