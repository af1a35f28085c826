package com.vidnyan.sixer.domain.rule;

import java.util.Collection;

/**
 * An operation name that no rule answers to.
 */
public class UnknownRuleException extends RuntimeException {

    private final String ruleName;

    public UnknownRuleException(String ruleName, Collection<String> knownNames) {
        super(String.format("invalid operation: %s (valid operations: %s)",
                ruleName, String.join(", ", knownNames)));
        this.ruleName = ruleName;
    }

    public String getRuleName() {
        return ruleName;
    }
}
