package com.vidnyan.sixer.domain.rule;

/**
 * Input of a rule: the current text of one file and the run settings.
 */
public record RewriteContext(String fileName, String content, RewriteSettings settings) {

    public RewriteContext withContent(String newContent) {
        return new RewriteContext(fileName, newContent, settings);
    }
}
