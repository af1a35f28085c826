package com.vidnyan.sixer.domain.rule;

import java.util.List;

/**
 * One Python 2 idiom and its Python 2/3 compatible replacement.
 *
 * <p>Implementations are stateless. {@link #apply} must be idempotent: applying it to its
 * own output changes nothing.
 */
public interface RewriteRule {

    /**
     * Operation name used on the command line, e.g. {@code iteritems}.
     */
    String name();

    /**
     * One-line description shown in the usage text.
     */
    String description();

    /**
     * Cheap pre-check; {@code false} means {@link #apply} would not change the text.
     */
    boolean detect(String content);

    /**
     * Rewrite the text. Imports the new text relies on are returned, not inserted.
     */
    RewriteResult apply(RewriteContext context);

    /**
     * Report every line still containing the old idiom.
     */
    List<Diagnostic> check(RewriteContext context);
}
