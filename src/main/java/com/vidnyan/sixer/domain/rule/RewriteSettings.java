package com.vidnyan.sixer.domain.rule;

import com.vidnyan.sixer.domain.imports.ModuleTables;

/**
 * Configuration shared by every rule of a run.
 *
 * @param maxRange     largest {@code xrange} span rewritten to a plain {@code range} call
 * @param moduleTables tables used to place new imports
 */
public record RewriteSettings(int maxRange, ModuleTables moduleTables) {

    public static final int DEFAULT_MAX_RANGE = 1024;

    public static RewriteSettings defaults() {
        return new RewriteSettings(DEFAULT_MAX_RANGE, ModuleTables.defaults());
    }
}
