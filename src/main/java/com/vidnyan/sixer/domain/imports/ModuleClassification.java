package com.vidnyan.sixer.domain.imports;

/**
 * Semantic kind of an import group.
 */
public enum ModuleClassification {
    FUTURE,
    STDLIB,
    THIRD_PARTY,
    APPLICATION,
    UNKNOWN
}
