package com.vidnyan.sixer.domain;

/**
 * A rewrite that cannot be completed without guessing.
 * Fatal for the file being patched; the file is left unmodified.
 */
public abstract class RewriteException extends RuntimeException {

    protected RewriteException(String message) {
        super(message);
    }
}
