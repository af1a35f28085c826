package com.vidnyan.sixer.domain.rule;

import com.vidnyan.sixer.domain.RewriteException;

/**
 * A symbol of a split module whose new location is unknown.
 */
public class UnknownSymbolException extends RewriteException {

    private final String symbol;

    public UnknownSymbolException(String module, String symbol) {
        super("Unknown " + module + " symbol: " + symbol);
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
