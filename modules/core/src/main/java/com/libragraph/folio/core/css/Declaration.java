package com.libragraph.folio.core.css;

/**
 * A {@code property: value} pair. Property names are lowercase; values have their
 * whitespace collapsed.
 */
public record Declaration(String property, String value) {

    @Override
    public String toString() {
        return property + ": " + value + ";";
    }
}
