package com.viffx.Pda.Symbols;

/**
 * The empty production. Expands to nothing and consumes no input.
 */
public enum Epsilon implements Symbol {
    EPSILON;

    @Override
    public String value() {
        return "";
    }

    @Override
    public String toString() {
        return "ε";
    }
}
