package com.viffx.Pda.Symbols;

public enum NonTerminal implements Symbol {
    A, // expression
    D, // expression tail
    B, // term
    E, // term tail
    C; // factor

    public static final NonTerminal START = A;

    @Override
    public String value() {
        return "<" + name() + ">";
    }

    @Override
    public String toString() {
        return value();
    }
}
