package com.viffx.Pda.Errors;

public class UnknownInputSymbolException extends PdaException {
    private final char symbol;
    private final int position;

    public UnknownInputSymbolException(char symbol, int position) {
        super("Unknown input symbol '" + symbol + "' at position " + position);
        this.symbol = symbol;
        this.position = position;
    }

    public char symbol() {
        return symbol;
    }

    public int position() {
        return position;
    }
}
