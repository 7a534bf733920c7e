package com.viffx.Pda.Errors;

import com.viffx.Pda.Symbols.NonTerminal;
import com.viffx.Pda.Symbols.Terminal;

public class NoProductionException extends PdaException {
    private final NonTerminal state;
    private final Terminal lookahead;

    public NoProductionException(NonTerminal state, Terminal lookahead) {
        super("No match " + state.value() + " to " + lookahead.value());
        this.state = state;
        this.lookahead = lookahead;
    }

    public NonTerminal state() {
        return state;
    }

    public Terminal lookahead() {
        return lookahead;
    }
}
