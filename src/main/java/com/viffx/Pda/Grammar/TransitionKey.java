package com.viffx.Pda.Grammar;

import com.viffx.Pda.Symbols.NonTerminal;
import com.viffx.Pda.Symbols.Terminal;

import java.util.Objects;

/**
 * A cell of the jump table: the nonterminal on top of the stack paired with one terminal of lookahead.
 */
public record TransitionKey(NonTerminal state, Terminal lookahead) {
    public TransitionKey {
        Objects.requireNonNull(state, "state cannot be null");
        Objects.requireNonNull(lookahead, "lookahead cannot be null");
    }

    @Override
    public String toString() {
        return state.value() + " " + lookahead.value();
    }
}
