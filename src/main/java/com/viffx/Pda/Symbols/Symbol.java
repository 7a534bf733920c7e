package com.viffx.Pda.Symbols;

/**
 * Anything that can sit on the automaton's stack or appear on the right hand side of a production.
 */
public sealed interface Symbol permits Terminal, NonTerminal, Epsilon {
    /**
     * The text this symbol contributes to a trace line.
     */
    String value();
}
